package test.alipsa.halsls.hals;

import org.junit.jupiter.api.Test;
import se.alipsa.halsls.core.model.Diagnostic;
import se.alipsa.halsls.core.server.CoreServer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HalsPluginSmokeTest {

  @Test
  void openFile_indexesWithoutDiagnostics() throws Exception {
    Path dir = Files.createTempDirectory("halsls-smoke");
    Path file = dir.resolve("nav.hal");
    String code = """
         SHUTTLE_NAV: PROGRAM;
         DECLARE ALTITUDE SCALAR;
         ALTITUDE = 0;
         CLOSE SHUTTLE_NAV;
        """;
    Files.writeString(file, code, StandardCharsets.UTF_8);
    String uri = file.toUri().toString();

    List<List<Diagnostic>> published = new ArrayList<>();
    try (CoreServer server = CoreServer.createDefault((u, diags) -> published.add(diags))) {
      assertTrue(server.plugins().byId("hals").isPresent(), "HAL/S plugin should be discovered");

      List<Diagnostic> diags = server.openFile(uri, code);
      assertTrue(diags.isEmpty(), "HAL/S analysis reports no problems");
      assertEquals(1, published.size());
      assertTrue(published.get(0).isEmpty());
      assertEquals(2, server.documentSymbols(uri).size());
    }
  }

  @Test
  void both_extensions_are_claimed() {
    try (CoreServer server = CoreServer.createDefault((u, d) -> { })) {
      server.openFile("mem://a.hal", " DECLARE A SCALAR;");
      server.openFile("mem://b.HALS", " DECLARE B SCALAR;");
      assertEquals(1, server.documentSymbols("mem://a.hal").size());
      assertEquals(1, server.documentSymbols("mem://b.HALS").size());
    }
  }

  @Test
  void other_files_are_not_analyzed() {
    try (CoreServer server = CoreServer.createDefault((u, d) -> { })) {
      List<Diagnostic> diags = server.openFile("mem://notes.txt", " DECLARE A SCALAR;");
      assertEquals(1, diags.size());
      assertEquals("no-plugin", diags.get(0).getCode());
      assertTrue(server.documentSymbols("mem://notes.txt").isEmpty());
    }
  }
}
