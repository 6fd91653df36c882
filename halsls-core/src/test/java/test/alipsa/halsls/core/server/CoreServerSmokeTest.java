package test.alipsa.halsls.core.server;

import org.junit.jupiter.api.Test;
import se.alipsa.halsls.core.server.CoreServer;   // from main module
import se.alipsa.halsls.core.model.Diagnostic;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoreServerSmokeTest {

  @Test
  void openFile_publishesDiagnostics() {
    List<String> published = new ArrayList<>();
    try (CoreServer server = CoreServer.createDefault((uri, diags) -> {
      printDiagnostics(uri, diags);
      published.add(uri + ":" + diags.size());
    })) {
      List<Diagnostic> diags = server.openFile("mem://empty.tdl", "nothing here\n");
      assertEquals(1, diags.size());
      assertEquals(Diagnostic.Severity.WARNING, diags.get(0).getSeverity());
      assertEquals("empty", diags.get(0).getCode());

      server.closeFile("mem://empty.tdl");
      assertEquals(List.of("mem://empty.tdl:1", "mem://empty.tdl:0"), published,
          "close should publish an empty list to clear diagnostics");
    }
  }

  @Test
  void unclaimedFile_getsNoPluginInfo() {
    try (CoreServer server = CoreServer.createDefault(null)) {
      List<Diagnostic> diags = server.openFile("mem://notes.txt", "declare x");
      assertEquals(1, diags.size());
      assertEquals(Diagnostic.Severity.INFORMATION, diags.get(0).getSeverity());
      assertEquals("no-plugin", diags.get(0).getCode());
      assertTrue(server.completions("mem://notes.txt", new se.alipsa.halsls.core.model.Position(0, 0)).isEmpty());
    }
  }

  @Test
  void pluginException_becomesErrorDiagnostic() {
    try (CoreServer server = CoreServer.createDefault(null)) {
      List<Diagnostic> diags = server.openFile("mem://bad.tdl", "declare boom");
      assertEquals(1, diags.size());
      assertEquals(Diagnostic.Severity.ERROR, diags.get(0).getSeverity());
      assertEquals("plugin-exception", diags.get(0).getCode());
      assertTrue(diags.get(0).getMessage().contains("boom"));
    }
  }

  @Test
  void analyze_unknownUri_returnsNothing() {
    try (CoreServer server = CoreServer.createDefault(null)) {
      assertTrue(server.analyze("mem://never-opened.tdl").isEmpty());
    }
  }

  private static void printDiagnostics(String uri, List<Diagnostic> diagnostics) {
    System.out.println("=== Diagnostics for " + uri + " ===");
    if (diagnostics == null || diagnostics.isEmpty()) {
      System.out.println("(none)");
      return;
    }
    for (Diagnostic d : diagnostics) {
      var r = d.getRange();
      System.out.printf("[%s] %s:%d:%d-%d:%d %s (source=%s, code=%s)%n",
          d.getSeverity(), uri, r.start.line, r.start.column, r.end.line, r.end.column,
          d.getMessage(), d.getSource(), d.getCode());
    }
  }
}
