package test.alipsa.halsls.hals.analysis;

import org.junit.jupiter.api.Test;
import se.alipsa.halsls.hals.analysis.ReferenceCollector;
import se.alipsa.halsls.hals.model.Reference;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceCollectorTest {

  private static List<Reference> collect(String text) {
    List<Reference> out = new ArrayList<>();
    new ReferenceCollector().collect(text, out);
    return out;
  }

  @Test
  void records_every_non_keyword_identifier_in_text_order() {
    List<Reference> refs = collect(" DECLARE ALT SCALAR;\n alt = ALT + Delta;");

    assertEquals(List.of(
        new Reference("ALT", 0, 9, 12, "DECLARE ALT SCALAR;"),
        new Reference("ALT", 1, 1, 4, "alt = ALT + Delta;"),
        new Reference("ALT", 1, 7, 10, "alt = ALT + Delta;"),
        new Reference("DELTA", 1, 13, 18, "alt = ALT + Delta;")
    ), refs);
  }

  @Test
  void keywords_and_numbers_are_skipped() {
    List<Reference> refs = collect(" IF X1 > 42 THEN GO TO DONE;");
    assertEquals(List.of("X1", "DONE"), refs.stream().map(Reference::getName).toList());
  }

  @Test
  void undeclared_names_are_recorded_too() {
    List<Reference> refs = collect(" CALL GUIDE(THRUST);");
    assertEquals(List.of("CALL", "GUIDE", "THRUST"), refs.stream().map(Reference::getName).toList());
  }

  @Test
  void empty_text_has_no_references() {
    assertTrue(collect("").isEmpty());
    assertTrue(collect(";\n\n").isEmpty());
  }
}
