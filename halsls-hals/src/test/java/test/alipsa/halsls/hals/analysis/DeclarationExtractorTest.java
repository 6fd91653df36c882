package test.alipsa.halsls.hals.analysis;

import org.junit.jupiter.api.Test;
import se.alipsa.halsls.hals.analysis.DeclarationExtractor;
import se.alipsa.halsls.hals.model.Symbol;
import se.alipsa.halsls.hals.model.SymbolKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeclarationExtractorTest {

  private static Map<String, Symbol> extract(String text) {
    return extract(text, 20);
  }

  private static Map<String, Symbol> extract(String text, int lookahead) {
    Map<String, Symbol> table = new LinkedHashMap<>();
    new DeclarationExtractor(lookahead).extract(text, table);
    return table;
  }

  @Test
  void program_units_get_their_kinds_and_types() {
    String code = """
         SHUTTLE_NAV: PROGRAM;
         GUIDE: PROCEDURE(ALT, VEL);
         THRUST: SCALAR FUNCTION(MASS);
         COUNT_IT: INTEGER FUNCTION;
         NAV_TASK: TASK;
         SHARED: COMPOOL;
        """;
    Map<String, Symbol> t = extract(code);

    assertEquals(List.of("SHUTTLE_NAV", "GUIDE", "THRUST", "COUNT_IT", "NAV_TASK", "SHARED"), List.copyOf(t.keySet()));

    Symbol program = t.get("SHUTTLE_NAV");
    assertEquals(SymbolKind.PROGRAM, program.getKind());
    assertEquals("PROGRAM", program.getDataType());
    assertEquals("HAL/S Program unit", program.getDocumentation());
    assertEquals(0, program.getLine());
    assertEquals(1, program.getColumn());
    assertEquals(0, program.getEndLine());
    assertEquals(22, program.getEndColumn());

    Symbol guide = t.get("GUIDE");
    assertEquals(SymbolKind.PROCEDURE, guide.getKind());
    assertEquals(List.of("ALT", "VEL"), guide.getParameters());
    assertEquals("Procedure with 2 parameters", guide.getDocumentation());

    Symbol thrust = t.get("THRUST");
    assertEquals(SymbolKind.FUNCTION, thrust.getKind());
    assertEquals("SCALAR FUNCTION", thrust.getDataType());
    assertEquals(List.of("MASS"), thrust.getParameters());

    Symbol count = t.get("COUNT_IT");
    assertEquals("INTEGER FUNCTION", count.getDataType());
    assertEquals("Function returning INTEGER", count.getDocumentation());
    assertTrue(count.getParameters().isEmpty());

    assertEquals(SymbolKind.TASK, t.get("NAV_TASK").getKind());
    assertEquals("Real-time task (schedulable process)", t.get("NAV_TASK").getDocumentation());
    assertEquals(SymbolKind.COMPOOL, t.get("SHARED").getKind());
    assertEquals("Communication pool (shared data)", t.get("SHARED").getDocumentation());
  }

  @Test
  void function_without_return_type_returns_scalar() {
    Symbol f = extract(" F: FUNCTION();").get("F");
    assertEquals("SCALAR FUNCTION", f.getDataType());
    assertEquals("Function returning SCALAR", f.getDocumentation());
    assertTrue(f.getParameters().isEmpty());
  }

  @Test
  void procedure_without_parameters_is_plain_procedure() {
    Symbol p = extract(" CHECK: PROCEDURE;").get("CHECK");
    assertEquals("Procedure", p.getDocumentation());
    assertTrue(p.getParameters().isEmpty());
  }

  @Test
  void parameter_list_may_span_lines() {
    Symbol p = extract(" P: PROCEDURE(A,\n B);").get("P");
    assertEquals(List.of("A", "B"), p.getParameters());
    assertEquals(0, p.getLine());
    assertEquals(1, p.getEndLine());
    assertEquals(4, p.getEndColumn());
  }

  @Test
  void declarations_of_every_shape() {
    String code = """
         DECLARE ALTITUDE SCALAR INITIAL(0.0);
         DECLARE LIFTOFF EVENT;
         DECLARE SENSOR_DATA ARRAY(3, 4) INTEGER;
         DECLARE PI CONSTANT(3.14159);
         DECLARE VELOCITY VECTOR(3);
         DECLARE ATTITUDE MATRIX(3, 3);
         DECLARE STATE STRUCTURE;
         REPLACE LIMIT BY "100";
        """;
    Map<String, Symbol> t = extract(code);

    Symbol alt = t.get("ALTITUDE");
    assertEquals(SymbolKind.VARIABLE, alt.getKind());
    assertEquals("SCALAR", alt.getDataType());
    assertEquals("SCALAR variable", alt.getDocumentation());
    assertEquals(1, alt.getColumn(), "position is that of the DECLARE keyword");

    assertEquals("EVENT", t.get("LIFTOFF").getDataType());

    Symbol data = t.get("SENSOR_DATA");
    assertEquals("ARRAY(3, 4) INTEGER", data.getDataType());
    assertEquals(List.of("3", "4"), data.getDimensions());
    assertEquals("Array of INTEGER with dimensions (3, 4)", data.getDocumentation());

    Symbol pi = t.get("PI");
    assertEquals(SymbolKind.CONSTANT, pi.getKind());
    assertEquals("Constant = 3.14159", pi.getDocumentation());

    Symbol vel = t.get("VELOCITY");
    assertEquals("VECTOR(3)", vel.getDataType());
    assertEquals(List.of("3"), vel.getDimensions());
    assertEquals("Vector of 3 elements", vel.getDocumentation());

    Symbol att = t.get("ATTITUDE");
    assertEquals("MATRIX(3,3)", att.getDataType());
    assertEquals(List.of("3", "3"), att.getDimensions());
    assertEquals("Matrix of 3x3 elements", att.getDocumentation());

    assertEquals(SymbolKind.STRUCTURE, t.get("STATE").getKind());
    assertEquals("Structure type", t.get("STATE").getDocumentation());

    Symbol limit = t.get("LIMIT");
    assertEquals(SymbolKind.REPLACE, limit.getKind());
    assertEquals("Macro expanding to: 100", limit.getDocumentation());
    assertEquals(7, limit.getLine());
  }

  @Test
  void names_are_upper_cased() {
    Map<String, Symbol> t = extract(" declare velocity vector(3);");
    assertTrue(t.containsKey("VELOCITY"));
    assertEquals("VECTOR(3)", t.get("VELOCITY").getDataType());
  }

  @Test
  void later_pass_wins_regardless_of_text_order() {
    Map<String, Symbol> t = extract(" REPLACE LIMIT BY \"10\";\n DECLARE LIMIT CONSTANT(5);");
    assertEquals(1, t.size());
    assertEquals(SymbolKind.REPLACE, t.get("LIMIT").getKind());
    assertEquals(0, t.get("LIMIT").getLine());
  }

  @Test
  void within_one_pass_the_last_match_wins() {
    Symbol a = extract(" DECLARE A SCALAR;\n DECLARE A INTEGER;").get("A");
    assertEquals("INTEGER", a.getDataType());
    assertEquals(1, a.getLine());
  }

  @Test
  void overwriting_keeps_first_insertion_order() {
    Map<String, Symbol> t = extract(" DECLARE B SCALAR;\n DECLARE A SCALAR;\n REPLACE B BY \"X\";");
    assertEquals(List.of("B", "A"), List.copyOf(t.keySet()));
    assertEquals(SymbolKind.REPLACE, t.get("B").getKind());
  }

  @Test
  void labels_are_found_and_never_override() {
    String code = """
         NAV_LOOP:
         DO WHILE TRUE;
         GO TO NAV_LOOP;
         DECLARE STEP SCALAR;
         STEP: STEP = STEP + 1;
        """;
    Map<String, Symbol> t = extract(code);

    Symbol loop = t.get("NAV_LOOP");
    assertEquals(SymbolKind.LABEL, loop.getKind());
    assertEquals("LABEL", loop.getDataType());
    assertEquals("Statement label (GO TO target)", loop.getDocumentation());
    assertEquals(0, loop.getLine());
    assertEquals(1, loop.getColumn());

    assertEquals(SymbolKind.VARIABLE, t.get("STEP").getKind());
  }

  @Test
  void first_label_occurrence_wins() {
    Symbol l1 = extract(" L1: A = 1;\n L1: B = 2;").get("L1");
    assertEquals(0, l1.getLine());
  }

  @Test
  void colon_followed_by_unit_keyword_is_not_a_label() {
    assertTrue(extract(" X:\n   PROCEDURE(A").isEmpty());
  }

  @Test
  void lookahead_window_bounds_the_unit_keyword_search() {
    String within = "X:" + " ".repeat(13) + "PROGRAM";
    String beyond = "X:" + " ".repeat(14) + "PROGRAM";

    assertTrue(extract(within).isEmpty());
    assertEquals(SymbolKind.LABEL, extract(beyond).get("X").getKind());
    assertTrue(extract(beyond, 30).isEmpty());
  }

  @Test
  void lookahead_must_be_positive() {
    assertThrows(IllegalArgumentException.class, () -> new DeclarationExtractor(0));
  }

  @Test
  void plain_statements_declare_nothing() {
    assertTrue(extract(" A = B + C;\n CALL GUIDE(A);").isEmpty());
  }
}
