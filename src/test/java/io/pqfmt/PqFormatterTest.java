package io.pqfmt;

import static org.junit.jupiter.api.Assertions.*;

import io.pqfmt.ast.Document;
import io.pqfmt.ast.LetExpr;
import io.pqfmt.format.FormatConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the public entry points. */
public class PqFormatterTest {

  @Test
  void testFormatUsesDefaults() throws PqfmtException {
    assertEquals(
        PqFormatter.format("let x = 1 in x", FormatConfig.defaults()),
        PqFormatter.format("let x = 1 in x"));
  }

  @Test
  void testParseReturnsDocument() throws PqfmtException {
    Document document = PqFormatter.parse("let x = 1 in x");
    assertInstanceOf(LetExpr.class, document.expression().kind());
  }

  @Test
  void testValidateValidInput() {
    assertTrue(PqFormatter.validate("let x = 1 in x").isEmpty());
    assertTrue(PqFormatter.isValid("Table.SelectRows(Source, each [A] > 1)"));
  }

  @Test
  void testValidateReportsLocation() {
    List<Diagnostic> problems = PqFormatter.validate("[A = 1");
    assertEquals(1, problems.size());
    Diagnostic problem = problems.get(0);
    assertEquals(1, problem.line());
    assertEquals(7, problem.column());
    assertEquals("Line 1: Expected ']', found end of input", problem.toString());
    assertFalse(PqFormatter.isValid("[A = 1"));
  }

  @Test
  void testErrorKinds() {
    PqfmtException parse =
        assertThrows(PqfmtException.class, () -> PqFormatter.format("let x = in x"));
    assertEquals(ErrorKind.PARSE, parse.kind());

    PqfmtException lex =
        assertThrows(PqfmtException.class, () -> PqFormatter.format("x & \"abc"));
    assertEquals(ErrorKind.LEX, lex.kind());
    assertEquals(lex.diagnostic(), lex.diagnostics().get(0));
  }

  @Test
  void testDisplayRich() {
    PqfmtException e = assertThrows(PqfmtException.class, () -> PqFormatter.parse("[A = 1"));
    assertEquals(
        "error: Expected ']', found end of input\n"
            + "  --> line 1, column 7\n"
            + "  [A = 1\n"
            + "        ^",
        e.displayRich());
    assertEquals("[A = 1", e.input());
    assertEquals(e.diagnostic().span(), e.span());
  }

  @Test
  void testDisplayRichOnLaterLine() {
    PqfmtException e =
        assertThrows(PqfmtException.class, () -> PqFormatter.parse("let\n  x = 1\n  y = 2\nin x"));
    assertTrue(e.displayRich().contains("\n    y = 2\n"), e.displayRich());
    assertEquals(3, e.diagnostic().line());
  }

  @Test
  void testNullConfigRejected() {
    assertThrows(NullPointerException.class, () -> PqFormatter.format("1", null));
  }
}
