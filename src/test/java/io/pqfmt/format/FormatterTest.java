package io.pqfmt.format;

import static org.junit.jupiter.api.Assertions.*;

import io.pqfmt.PqFormatter;
import io.pqfmt.PqfmtException;
import io.pqfmt.Span;
import io.pqfmt.ast.*;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for the formatter. */
public class FormatterTest {
  private static final Span NOWHERE = new Span(0, 0, 1, 1);

  private static String format(String input) throws PqfmtException {
    return PqFormatter.format(input);
  }

  private static String format(String input, FormatConfig config) throws PqfmtException {
    return PqFormatter.format(input, config);
  }

  private static Expr num(double value) {
    return Expr.of(new NumberLiteral(value), NOWHERE);
  }

  private static Expr binary(Expr left, BinaryOp op, Expr right) {
    return Expr.of(new BinaryExpr(left, op, right), NOWHERE);
  }

  private static String render(Expr expr) {
    return Formatter.format(new Document(expr, NOWHERE), FormatConfig.defaults());
  }

  // Let

  @Test
  void testLetExpandsByDefault() throws PqfmtException {
    assertEquals("let\n    x = 1,\n    y = 2\nin\n    x + y\n", format("let x=1,y=2 in x+y"));
  }

  @Test
  void testCompactLetStaysOnOneLine() throws PqfmtException {
    assertEquals(
        "let x = 1, y = 2 in x + y\n",
        format("let x = 1, y = 2 in x + y", FormatConfig.compact()));
  }

  @Test
  void testComplexBindingMovesToNextLine() throws PqfmtException {
    assertEquals(
        "let\n"
            + "    Source =\n"
            + "        [\n"
            + "            A = 1,\n"
            + "            B = 2\n"
            + "        ]\n"
            + "in\n"
            + "    Source\n",
        format("let Source = [A = 1, B = 2] in Source"));
  }

  @Test
  void testFunctionBindingStaysInline() throws PqfmtException {
    assertEquals("let\n    f = (x) => x\nin\n    f\n", format("let f = (x) => x in f"));
  }

  @Test
  void testCommentsArePreserved() throws PqfmtException {
    String input = "let\n    // first\n    a = 1, // after a\n    b = 2\nin\n    a + b";
    assertEquals(input + "\n", format(input));
  }

  @Test
  void testTrailingCommentMovesAfterComma() throws PqfmtException {
    assertEquals(
        "let\n    a = 1, // one\n    b = 2\nin\n    b\n",
        format("let a = 1 // one\n, b = 2 in b"));
  }

  @Test
  void testLineCommentGetsSpace() throws PqfmtException {
    assertEquals("// note\n1\n", format("//note\n1"));
  }

  @Test
  void testDocumentComments() throws PqfmtException {
    assertEquals("// head\n1 // tail\n", format("// head\n1 // tail"));
    assertEquals("/* a */ 1 /* b */\n", format("/* a */ 1 /* b */"));
  }

  @Test
  void testLetBodyComment() throws PqfmtException {
    assertEquals(
        "let\n    a = 1\nin\n    // result\n    a\n",
        format("let a = 1 in // result\n a", FormatConfig.compact()));
  }

  // If

  @Test
  void testShortIfStaysOnOneLine() throws PqfmtException {
    assertEquals("if a then 1 else 2\n", format("if a   then 1\nelse 2"));
  }

  @Test
  void testComplexIfExpands() throws PqfmtException {
    assertEquals(
        "if a then\n    let\n        x = 1\n    in\n        x\nelse\n    2\n",
        format("if a then let x = 1 in x else 2"));
  }

  @Test
  void testElseIfChain() throws PqfmtException {
    assertEquals(
        "if a then\n    let\n        x = 1\n    in\n        x\nelse if b then 2 else 3\n",
        format("if a then let x = 1 in x else if b then 2 else 3"));
  }

  // Functions

  @Test
  void testSimpleFunction() throws PqfmtException {
    assertEquals("(x) => x + 1\n", format("(x)=>x+1"));
    assertEquals(
        "(x as number, optional y as nullable text) as text => y\n",
        format("( x as number , optional y as nullable text ) as text=>y"));
  }

  @Test
  void testTopLevelFunctionWithLetBody() throws PqfmtException {
    assertEquals("(x) =>\nlet\n    y = x\nin\n    y\n", format("(x) => let y = x in y"));
  }

  @Test
  void testCompactFunctionWithLetBody() throws PqfmtException {
    assertEquals(
        "(x) => let y = x in y\n", format("(x)=>let y=x in y", FormatConfig.compact()));
  }

  @Test
  void testFunctionWithComplexBody() throws PqfmtException {
    assertEquals(
        "(x) =>\n    if x then 1 else 2\n", format("(x) => if x then 1 else 2"));
  }

  // Calls, records and lists

  @Test
  void testCallWithEachExpands() throws PqfmtException {
    assertEquals(
        "Table.SelectRows(\n    Source,\n    each _[Value] > 100\n)\n",
        format("Table.SelectRows(Source, each [Value] > 100)"));
  }

  @Test
  void testSimpleCallsStayInline() throws PqfmtException {
    assertEquals("Text.Upper(\"abc\")\n", format("Text.Upper( \"abc\" )"));
    assertEquals("f(1, 2)\n", format("f(1,2)"));
    assertEquals("f()\n", format("f( )"));
  }

  @Test
  void testLongCallWraps() throws PqfmtException {
    assertEquals(
        "f(\n    aaaaaaaaaa,\n    bbbbbbbbbb\n)\n",
        format("f(aaaaaaaaaa, bbbbbbbbbb)", FormatConfig.compact().withMaxLineLength(20)));
  }

  @Test
  void testRecords() throws PqfmtException {
    assertEquals("[\n    A = 1,\n    B = 2\n]\n", format("[A=1,B=2]"));
    assertEquals("[A = 1]\n", format("[A=1]"));
    assertEquals("[]\n", format("[ ]"));
  }

  @Test
  void testRecordFieldComments() throws PqfmtException {
    String input = "[\n    // lead\n    A = 1,  // tail\n    B = 2\n]";
    assertEquals(input + "\n", format(input));
  }

  @Test
  void testLists() throws PqfmtException {
    assertEquals("{1, 2, 3}\n", format("{1,2,3}"));
    assertEquals("{}\n", format("{ }"));
    assertEquals("{1..3}\n", format("{1 .. 3}"));
    assertEquals("{\n    [A = 1],\n    [B = 2]\n}\n", format("{[A=1],[B=2]}"));
  }

  @Test
  void testAccessors() throws PqfmtException {
    assertEquals("each _[Unit Price] * 2\n", format("each [Unit Price] * 2"));
    assertEquals("x[[A], [B]]?\n", format("x[[A],[B]]?"));
    assertEquals("Source{0}[Content]\n", format("Source{0}[Content]"));
    assertEquals("x{0}?\n", format("x {0}?"));
  }

  // Operators and literals

  @Test
  void testPrecedenceRoundTrips() throws PqfmtException {
    assertEquals("1 + 2 * 3\n", format("1+2*3"));
    assertEquals("(1 + 2) * 3\n", format("(1+2)*3"));
    assertEquals("not a and -b\n", format("not a and -b"));
    assertEquals("x meta [A = 1]\n", format("x meta [A=1]"));
    assertEquals("a ?? b\n", format("a??b"));
  }

  @Test
  void testParenthesesAddedForLooserChild() {
    Expr sum = binary(num(1), BinaryOp.ADD, num(2));
    assertEquals("(1 + 2) * 3\n", render(binary(sum, BinaryOp.MULTIPLY, num(3))));
  }

  @Test
  void testParenthesesAddedForEqualRightChild() {
    Expr right = binary(num(2), BinaryOp.SUBTRACT, num(3));
    assertEquals("1 - (2 - 3)\n", render(binary(num(1), BinaryOp.SUBTRACT, right)));
    Expr left = binary(num(1), BinaryOp.SUBTRACT, num(2));
    assertEquals("1 - 2 - 3\n", render(binary(left, BinaryOp.SUBTRACT, num(3))));
  }

  @Test
  void testNegatedSumIsParenthesized() {
    Expr sum = binary(num(1), BinaryOp.ADD, num(2));
    assertEquals("-(1 + 2)\n", render(Expr.of(new UnaryExpr(UnaryOp.NEGATE, sum), NOWHERE)));
  }

  @Test
  void testNumbers() throws PqfmtException {
    assertEquals("1.5\n", format("1.50"));
    assertEquals("16\n", format("0x10"));
    assertEquals("0.1\n", format("0.1"));
    assertEquals("0.0000001\n", format("1e-7"));
    assertEquals("100000000000000000000\n", format("1e20"));
    assertEquals("#infinity\n", format("#infinity"));
    assertEquals("-#infinity\n", format("-#infinity"));
    assertEquals("#nan\n", format("#nan"));
  }

  @Test
  void testNegativeInfinityLiteral() {
    assertEquals("-#infinity\n", render(num(Double.NEGATIVE_INFINITY)));
  }

  @Test
  void testTextEscapes() throws PqfmtException {
    assertEquals("\"a\"\"b#(lf)c#(tab)\"\n", format("\"a\"\"b#(lf)c#(tab)\""));
    assertEquals("\"#(#)(cr)\"\n", format("\"#(#)(cr)\""));
    assertEquals("\"#x\"\n", format("\"#x\""));
  }

  @Test
  void testIdentifiers() throws PqfmtException {
    assertEquals("#\"My Col\"\n", format("#\"My Col\""));
    assertEquals("@f\n", format("@f"));
    assertEquals("#shared\n", format("#shared"));
  }

  @Test
  void testControlKeywords() throws PqfmtException {
    assertEquals("try x otherwise 0\n", format("try x otherwise 0"));
    assertEquals("try x\n", format("try  x"));
    assertEquals("error \"bad\"\n", format("error\"bad\""));
    assertEquals("#date(2024, 1, 31)\n", format("#date(2024,1,31)"));
  }

  @Test
  void testTypes() throws PqfmtException {
    assertEquals("x is number\n", format("x is number"));
    assertEquals("x as nullable text\n", format("x as nullable text"));
    assertEquals("x is number\n", format("x is type number"));
    assertEquals("type [A = number, B]\n", format("type [A = number, B = any]"));
    assertEquals("type table [A = text]\n", format("type table [A=text]"));
    assertEquals("type {number}\n", format("type {number}"));
    assertEquals("type [A = text, ...]\n", format("type [A=text,...]"));
    assertEquals(
        "type function (x as number) as text\n", format("type function(x as number)as text"));
  }

  @Test
  void testStructuredTypesAfterIsAndAs() throws PqfmtException {
    for (FormatConfig config :
        List.of(FormatConfig.defaults(), FormatConfig.compact(), FormatConfig.expanded())) {
      String record = format("x is type [A = number, B = text]", config);
      assertEquals("x is [A = number, B = text]\n", record);
      assertEquals(record, format(record, config));

      String list = format("x as type {number}", config);
      assertEquals("x as {number}\n", list);
      assertEquals(list, format(list, config));
    }
    assertEquals("x is type\n", format("x is type"));
    assertEquals("x is table [A = text]\n", format("x is type table [A=text]"));
  }

  @Test
  void testEscapedTextCountsTowardLineLength() throws PqfmtException {
    assertEquals(
        "f(\n    x,\n    \"#(lf)#(lf)#(lf)#(lf)\"\n)\n",
        format("f(x, \"#(lf)#(lf)#(lf)#(lf)\")", FormatConfig.compact().withMaxLineLength(20)));
  }

  // Options

  @Test
  void testTabs() throws PqfmtException {
    assertEquals(
        "let\n\tx = 1\nin\n\tx\n", format("let x = 1 in x", FormatConfig.defaults().withUseTabs(true)));
  }

  @Test
  void testIndentSize() throws PqfmtException {
    assertEquals(
        "let\n  x = 1\nin\n  x\n", format("let x = 1 in x", FormatConfig.defaults().withIndentSize(2)));
  }

  @Test
  void testAlignEquals() throws PqfmtException {
    assertEquals(
        "let\n    a   = 1,\n    bcd = 2\nin\n    a\n",
        format("let a = 1, bcd = 2 in a", FormatConfig.defaults().withAlignEquals(true)));
  }

  @Test
  void testTrailingComma() throws PqfmtException {
    assertEquals(
        "[\n    A = 1,\n    B = 2,\n]\n",
        format("[A=1,B=2]", FormatConfig.defaults().withTrailingComma(true)));
  }

  @Test
  void testInnerPadding() throws PqfmtException {
    FormatConfig config =
        FormatConfig.compact().withSpaceInBrackets(true).withSpaceInBraces(true).withSpaceInParens(true);
    assertEquals("[ A = 1, B = 2 ]\n", format("[A=1,B=2]", config));
    assertEquals("{ 1, 2 }\n", format("{1,2}", config));
    assertEquals("( 1 + 2 ) * 3\n", format("(1+2)*3", config));
  }

  @Test
  void testExpandedPreset() throws PqfmtException {
    assertEquals("{\n    1,\n    2\n}\n", format("{1, 2}", FormatConfig.expanded()));
    assertEquals("[\n    A = 1\n]\n", format("[A=1]", FormatConfig.expanded()));
  }

  @Test
  void testDeterministic() throws PqfmtException {
    String input = "let a = [B = {1, 2}, C = \"x\"], f = (y) => y + 1 in f(a[B]{0})";
    String first = format(input);
    for (int i = 0; i < 5; i++) {
      assertEquals(first, format(input));
    }
  }

  @Test
  void testIdempotent() throws PqfmtException {
    List<String> inputs =
        List.of(
            "let Source = Excel.CurrentWorkbook(){[Name=\"T\"]}[Content], Rows = Table.SelectRows(Source, each [A] > 1) in Rows",
            "let f = (x as number) as number => if x < 2 then 1 else x * @f(x - 1) in f(5)",
            "[A = 1, // one\nB = {1, 2, 3}, C = [D = \"x\"]]",
            "(x) => let y = x in y");
    for (FormatConfig config :
        List.of(FormatConfig.defaults(), FormatConfig.compact(), FormatConfig.expanded())) {
      for (String input : inputs) {
        String once = format(input, config);
        assertEquals(once, format(once, config), "not idempotent: " + input);
      }
    }
  }
}
