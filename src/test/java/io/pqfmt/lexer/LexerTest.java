package io.pqfmt.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.pqfmt.Span;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Unit tests for the lexer. */
public class LexerTest {

  private static List<Token> significant(String input) {
    return Lexer.tokenize(input).stream().filter(t -> !t.isTrivia()).collect(Collectors.toList());
  }

  private static List<TokenKind> kinds(String input) {
    return significant(input).stream().map(Token::kind).collect(Collectors.toList());
  }

  private static Token first(String input) {
    return significant(input).get(0);
  }

  @Test
  void testSimpleLet() {
    assertEquals(
        List.of(
            TokenKind.LET,
            TokenKind.IDENTIFIER,
            TokenKind.EQUAL,
            TokenKind.NUMBER,
            TokenKind.IN,
            TokenKind.IDENTIFIER,
            TokenKind.EOF),
        kinds("let x = 1 in x"));
  }

  @Test
  void testEmptyInputIsJustEof() {
    List<Token> tokens = Lexer.tokenize("");
    assertEquals(1, tokens.size());
    assertEquals(TokenKind.EOF, tokens.get(0).kind());
  }

  @Test
  void testTriviaIsKept() {
    List<TokenKind> all =
        Lexer.tokenize("a // note\n\tb").stream().map(Token::kind).collect(Collectors.toList());
    assertEquals(
        List.of(
            TokenKind.IDENTIFIER,
            TokenKind.WHITESPACE,
            TokenKind.LINE_COMMENT,
            TokenKind.NEWLINE,
            TokenKind.WHITESPACE,
            TokenKind.IDENTIFIER,
            TokenKind.EOF),
        all);
  }

  @Test
  void testLineCommentContent() {
    Token comment = Lexer.tokenize("// hi there\nx").get(0);
    assertEquals(TokenKind.LINE_COMMENT, comment.kind());
    assertEquals(" hi there", comment.text());
  }

  @Test
  void testCrlfIsOneNewline() {
    List<Token> tokens = Lexer.tokenize("a\r\nb");
    assertEquals(TokenKind.NEWLINE, tokens.get(1).kind());
    assertEquals(TokenKind.IDENTIFIER, tokens.get(2).kind());
  }

  @Test
  void testNestedBlockComment() {
    Token comment = Lexer.tokenize("/* a /* b */ c */x").get(0);
    assertEquals(TokenKind.BLOCK_COMMENT, comment.kind());
    assertEquals(" a /* b */ c ", comment.text());
  }

  @Test
  void testUnterminatedBlockComment() {
    Token token = first("/* open /* nested */");
    assertEquals(TokenKind.INVALID, token.kind());
    assertEquals("Unterminated block comment", token.text());
  }

  @Test
  void testSlashIsDivision() {
    assertEquals(
        List.of(TokenKind.NUMBER, TokenKind.SLASH, TokenKind.NUMBER, TokenKind.EOF),
        kinds("6 / 3"));
  }

  @Test
  void testTextWithDoubledQuote() {
    Token token = first("\"say \"\"hi\"\"\"");
    assertEquals(TokenKind.TEXT, token.kind());
    assertEquals("say \"hi\"", token.text());
  }

  @Test
  void testTextEscapes() {
    Token token = first("\"a#(cr,lf)b#(tab)#(#)#(0041)#(0001F600)\"");
    assertEquals(TokenKind.TEXT, token.kind());
    assertEquals("a\r\nb\t#A😀", token.text());
  }

  @Test
  void testHashWithoutParenIsLiteral() {
    assertEquals("#1 and #x", first("\"#1 and #x\"").text());
  }

  @Test
  void testUnknownEscape() {
    Token token = first("\"#(foo)\"");
    assertEquals(TokenKind.INVALID, token.kind());
    assertEquals("Unknown escape sequence: foo", token.text());
  }

  @Test
  void testEscapeCodeMustBeHexDigits() {
    Token signed = first("\"#(+00A)\"");
    assertEquals(TokenKind.INVALID, signed.kind());
    assertEquals("Invalid escape sequence: +00A", signed.text());
    assertEquals(TokenKind.INVALID, first("\"#(-0000041)\"").kind());
    assertEquals(TokenKind.INVALID, first("\"#(00G1)\"").kind());
    assertEquals("\n", first("\"#(000A)\"").text());
  }

  @Test
  void testInvalidCodePoint() {
    Token token = first("\"#(D800)\"");
    assertEquals(TokenKind.INVALID, token.kind());
    assertEquals("Invalid unicode code point: D800", token.text());
  }

  @Test
  void testUnterminatedEscape() {
    Token token = first("\"#(cr");
    assertEquals(TokenKind.INVALID, token.kind());
    assertEquals("Unterminated escape sequence", token.text());
  }

  @Test
  void testUnterminatedString() {
    Token token = first("\"abc");
    assertEquals(TokenKind.INVALID, token.kind());
    assertEquals("Unterminated string", token.text());
  }

  @Test
  void testQuotedIdentifier() {
    Token token = first("#\"Changed \"\"Type\"\"\"");
    assertEquals(TokenKind.QUOTED_IDENTIFIER, token.kind());
    assertEquals("Changed \"Type\"", token.text());
  }

  @Test
  void testUnterminatedQuotedIdentifier() {
    Token token = first("#\"abc");
    assertEquals(TokenKind.INVALID, token.kind());
    assertEquals("Unterminated quoted identifier", token.text());
  }

  @Test
  void testHashKeywords() {
    assertEquals(
        List.of(
            TokenKind.HASH_DATE,
            TokenKind.HASH_INFINITY,
            TokenKind.HASH_NAN,
            TokenKind.HASH_TABLE,
            TokenKind.HASH_SHARED,
            TokenKind.EOF),
        kinds("#date #infinity #nan #table #shared"));
  }

  @Test
  void testUnknownHashKeyword() {
    Token token = first("#foo");
    assertEquals(TokenKind.INVALID, token.kind());
    assertEquals("Unknown hash keyword: #foo", token.text());
  }

  @Test
  void testBareHash() {
    assertEquals(TokenKind.INVALID, first("# 1").kind());
  }

  @Test
  void testNumbers() {
    assertEquals(42, first("42").number());
    assertEquals(1.5, first("1.5").number());
    assertEquals(1500, first("1.5e3").number());
    assertEquals(0.02, first("2E-2").number());
    assertEquals(0.5, first(".5").number());
    assertEquals(255, first("0xFF").number());
    assertEquals("0xFF", first("0xFF").text());
  }

  @Test
  void testMissingExponent() {
    Token token = first("1e");
    assertEquals(TokenKind.INVALID, token.kind());
    assertEquals("Invalid number: missing exponent", token.text());
  }

  @Test
  void testHexErrors() {
    assertEquals("Invalid hex number", first("0x").text());
    assertEquals("Hex number out of range", first("0xFFFFFFFFFFFFFFFFFF").text());
  }

  @Test
  void testRangeDotsAfterNumber() {
    assertEquals(
        List.of(TokenKind.NUMBER, TokenKind.DOT_DOT, TokenKind.NUMBER, TokenKind.EOF),
        kinds("1..5"));
  }

  @Test
  void testOperators() {
    assertEquals(
        List.of(
            TokenKind.FAT_ARROW,
            TokenKind.LESS_THAN_EQUAL,
            TokenKind.NOT_EQUAL,
            TokenKind.GREATER_THAN_EQUAL,
            TokenKind.QUESTION_QUESTION,
            TokenKind.QUESTION,
            TokenKind.DOT_DOT_DOT,
            TokenKind.AMPERSAND,
            TokenKind.AT,
            TokenKind.BANG,
            TokenKind.SEMICOLON,
            TokenKind.EOF),
        kinds("=> <= <> >= ?? ? ... & @ ! ;"));
  }

  @Test
  void testDottedIdentifierIsOneToken() {
    Token token = first("Table.SelectRows(x)");
    assertEquals(TokenKind.IDENTIFIER, token.kind());
    assertEquals("Table.SelectRows", token.text());
  }

  @Test
  void testKeywordOnlyWithoutDot() {
    assertEquals(TokenKind.EACH, first("each").kind());
    Token dotted = first("each.item");
    assertEquals(TokenKind.IDENTIFIER, dotted.kind());
    assertEquals("each.item", dotted.text());
  }

  @Test
  void testUnexpectedCharacterDoesNotStopLexing() {
    List<Token> tokens = significant("$ x");
    assertEquals(TokenKind.INVALID, tokens.get(0).kind());
    assertEquals("Unexpected character '$'", tokens.get(0).text());
    assertEquals(TokenKind.IDENTIFIER, tokens.get(1).kind());
    assertEquals(TokenKind.EOF, tokens.get(2).kind());
  }

  @Test
  void testSpansUseByteOffsetsAndCodePointColumns() {
    List<Token> tokens = significant("é = 1\nfoo");
    assertEquals(new Span(0, 2, 1, 1), tokens.get(0).span());
    assertEquals(new Span(3, 4, 1, 3), tokens.get(1).span());
    assertEquals(new Span(7, 10, 2, 1), tokens.get(3).span());
  }

  @Test
  void testDescribe() {
    assertEquals("']'", TokenKind.RIGHT_BRACKET.describe());
    assertEquals("'in'", TokenKind.IN.describe());
    assertEquals("end of input", TokenKind.EOF.describe());
    assertEquals("identifier 'x'", first("x").describe());
  }
}
