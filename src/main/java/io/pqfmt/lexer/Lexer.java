package io.pqfmt.lexer;

import io.pqfmt.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Tokenizes Power Query M source text into a list of tokens.
 *
 * <p>Whitespace, newlines and comments are kept as trivia tokens. Lexing never fails: anything
 * that cannot be scanned becomes an {@link TokenKind#INVALID} token carrying a description, and
 * the list always ends with an {@link TokenKind#EOF} token.
 */
public final class Lexer {
  private static final int END = -1;

  private final String input;
  private int pos;
  private int offset;
  private int line;
  private int column;

  private int tokenPos;
  private int tokenOffset;
  private int tokenLine;
  private int tokenColumn;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
    this.offset = 0;
    this.line = 1;
    this.column = 1;
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the input string to tokenize
   * @return a list of tokens ending with EOF
   */
  public static List<Token> tokenize(String input) {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      Token token = nextToken();
      tokens.add(token);
      if (token.kind() == TokenKind.EOF) {
        return tokens;
      }
    }
  }

  private Token nextToken() {
    tokenPos = pos;
    tokenOffset = offset;
    tokenLine = line;
    tokenColumn = column;

    int c = peek();
    if (c == END) {
      return make(TokenKind.EOF, "");
    }

    return switch (c) {
      case ' ', '\t', '\uFEFF' -> lexWhitespace();
      case '\r', '\n' -> lexNewline();
      case '"' -> lexText();
      case '#' -> lexHash();
      case '/' -> lexSlash();
      case '.' -> isDigit(peekNext()) ? lexNumber() : lexDots();
      case '=' -> twoChar('>', TokenKind.FAT_ARROW, TokenKind.EQUAL);
      case '?' -> twoChar('?', TokenKind.QUESTION_QUESTION, TokenKind.QUESTION);
      case '>' -> twoChar('=', TokenKind.GREATER_THAN_EQUAL, TokenKind.GREATER_THAN);
      case '<' -> lexLessThan();
      case '+' -> single(TokenKind.PLUS);
      case '-' -> single(TokenKind.MINUS);
      case '*' -> single(TokenKind.STAR);
      case '&' -> single(TokenKind.AMPERSAND);
      case ',' -> single(TokenKind.COMMA);
      case ';' -> single(TokenKind.SEMICOLON);
      case '(' -> single(TokenKind.LEFT_PAREN);
      case ')' -> single(TokenKind.RIGHT_PAREN);
      case '[' -> single(TokenKind.LEFT_BRACKET);
      case ']' -> single(TokenKind.RIGHT_BRACKET);
      case '{' -> single(TokenKind.LEFT_BRACE);
      case '}' -> single(TokenKind.RIGHT_BRACE);
      case '@' -> single(TokenKind.AT);
      case '!' -> single(TokenKind.BANG);
      default -> {
        if (isDigit(c)) {
          yield lexNumber();
        }
        if (isIdentifierStart(c)) {
          yield lexIdentifier();
        }
        advance();
        yield invalid("Unexpected character '" + new String(Character.toChars(c)) + "'");
      }
    };
  }

  private Token lexWhitespace() {
    advanceWhile(c -> c == ' ' || c == '\t' || c == '\uFEFF');
    return make(TokenKind.WHITESPACE, lexeme());
  }

  private Token lexNewline() {
    int c = advance();
    if (c == '\r' && peek() == '\n') {
      advance();
    }
    return make(TokenKind.NEWLINE, "\n");
  }

  private Token lexText() {
    advance(); // opening quote
    StringBuilder value = new StringBuilder();
    while (true) {
      int c = peek();
      if (c == END) {
        return invalid("Unterminated string");
      }
      if (c == '"') {
        advance();
        if (peek() != '"') {
          return make(TokenKind.TEXT, value.toString());
        }
        advance();
        value.append('"');
      } else if (c == '#' && peekNext() == '(') {
        advance();
        advance();
        String error = lexEscapeSequence(value);
        if (error != null) {
          return invalid(error);
        }
      } else {
        value.appendCodePoint(advance());
      }
    }
  }

  /** Decodes the escapes of a {@code #(...)} group into {@code out}, returning an error or null. */
  private String lexEscapeSequence(StringBuilder out) {
    while (true) {
      String code = advanceWhile(c -> c != ',' && c != ')');
      switch (code) {
        case "cr" -> out.append('\r');
        case "lf" -> out.append('\n');
        case "tab" -> out.append('\t');
        case "#" -> out.append('#');
        default -> {
          if (code.length() != 4 && code.length() != 8) {
            return "Unknown escape sequence: " + code;
          }
          if (!code.chars().allMatch(Lexer::isHexDigit)) {
            return "Invalid escape sequence: " + code;
          }
          long value = Long.parseLong(code, 16);
          if (value < 0
              || value > Character.MAX_CODE_POINT
              || (value >= Character.MIN_SURROGATE && value <= Character.MAX_SURROGATE)) {
            return "Invalid unicode code point: " + code;
          }
          out.appendCodePoint((int) value);
        }
      }

      int c = peek();
      if (c == ',') {
        advance();
      } else if (c == ')') {
        advance();
        return null;
      } else {
        return "Unterminated escape sequence";
      }
    }
  }

  private Token lexHash() {
    advance(); // #
    int c = peek();
    if (c == '"') {
      advance();
      StringBuilder name = new StringBuilder();
      while (true) {
        int d = peek();
        if (d == END) {
          return invalid("Unterminated quoted identifier");
        }
        advance();
        if (d == '"') {
          if (peek() != '"') {
            return make(TokenKind.QUOTED_IDENTIFIER, name.toString());
          }
          advance();
        }
        name.appendCodePoint(d);
      }
    }
    if (isIdentifierStart(c)) {
      String word = advanceWhile(Lexer::isIdentifierPart);
      TokenKind kind = TokenKind.hashKeyword(word);
      if (kind == null) {
        return invalid("Unknown hash keyword: #" + word);
      }
      return make(kind, "#" + word);
    }
    return invalid("Unexpected character '#'");
  }

  private Token lexNumber() {
    if (peek() == '0' && (peekNext() == 'x' || peekNext() == 'X')) {
      advance();
      advance();
      String hex = advanceWhile(Lexer::isHexDigit);
      if (hex.isEmpty()) {
        return invalid("Invalid hex number");
      }
      try {
        return Token.number(Long.parseLong(hex, 16), lexeme(), span());
      } catch (NumberFormatException e) {
        return invalid("Hex number out of range");
      }
    }

    advanceWhile(Lexer::isDigit);
    if (peek() == '.' && isDigit(peekNext())) {
      advance();
      advanceWhile(Lexer::isDigit);
    }
    if (peek() == 'e' || peek() == 'E') {
      advance();
      if (peek() == '+' || peek() == '-') {
        advance();
      }
      if (advanceWhile(Lexer::isDigit).isEmpty()) {
        return invalid("Invalid number: missing exponent");
      }
    }

    String lexeme = lexeme();
    try {
      return Token.number(Double.parseDouble(lexeme), lexeme, span());
    } catch (NumberFormatException e) {
      return invalid("Invalid number: " + lexeme);
    }
  }

  private Token lexSlash() {
    advance(); // /
    int c = peek();
    if (c == '/') {
      advance();
      String content = advanceWhile(d -> d != '\n' && d != '\r');
      return make(TokenKind.LINE_COMMENT, content);
    }
    if (c != '*') {
      return make(TokenKind.SLASH, "/");
    }

    advance();
    int contentStart = pos;
    int depth = 1;
    while (true) {
      int d = peek();
      if (d == END) {
        return invalid("Unterminated block comment");
      }
      if (d == '/' && peekNext() == '*') {
        advance();
        advance();
        depth++;
      } else if (d == '*' && peekNext() == '/') {
        int contentEnd = pos;
        advance();
        advance();
        if (--depth == 0) {
          return make(TokenKind.BLOCK_COMMENT, input.substring(contentStart, contentEnd));
        }
      } else {
        advance();
      }
    }
  }

  private Token lexDots() {
    advance();
    if (peek() != '.') {
      return make(TokenKind.DOT, ".");
    }
    advance();
    if (peek() != '.') {
      return make(TokenKind.DOT_DOT, "..");
    }
    advance();
    return make(TokenKind.DOT_DOT_DOT, "...");
  }

  private Token lexLessThan() {
    advance();
    if (peek() == '=') {
      advance();
      return make(TokenKind.LESS_THAN_EQUAL, "<=");
    }
    if (peek() == '>') {
      advance();
      return make(TokenKind.NOT_EQUAL, "<>");
    }
    return make(TokenKind.LESS_THAN, "<");
  }

  private Token lexIdentifier() {
    StringBuilder name = new StringBuilder(advanceWhile(Lexer::isIdentifierPart));
    boolean dotted = false;
    while (peek() == '.' && isIdentifierStart(peekNext())) {
      advance();
      name.append('.').append(advanceWhile(Lexer::isIdentifierPart));
      dotted = true;
    }
    String word = name.toString();
    TokenKind keyword = dotted ? null : TokenKind.keyword(word);
    return make(keyword != null ? keyword : TokenKind.IDENTIFIER, word);
  }

  private Token twoChar(int second, TokenKind pair, TokenKind alone) {
    advance();
    if (peek() == second) {
      advance();
      return make(pair, pair.text());
    }
    return make(alone, alone.text());
  }

  private Token single(TokenKind kind) {
    advance();
    return make(kind, kind.text());
  }

  // Helper methods

  private Token make(TokenKind kind, String text) {
    return Token.of(kind, text, span());
  }

  private Token invalid(String message) {
    return Token.invalid(message, span());
  }

  private Span span() {
    return new Span(tokenOffset, offset, tokenLine, tokenColumn);
  }

  private String lexeme() {
    return input.substring(tokenPos, pos);
  }

  private int peek() {
    return pos < input.length() ? input.codePointAt(pos) : END;
  }

  private int peekNext() {
    if (pos >= input.length()) {
      return END;
    }
    int next = pos + Character.charCount(input.codePointAt(pos));
    return next < input.length() ? input.codePointAt(next) : END;
  }

  private int advance() {
    int c = input.codePointAt(pos);
    pos += Character.charCount(c);
    offset += utf8Length(c);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private String advanceWhile(IntPredicate predicate) {
    int start = pos;
    while (peek() != END && predicate.test(peek())) {
      advance();
    }
    return input.substring(start, pos);
  }

  private static int utf8Length(int c) {
    if (c < 0x80) {
      return 1;
    }
    if (c < 0x800) {
      return 2;
    }
    return c < 0x10000 ? 3 : 4;
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(int c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isIdentifierStart(int c) {
    return c == '_' || Character.isLetter(c) || Character.isAlphabetic(c);
  }

  private static boolean isIdentifierPart(int c) {
    return isIdentifierStart(c)
        || Character.isDigit(c)
        || Character.getType(c) == Character.OTHER_NUMBER;
  }
}
