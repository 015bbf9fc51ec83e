package io.pqfmt.lexer;

import java.util.HashMap;
import java.util.Map;

/** The type of token. */
public enum TokenKind {
  // Literals
  /** The "null" keyword. */
  NULL("null", Category.KEYWORD),
  /** The "true" keyword. */
  TRUE("true", Category.KEYWORD),
  /** The "false" keyword. */
  FALSE("false", Category.KEYWORD),
  /** A decimal or hexadecimal number. */
  NUMBER("number", Category.VALUE),
  /** A text literal; the token text holds the decoded value. */
  TEXT("text", Category.VALUE),
  /** A plain, possibly dotted, identifier. */
  IDENTIFIER("identifier", Category.VALUE),
  /** A {@code #"..."} identifier; the token text holds the decoded name. */
  QUOTED_IDENTIFIER("quoted identifier", Category.VALUE),

  // Keywords
  AND("and", Category.KEYWORD),
  AS("as", Category.KEYWORD),
  EACH("each", Category.KEYWORD),
  ELSE("else", Category.KEYWORD),
  ERROR("error", Category.KEYWORD),
  IF("if", Category.KEYWORD),
  IN("in", Category.KEYWORD),
  IS("is", Category.KEYWORD),
  LET("let", Category.KEYWORD),
  META("meta", Category.KEYWORD),
  NOT("not", Category.KEYWORD),
  OR("or", Category.KEYWORD),
  OTHERWISE("otherwise", Category.KEYWORD),
  SECTION("section", Category.KEYWORD),
  SHARED("shared", Category.KEYWORD),
  THEN("then", Category.KEYWORD),
  TRY("try", Category.KEYWORD),
  TYPE("type", Category.KEYWORD),

  // Hash keywords
  HASH_BINARY("#binary", Category.HASH_KEYWORD),
  HASH_DATE("#date", Category.HASH_KEYWORD),
  HASH_DATETIME("#datetime", Category.HASH_KEYWORD),
  HASH_DATETIMEZONE("#datetimezone", Category.HASH_KEYWORD),
  HASH_DURATION("#duration", Category.HASH_KEYWORD),
  HASH_INFINITY("#infinity", Category.HASH_KEYWORD),
  HASH_NAN("#nan", Category.HASH_KEYWORD),
  HASH_SECTIONS("#sections", Category.HASH_KEYWORD),
  HASH_SHARED("#shared", Category.HASH_KEYWORD),
  HASH_TABLE("#table", Category.HASH_KEYWORD),
  HASH_TIME("#time", Category.HASH_KEYWORD),

  // Operators
  PLUS("+", Category.PUNCTUATION),
  MINUS("-", Category.PUNCTUATION),
  STAR("*", Category.PUNCTUATION),
  SLASH("/", Category.PUNCTUATION),
  AMPERSAND("&", Category.PUNCTUATION),
  EQUAL("=", Category.PUNCTUATION),
  NOT_EQUAL("<>", Category.PUNCTUATION),
  LESS_THAN("<", Category.PUNCTUATION),
  LESS_THAN_EQUAL("<=", Category.PUNCTUATION),
  GREATER_THAN(">", Category.PUNCTUATION),
  GREATER_THAN_EQUAL(">=", Category.PUNCTUATION),
  FAT_ARROW("=>", Category.PUNCTUATION),
  QUESTION_QUESTION("??", Category.PUNCTUATION),
  DOT(".", Category.PUNCTUATION),
  DOT_DOT("..", Category.PUNCTUATION),
  DOT_DOT_DOT("...", Category.PUNCTUATION),

  // Punctuation
  COMMA(",", Category.PUNCTUATION),
  SEMICOLON(";", Category.PUNCTUATION),
  LEFT_PAREN("(", Category.PUNCTUATION),
  RIGHT_PAREN(")", Category.PUNCTUATION),
  LEFT_BRACKET("[", Category.PUNCTUATION),
  RIGHT_BRACKET("]", Category.PUNCTUATION),
  LEFT_BRACE("{", Category.PUNCTUATION),
  RIGHT_BRACE("}", Category.PUNCTUATION),
  AT("@", Category.PUNCTUATION),
  BANG("!", Category.PUNCTUATION),
  QUESTION("?", Category.PUNCTUATION),

  // Trivia
  /** A {@code //} comment; the token text excludes the marker. */
  LINE_COMMENT("line comment", Category.TRIVIA),
  /** A {@code /* *\/} comment; the token text excludes the outer markers. */
  BLOCK_COMMENT("block comment", Category.TRIVIA),
  /** A run of spaces and tabs. */
  WHITESPACE("whitespace", Category.TRIVIA),
  /** A single line break: CR, LF or CRLF. */
  NEWLINE("newline", Category.TRIVIA),

  // Special
  /** End of input; always the last token. */
  EOF("end of input", Category.SPECIAL),
  /** An unscannable region; the token text holds the lexer's description. */
  INVALID("invalid token", Category.SPECIAL);

  private enum Category {
    KEYWORD,
    HASH_KEYWORD,
    VALUE,
    PUNCTUATION,
    TRIVIA,
    SPECIAL
  }

  private static final Map<String, TokenKind> KEYWORDS = new HashMap<>();
  private static final Map<String, TokenKind> HASH_KEYWORDS = new HashMap<>();

  static {
    for (TokenKind kind : values()) {
      if (kind.category == Category.KEYWORD) {
        KEYWORDS.put(kind.text, kind);
      } else if (kind.category == Category.HASH_KEYWORD) {
        HASH_KEYWORDS.put(kind.text.substring(1), kind);
      }
    }
  }

  private final String text;
  private final Category category;

  TokenKind(String text, Category category) {
    this.text = text;
    this.category = category;
  }

  /**
   * Looks up a reserved word, including {@code null}, {@code true} and {@code false}.
   *
   * @param word the word to look up
   * @return the keyword kind, or null if the word is not reserved
   */
  public static TokenKind keyword(String word) {
    return KEYWORDS.get(word);
  }

  /**
   * Looks up the word that follows a {@code #}.
   *
   * @param word the word without its leading {@code #}
   * @return the hash keyword kind, or null if unknown
   */
  public static TokenKind hashKeyword(String word) {
    return HASH_KEYWORDS.get(word);
  }

  /** Returns the source text of fixed tokens, or a description of variable ones. */
  public String text() {
    return text;
  }

  /** Returns true for reserved words. */
  public boolean isKeyword() {
    return category == Category.KEYWORD;
  }

  /** Returns true for whitespace, newlines and comments. */
  public boolean isTrivia() {
    return category == Category.TRIVIA;
  }

  /** Returns true for line and block comments. */
  public boolean isComment() {
    return this == LINE_COMMENT || this == BLOCK_COMMENT;
  }

  /**
   * Describes this kind for error messages: fixed tokens are quoted, others are named.
   *
   * @return the description
   */
  public String describe() {
    return switch (category) {
      case KEYWORD, HASH_KEYWORD, PUNCTUATION -> "'" + text + "'";
      default -> text;
    };
  }
}
