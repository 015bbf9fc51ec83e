package io.pqfmt.lexer;

import io.pqfmt.Span;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param text the lexeme; decoded value for text and quoted identifiers, comment content for
 *     comments, the problem description for invalid tokens
 * @param number the numeric value (for NUMBER tokens)
 */
public record Token(TokenKind kind, Span span, String text, double number) {
  /** Creates a token whose value is its text. */
  public static Token of(TokenKind kind, String text, Span span) {
    return new Token(kind, span, text, 0);
  }

  /** Creates a number token. */
  public static Token number(double value, String lexeme, Span span) {
    return new Token(TokenKind.NUMBER, span, lexeme, value);
  }

  /** Creates an invalid token carrying a description of the problem. */
  public static Token invalid(String message, Span span) {
    return new Token(TokenKind.INVALID, span, message, 0);
  }

  /** Returns true for whitespace, newlines and comments. */
  public boolean isTrivia() {
    return kind.isTrivia();
  }

  /**
   * Describes this token for error messages.
   *
   * @return the description
   */
  public String describe() {
    return switch (kind) {
      case IDENTIFIER -> "identifier '" + text + "'";
      case QUOTED_IDENTIFIER -> "identifier #\"" + text + "\"";
      case NUMBER -> "number " + text;
      case TEXT -> "text \"" + text + "\"";
      case INVALID -> text;
      default -> kind.describe();
    };
  }
}
