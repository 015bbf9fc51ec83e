package io.pqfmt.ast;

import io.pqfmt.lexer.TokenKind;

/** Binary operators, with their binding precedence (higher binds tighter). */
public enum BinaryOp {
  META("meta", 1),
  COALESCE("??", 2),
  OR("or", 3),
  AND("and", 4),
  EQUAL("=", 5),
  NOT_EQUAL("<>", 5),
  LESS_THAN("<", 5),
  LESS_THAN_EQUAL("<=", 5),
  GREATER_THAN(">", 5),
  GREATER_THAN_EQUAL(">=", 5),
  IS("is", 5),
  AS("as", 5),
  CONCATENATE("&", 6),
  ADD("+", 7),
  SUBTRACT("-", 7),
  MULTIPLY("*", 8),
  DIVIDE("/", 8);

  private final String symbol;
  private final int precedence;

  BinaryOp(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  /**
   * Maps a token to the binary operator it spells.
   *
   * @param kind the token kind
   * @return the operator, or null if the token is not a binary operator
   */
  public static BinaryOp fromToken(TokenKind kind) {
    return switch (kind) {
      case META -> META;
      case QUESTION_QUESTION -> COALESCE;
      case OR -> OR;
      case AND -> AND;
      case EQUAL -> EQUAL;
      case NOT_EQUAL -> NOT_EQUAL;
      case LESS_THAN -> LESS_THAN;
      case LESS_THAN_EQUAL -> LESS_THAN_EQUAL;
      case GREATER_THAN -> GREATER_THAN;
      case GREATER_THAN_EQUAL -> GREATER_THAN_EQUAL;
      case IS -> IS;
      case AS -> AS;
      case AMPERSAND -> CONCATENATE;
      case PLUS -> ADD;
      case MINUS -> SUBTRACT;
      case STAR -> MULTIPLY;
      case SLASH -> DIVIDE;
      default -> null;
    };
  }

  /** Returns the operator as written in source. */
  public String symbol() {
    return symbol;
  }

  /** Returns the precedence level, from 1 ({@code meta}) to 8 ({@code *}, {@code /}). */
  public int precedence() {
    return precedence;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
