package io.pqfmt.ast;

import java.util.List;

/**
 * A {@code #time(hour, minute, second)} constructor.
 *
 * @param hour the hour
 * @param minute the minute
 * @param second the second
 */
public record HashTimeExpr(Expr hour, Expr minute, Expr second) implements HashConstructorExpr {
  @Override
  public String keyword() {
    return "#time";
  }

  @Override
  public List<Expr> arguments() {
    return List.of(hour, minute, second);
  }
}
