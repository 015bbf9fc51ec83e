package io.pqfmt.ast;

import java.util.List;

/**
 * A {@code #duration(days, hours, minutes, seconds)} constructor.
 *
 * @param days the days
 * @param hours the hours
 * @param minutes the minutes
 * @param seconds the seconds
 */
public record HashDurationExpr(Expr days, Expr hours, Expr minutes, Expr seconds)
    implements HashConstructorExpr {
  @Override
  public String keyword() {
    return "#duration";
  }

  @Override
  public List<Expr> arguments() {
    return List.of(days, hours, minutes, seconds);
  }
}
