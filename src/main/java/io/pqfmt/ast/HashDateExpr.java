package io.pqfmt.ast;

import java.util.List;

/**
 * A {@code #date(year, month, day)} constructor.
 *
 * @param year the year
 * @param month the month
 * @param day the day
 */
public record HashDateExpr(Expr year, Expr month, Expr day) implements HashConstructorExpr {
  @Override
  public String keyword() {
    return "#date";
  }

  @Override
  public List<Expr> arguments() {
    return List.of(year, month, day);
  }
}
