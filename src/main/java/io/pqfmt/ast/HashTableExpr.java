package io.pqfmt.ast;

import java.util.List;

/**
 * A {@code #table(columns, rows)} constructor.
 *
 * @param columns the column names or table type
 * @param rows the row lists
 */
public record HashTableExpr(Expr columns, Expr rows) implements HashConstructorExpr {
  @Override
  public String keyword() {
    return "#table";
  }

  @Override
  public List<Expr> arguments() {
    return List.of(columns, rows);
  }
}
