package io.pqfmt.ast;

import java.util.List;

/**
 * A list literal {@code {1, 2, 3}}.
 *
 * @param items the items; ranges appear as {@link RangeExpr} items
 */
public record ListExpr(List<Expr> items) implements ExprKind {
  /** Creates a new ListExpr with defensive copy of items list. */
  public ListExpr {
    items = List.copyOf(items);
  }
}
