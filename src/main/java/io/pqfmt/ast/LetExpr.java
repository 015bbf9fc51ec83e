package io.pqfmt.ast;

import java.util.List;

/**
 * A {@code let ... in ...} expression.
 *
 * @param bindings the bindings in source order
 * @param body the expression after {@code in}
 */
public record LetExpr(List<Binding> bindings, Expr body) implements ExprKind {
  /** Creates a new LetExpr with defensive copy of bindings list. */
  public LetExpr {
    bindings = List.copyOf(bindings);
  }
}
