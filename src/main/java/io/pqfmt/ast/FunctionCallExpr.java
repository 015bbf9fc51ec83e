package io.pqfmt.ast;

import java.util.List;

/**
 * An invocation {@code f(a, b)}.
 *
 * @param function the invoked expression
 * @param arguments the arguments
 */
public record FunctionCallExpr(Expr function, List<Expr> arguments) implements ExprKind {
  /** Creates a new FunctionCallExpr with defensive copy of arguments list. */
  public FunctionCallExpr {
    arguments = List.copyOf(arguments);
  }
}
