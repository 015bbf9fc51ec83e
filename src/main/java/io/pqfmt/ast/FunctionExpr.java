package io.pqfmt.ast;

import java.util.List;

/**
 * A function literal {@code (params) as T => body}.
 *
 * @param parameters the parameters
 * @param returnType the declared return type, or null
 * @param body the function body
 */
public record FunctionExpr(List<Parameter> parameters, TypeAnnotation returnType, Expr body)
    implements ExprKind {
  /** Creates a new FunctionExpr with defensive copy of parameters list. */
  public FunctionExpr {
    parameters = List.copyOf(parameters);
  }
}
