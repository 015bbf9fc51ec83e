package io.pqfmt.ast;

/**
 * An {@code each} expression, shorthand for a one-parameter function of {@code _}.
 *
 * @param body the function body
 */
public record EachExpr(Expr body) implements ExprKind {}
