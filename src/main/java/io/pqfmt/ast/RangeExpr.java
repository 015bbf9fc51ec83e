package io.pqfmt.ast;

/**
 * A list item range {@code start..end}.
 *
 * @param start the first value
 * @param end the last value
 */
public record RangeExpr(Expr start, Expr end) implements ExprKind {}
