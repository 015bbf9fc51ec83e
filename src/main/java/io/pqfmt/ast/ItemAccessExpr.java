package io.pqfmt.ast;

/**
 * An item lookup {@code target{index}}.
 *
 * @param target the list or table
 * @param index the index or key expression
 * @param optional whether a trailing {@code ?} was written
 */
public record ItemAccessExpr(Expr target, Expr index, boolean optional) implements ExprKind {}
