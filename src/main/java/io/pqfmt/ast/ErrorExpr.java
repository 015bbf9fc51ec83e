package io.pqfmt.ast;

/**
 * An {@code error} expression.
 *
 * @param value the raised value
 */
public record ErrorExpr(Expr value) implements ExprKind {}
