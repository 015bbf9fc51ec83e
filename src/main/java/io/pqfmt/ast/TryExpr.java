package io.pqfmt.ast;

/**
 * A {@code try} expression with an optional {@code otherwise} fallback.
 *
 * @param body the protected expression
 * @param otherwise the fallback, or null
 */
public record TryExpr(Expr body, Expr otherwise) implements ExprKind {}
