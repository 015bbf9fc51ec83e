package io.pqfmt.ast;

/**
 * An {@code if ... then ... else ...} expression.
 *
 * @param condition the tested expression
 * @param thenBranch the value when the condition holds
 * @param elseBranch the value otherwise
 */
public record IfExpr(Expr condition, Expr thenBranch, Expr elseBranch) implements ExprKind {}
