package io.pqfmt.ast;

/**
 * An expression written in parentheses. Kept so the source grouping survives formatting.
 *
 * @param inner the enclosed expression
 */
public record ParenthesizedExpr(Expr inner) implements ExprKind {}
