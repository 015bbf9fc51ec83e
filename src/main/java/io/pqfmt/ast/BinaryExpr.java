package io.pqfmt.ast;

/**
 * A binary operation.
 *
 * @param left the left operand
 * @param operator the operator
 * @param right the right operand; a {@link TypeExpr} for {@code is} and {@code as}
 */
public record BinaryExpr(Expr left, BinaryOp operator, Expr right) implements ExprKind {}
