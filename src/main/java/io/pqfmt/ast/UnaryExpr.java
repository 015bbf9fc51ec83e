package io.pqfmt.ast;

/**
 * A prefix operation.
 *
 * @param operator the operator
 * @param operand the operand
 */
public record UnaryExpr(UnaryOp operator, Expr operand) implements ExprKind {}
