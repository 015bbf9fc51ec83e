package io.pqfmt.ast;

/**
 * A {@code true} or {@code false} literal.
 *
 * @param value the literal value
 */
public record LogicalLiteral(boolean value) implements ExprKind {}
