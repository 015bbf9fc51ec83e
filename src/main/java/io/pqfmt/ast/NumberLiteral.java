package io.pqfmt.ast;

/**
 * A number literal, including {@code #infinity} and {@code #nan}.
 *
 * @param value the literal value
 */
public record NumberLiteral(double value) implements ExprKind {}
