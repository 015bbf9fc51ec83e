package io.pqfmt.ast;

/**
 * A text literal.
 *
 * @param value the decoded text
 */
public record TextLiteral(String value) implements ExprKind {}
