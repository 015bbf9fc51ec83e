package io.pqfmt.ast;

/** The {@code null} literal. */
public record NullLiteral() implements ExprKind {}
