package io.pqfmt.ast;

/** The implicit {@code _} parameter of {@code each}. */
public record UnderscoreExpr() implements ExprKind {}
