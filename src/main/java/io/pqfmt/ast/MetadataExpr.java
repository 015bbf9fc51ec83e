package io.pqfmt.ast;

/**
 * A {@code value meta record} expression.
 *
 * @param value the annotated value
 * @param metadata the metadata expression
 */
public record MetadataExpr(Expr value, Expr metadata) implements ExprKind {}
