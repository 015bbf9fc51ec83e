package io.pqfmt.ast;

/**
 * A reference to a {@code #"..."} name.
 *
 * @param name the decoded name
 * @param inclusive whether the reference was written with a leading {@code @}
 */
public record QuotedIdentifierExpr(String name, boolean inclusive) implements ExprKind {}
