package io.pqfmt.ast;

/**
 * A reference to a plain, possibly dotted, name such as {@code Table.SelectRows}.
 *
 * @param name the name
 * @param inclusive whether the reference was written with a leading {@code @}
 */
public record IdentifierExpr(String name, boolean inclusive) implements ExprKind {}
