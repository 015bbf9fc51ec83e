package io.pqfmt.ast;

/**
 * A type referenced by a name that is not built in.
 *
 * @param name the type name
 */
public record CustomType(String name) implements TypeKind {}
