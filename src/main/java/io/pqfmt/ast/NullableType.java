package io.pqfmt.ast;

/**
 * A {@code nullable T} type.
 *
 * @param inner the wrapped type
 */
public record NullableType(TypeAnnotation inner) implements TypeKind {}
