package io.pqfmt.ast;

/**
 * A list type {@code {T}}.
 *
 * @param itemType the item type, or null for {@code {}}
 */
public record ListType(TypeAnnotation itemType) implements TypeKind {}
