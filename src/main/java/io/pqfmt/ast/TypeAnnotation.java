package io.pqfmt.ast;

import io.pqfmt.Span;

/**
 * A type as written in a parameter, return position or type expression.
 *
 * @param kind the type variant
 * @param span the location in the input
 */
public record TypeAnnotation(TypeKind kind, Span span) {}
