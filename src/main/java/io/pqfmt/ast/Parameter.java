package io.pqfmt.ast;

import io.pqfmt.Span;

/**
 * A function parameter.
 *
 * @param name the parameter name
 * @param type the declared type, or null
 * @param optional whether the parameter was marked {@code optional}
 * @param span the location in the input
 */
public record Parameter(Identifier name, TypeAnnotation type, boolean optional, Span span) {}
