package io.pqfmt.ast;

import io.pqfmt.Span;

/**
 * A field of a record or table type.
 *
 * @param name the field name
 * @param type the field type; {@code any} when none was written
 * @param optional whether the field was marked {@code optional}
 * @param span the location in the input
 */
public record FieldType(Identifier name, TypeAnnotation type, boolean optional, Span span) {}
