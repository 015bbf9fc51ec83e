package io.pqfmt.ast;

import io.pqfmt.Span;

/**
 * A name as written in the source.
 *
 * @param name the decoded name
 * @param quoted whether the name was written as {@code #"..."}
 * @param span the location in the input
 */
public record Identifier(String name, boolean quoted, Span span) {}
