package io.pqfmt.ast;

import io.pqfmt.Span;

/**
 * The root of a parsed document: a single expression. Comments before and after it are attached
 * to the expression as trivia.
 *
 * @param expression the document expression
 * @param span the location of the whole document
 */
public record Document(Expr expression, Span span) {}
