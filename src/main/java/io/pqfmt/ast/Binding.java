package io.pqfmt.ast;

import io.pqfmt.Span;
import java.util.List;

/**
 * A {@code name = value} entry of a let expression.
 *
 * @param name the bound name
 * @param value the bound expression
 * @param span the location in the input
 * @param leadingTrivia comments on the lines before the binding
 * @param trailingTrivia comments after the value on the same line
 */
public record Binding(
    Identifier name, Expr value, Span span, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia) {
  /** Creates a new Binding with defensive copies of the trivia lists. */
  public Binding {
    leadingTrivia = List.copyOf(leadingTrivia);
    trailingTrivia = List.copyOf(trailingTrivia);
  }

  /** Returns a copy with the given leading comments. */
  public Binding withLeadingTrivia(List<Trivia> trivia) {
    return new Binding(name, value, span, trivia, trailingTrivia);
  }

  /** Returns a copy with the given trailing comments. */
  public Binding withTrailingTrivia(List<Trivia> trivia) {
    return new Binding(name, value, span, leadingTrivia, trivia);
  }

  /** Returns true if any comment is attached to this binding. */
  public boolean hasComments() {
    return !leadingTrivia.isEmpty() || !trailingTrivia.isEmpty();
  }
}
