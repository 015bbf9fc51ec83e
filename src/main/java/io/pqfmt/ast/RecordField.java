package io.pqfmt.ast;

import io.pqfmt.Span;
import java.util.List;

/**
 * A {@code name = value} entry of a record literal. Names may be generalized identifiers such as
 * {@code type} or {@code Unit Price}.
 *
 * @param name the field name
 * @param value the field value
 * @param span the location in the input
 * @param leadingTrivia comments on the lines before the field
 * @param trailingTrivia comments after the value on the same line
 */
public record RecordField(
    Identifier name, Expr value, Span span, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia) {
  /** Creates a new RecordField with defensive copies of the trivia lists. */
  public RecordField {
    leadingTrivia = List.copyOf(leadingTrivia);
    trailingTrivia = List.copyOf(trailingTrivia);
  }

  /** Returns a copy with the given leading comments. */
  public RecordField withLeadingTrivia(List<Trivia> trivia) {
    return new RecordField(name, value, span, trivia, trailingTrivia);
  }

  /** Returns a copy with the given trailing comments. */
  public RecordField withTrailingTrivia(List<Trivia> trivia) {
    return new RecordField(name, value, span, leadingTrivia, trivia);
  }

  /** Returns true if any comment is attached to this field. */
  public boolean hasComments() {
    return !leadingTrivia.isEmpty() || !trailingTrivia.isEmpty();
  }
}
