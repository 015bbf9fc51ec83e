package io.pqfmt.ast;

import io.pqfmt.Span;
import java.util.List;

/**
 * An expression node: its variant, location and attached comments.
 *
 * @param kind the expression variant
 * @param span the location in the input
 * @param leadingTrivia comments written before the expression
 * @param trailingTrivia comments written after the expression
 */
public record Expr(ExprKind kind, Span span, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia) {
  /** Creates a new Expr with defensive copies of the trivia lists. */
  public Expr {
    leadingTrivia = List.copyOf(leadingTrivia);
    trailingTrivia = List.copyOf(trailingTrivia);
  }

  /**
   * Creates an expression without comments.
   *
   * @param kind the expression variant
   * @param span the location in the input
   * @return a new Expr
   */
  public static Expr of(ExprKind kind, Span span) {
    return new Expr(kind, span, List.of(), List.of());
  }

  /** Returns a copy with the given leading comments. */
  public Expr withLeadingTrivia(List<Trivia> trivia) {
    return new Expr(kind, span, trivia, trailingTrivia);
  }

  /** Returns a copy with the given trailing comments. */
  public Expr withTrailingTrivia(List<Trivia> trivia) {
    return new Expr(kind, span, leadingTrivia, trivia);
  }

  /** Returns true if any comment is attached to this node. */
  public boolean hasComments() {
    return !leadingTrivia.isEmpty() || !trailingTrivia.isEmpty();
  }
}
