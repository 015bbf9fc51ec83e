package io.pqfmt.ast;

import java.util.List;

/**
 * A field projection {@code target[[A], [B]]}.
 *
 * @param target the projected expression
 * @param fields the selected field names
 * @param optional whether a trailing {@code ?} was written
 */
public record FieldProjectionExpr(Expr target, List<Identifier> fields, boolean optional)
    implements ExprKind {
  /** Creates a new FieldProjectionExpr with defensive copy of fields list. */
  public FieldProjectionExpr {
    fields = List.copyOf(fields);
  }
}
