package io.pqfmt.ast;

import java.util.List;

/**
 * A record literal {@code [A = 1, B = 2]}.
 *
 * @param fields the fields in source order
 */
public record RecordExpr(List<RecordField> fields) implements ExprKind {
  /** Creates a new RecordExpr with defensive copy of fields list. */
  public RecordExpr {
    fields = List.copyOf(fields);
  }
}
