package io.pqfmt.ast;

import java.util.List;

/**
 * A table type {@code table [A = number]}.
 *
 * @param fields the column declarations
 * @param open whether the row type ends with {@code ...}
 */
public record TableType(List<FieldType> fields, boolean open) implements TypeKind {
  /** Creates a new TableType with defensive copy of fields list. */
  public TableType {
    fields = List.copyOf(fields);
  }
}
