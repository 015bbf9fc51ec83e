package io.pqfmt.ast;

import java.util.List;

/**
 * A record type {@code [A = number, ...]}.
 *
 * @param fields the declared fields
 * @param open whether the type ends with {@code ...}
 */
public record RecordType(List<FieldType> fields, boolean open) implements TypeKind {
  /** Creates a new RecordType with defensive copy of fields list. */
  public RecordType {
    fields = List.copyOf(fields);
  }
}
