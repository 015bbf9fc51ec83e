package io.pqfmt.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/** The built-in type names. */
public enum PrimitiveType implements TypeKind {
  ANY("any"),
  ANYNONNULL("anynonnull"),
  NONE("none"),
  NULL("null"),
  LOGICAL("logical"),
  NUMBER("number"),
  TIME("time"),
  DATE("date"),
  DATETIME("datetime"),
  DATETIMEZONE("datetimezone"),
  DURATION("duration"),
  TEXT("text"),
  BINARY("binary"),
  TYPE("type"),
  LIST("list"),
  RECORD("record"),
  TABLE("table"),
  FUNCTION("function");

  private static final Map<String, PrimitiveType> BY_NAME =
      Arrays.stream(values()).collect(Collectors.toMap(PrimitiveType::keyword, Function.identity()));

  private final String keyword;

  PrimitiveType(String keyword) {
    this.keyword = keyword;
  }

  /**
   * Looks up a primitive type by name.
   *
   * @param name the type name
   * @return the type, or null if the name is not a built-in type
   */
  public static PrimitiveType fromName(String name) {
    return BY_NAME.get(name);
  }

  /** Returns the type name as written in source. */
  public String keyword() {
    return keyword;
  }
}
