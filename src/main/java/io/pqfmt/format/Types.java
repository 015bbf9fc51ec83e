package io.pqfmt.format;

import io.pqfmt.ast.*;
import java.util.List;
import java.util.stream.Collectors;

/** Renders type annotations as canonical strings. Types always render on one line. */
final class Types {
  private Types() {}

  /**
   * Renders a type annotation.
   *
   * @param type the type to render
   * @return the canonical type text
   */
  static String render(TypeAnnotation type) {
    return render(type.kind());
  }

  static String render(TypeKind kind) {
    if (kind instanceof PrimitiveType primitive) {
      return primitive.keyword();
    }
    if (kind instanceof ListType list) {
      return list.itemType() == null ? "{}" : "{" + render(list.itemType()) + "}";
    }
    if (kind instanceof RecordType recordType) {
      return renderFields(recordType.fields(), recordType.open());
    }
    if (kind instanceof TableType table) {
      return "table " + renderFields(table.fields(), table.open());
    }
    if (kind instanceof FunctionType function) {
      String head = "function " + renderParameters(function.parameters());
      return function.returnType() == null ? head : head + " as " + render(function.returnType());
    }
    if (kind instanceof NullableType nullable) {
      return "nullable " + render(nullable.inner());
    }
    return ((CustomType) kind).name();
  }

  /** Renders {@code (optional x as number, y)}. */
  static String renderParameters(List<Parameter> parameters) {
    return parameters.stream()
        .map(Types::renderParameter)
        .collect(Collectors.joining(", ", "(", ")"));
  }

  private static String renderParameter(Parameter parameter) {
    StringBuilder sb = new StringBuilder();
    if (parameter.optional()) {
      sb.append("optional ");
    }
    sb.append(Literals.identifier(parameter.name()));
    if (parameter.type() != null) {
      sb.append(" as ").append(render(parameter.type()));
    }
    return sb.toString();
  }

  private static String renderFields(List<FieldType> fields, boolean open) {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      FieldType field = fields.get(i);
      if (field.optional()) {
        sb.append("optional ");
      }
      sb.append(Literals.identifier(field.name()));
      // "= any" is the default and is left out
      if (field.type().kind() != PrimitiveType.ANY) {
        sb.append(" = ").append(render(field.type()));
      }
    }
    if (open) {
      sb.append(fields.isEmpty() ? "..." : ", ...");
    }
    return sb.append("]").toString();
  }
}
