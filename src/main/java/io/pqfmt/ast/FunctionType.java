package io.pqfmt.ast;

import java.util.List;

/**
 * A function type {@code function (x as number) as text}.
 *
 * @param parameters the parameters
 * @param returnType the return type, or null
 */
public record FunctionType(List<Parameter> parameters, TypeAnnotation returnType)
    implements TypeKind {
  /** Creates a new FunctionType with defensive copy of parameters list. */
  public FunctionType {
    parameters = List.copyOf(parameters);
  }
}
