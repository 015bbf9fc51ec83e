package io.pqfmt.ast;

import java.util.List;

/**
 * A {@code #datetime(year, month, day, hour, minute, second)} constructor.
 *
 * @param arguments the six components
 */
public record HashDatetimeExpr(List<Expr> arguments) implements HashConstructorExpr {
  /** Creates a new HashDatetimeExpr, requiring six components. */
  public HashDatetimeExpr {
    if (arguments.size() != 6) {
      throw new IllegalArgumentException("#datetime takes 6 arguments");
    }
    arguments = List.copyOf(arguments);
  }

  @Override
  public String keyword() {
    return "#datetime";
  }
}
