package io.pqfmt.ast;

import java.util.List;

/**
 * A {@code #datetimezone(year, month, day, hour, minute, second, offsetHours, offsetMinutes)}
 * constructor.
 *
 * @param arguments the eight components
 */
public record HashDatetimezoneExpr(List<Expr> arguments) implements HashConstructorExpr {
  /** Creates a new HashDatetimezoneExpr, requiring eight components. */
  public HashDatetimezoneExpr {
    if (arguments.size() != 8) {
      throw new IllegalArgumentException("#datetimezone takes 8 arguments");
    }
    arguments = List.copyOf(arguments);
  }

  @Override
  public String keyword() {
    return "#datetimezone";
  }
}
