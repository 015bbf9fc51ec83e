package io.pqfmt.format;

import io.pqfmt.ast.Identifier;
import java.math.BigDecimal;

/** Source spellings of literals and names. */
final class Literals {
  private static final double LONG_FORM_LIMIT = 1e15;

  private Literals() {}

  /**
   * Renders a number. Integral values print without a fractional part; other values print the
   * shortest decimal that reads back as the same double, never in exponent notation.
   */
  static String number(double value) {
    if (Double.isNaN(value)) {
      return "#nan";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "#infinity" : "-#infinity";
    }
    if (value == Math.rint(value) && Math.abs(value) < LONG_FORM_LIMIT) {
      return Long.toString((long) value);
    }
    return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
  }

  /** Renders a text literal with its quotes and escapes. */
  static String text(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\"\"");
        case '\r' -> sb.append("#(cr)");
        case '\n' -> sb.append("#(lf)");
        case '\t' -> sb.append("#(tab)");
        case '#' -> {
          // a literal "#(" would read back as an escape
          if (i + 1 < value.length() && value.charAt(i + 1) == '(') {
            sb.append("#(#)");
          } else {
            sb.append('#');
          }
        }
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  /** Renders a quoted name {@code #"..."}. */
  static String quoted(String name) {
    return "#\"" + name.replace("\"", "\"\"") + "\"";
  }

  /** Renders a name, quoting it if it was quoted in the source. */
  static String identifier(Identifier identifier) {
    return identifier.quoted() ? quoted(identifier.name()) : identifier.name();
  }
}
