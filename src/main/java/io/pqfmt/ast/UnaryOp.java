package io.pqfmt.ast;

/** Prefix operators. */
public enum UnaryOp {
  NOT("not "),
  NEGATE("-"),
  PLUS("+");

  private final String prefix;

  UnaryOp(String prefix) {
    this.prefix = prefix;
  }

  /** Returns the text written before the operand. */
  public String prefix() {
    return prefix;
  }
}
