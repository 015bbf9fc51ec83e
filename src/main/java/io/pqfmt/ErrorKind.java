package io.pqfmt;

/** The stage that rejected the input. */
public enum ErrorKind {
  /** Lexer error - the failing token could not be scanned. */
  LEX("lex"),
  /** Parser error - invalid syntax. */
  PARSE("parse"),
  /** Nesting limit error - the input is nested too deeply to parse. */
  LIMIT("limit");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
