package io.pqfmt;

/**
 * A single problem found in the input.
 *
 * @param message a human-readable description
 * @param span where the problem was found
 */
public record Diagnostic(String message, Span span) {
  /** Returns the 1-based line of the problem. */
  public int line() {
    return span.line();
  }

  /** Returns the 1-based column of the problem. */
  public int column() {
    return span.column();
  }

  @Override
  public String toString() {
    return "Line " + span.line() + ": " + message;
  }
}
