package io.pqfmt;

import java.nio.charset.StandardCharsets;
import java.util.List;

/** Exception thrown when an input cannot be lexed or parsed. */
public final class PqfmtException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The problem, with its location. */
  private final Diagnostic diagnostic;

  /** The original input string. */
  private final String input;

  private PqfmtException(ErrorKind kind, String message, Span span, String input) {
    super(message);
    this.kind = kind;
    this.diagnostic = new Diagnostic(message, span);
    this.input = input;
  }

  /**
   * Creates a new lexer error, raised when the parser reaches an invalid token.
   *
   * @param message the lexer's description of the token
   * @param span the location of the token
   * @param input the original input string
   * @return a new PqfmtException for a lexer error
   */
  public static PqfmtException lex(String message, Span span, String input) {
    return new PqfmtException(ErrorKind.LEX, message, span, input);
  }

  /**
   * Creates a new parser error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @return a new PqfmtException for a parser error
   */
  public static PqfmtException parse(String message, Span span, String input) {
    return new PqfmtException(ErrorKind.PARSE, message, span, input);
  }

  /**
   * Creates a new nesting limit error.
   *
   * @param message the error message
   * @param span the location where the limit was hit
   * @param input the original input string
   * @return a new PqfmtException for a nesting limit error
   */
  public static PqfmtException limit(String message, Span span, String input) {
    return new PqfmtException(ErrorKind.LIMIT, message, span, input);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the diagnostic describing this error.
   *
   * @return the diagnostic
   */
  public Diagnostic diagnostic() {
    return diagnostic;
  }

  /**
   * Returns this error as a diagnostic list. Parsing stops at the first error, so the list always
   * holds exactly one entry.
   *
   * @return a single-element list
   */
  public List<Diagnostic> diagnostics() {
    return List.of(diagnostic);
  }

  /**
   * Returns the span where the error occurred.
   *
   * @return the span
   */
  public Span span() {
    return diagnostic.span();
  }

  /**
   * Returns the original input string.
   *
   * @return the input
   */
  public String input() {
    return input;
  }

  /**
   * Formats a rich error message with the offending line and an underline.
   *
   * <pre>
   * error: Expected ']', found end of input
   *   --&gt; line 1, column 7
   *   [A = 1
   *         ^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    Span span = diagnostic.span();
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage()).append("\n");
    sb.append("  --> line ").append(span.line()).append(", column ").append(span.column());

    String[] lines = input.split("\n", -1);
    if (span.line() < 1 || span.line() > lines.length) {
      return sb.toString();
    }
    String text = lines[span.line() - 1];
    if (text.endsWith("\r")) {
      text = text.substring(0, text.length() - 1);
    }
    sb.append("\n  ").append(text).append("\n");

    // Add padding and underline
    sb.append(" ".repeat(span.column() + 1));
    sb.append("^".repeat(underlineWidth(text, span)));
    return sb.toString();
  }

  private static int underlineWidth(String line, Span span) {
    int before = Math.min(span.column() - 1, line.codePointCount(0, line.length()));
    int index = line.offsetByCodePoints(0, before);
    int budget = span.end() - span.start();
    int width = 0;
    while (index < line.length() && budget > 0) {
      int cp = line.codePointAt(index);
      budget -= new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
      index += Character.charCount(cp);
      width++;
    }
    return Math.max(1, width);
  }
}
