package io.pqfmt.ast;

/**
 * A comment kept from the source and attached to a neighbouring node.
 *
 * @param kind whether this is a line or block comment
 * @param text the comment content without its markers
 */
public record Trivia(Kind kind, String text) {
  /** The comment style. */
  public enum Kind {
    /** A {@code //} comment, running to the end of the line. */
    LINE_COMMENT,
    /** A {@code /* *\/} comment. */
    BLOCK_COMMENT
  }

  /** Creates a line comment. */
  public static Trivia line(String text) {
    return new Trivia(Kind.LINE_COMMENT, text);
  }

  /** Creates a block comment. */
  public static Trivia block(String text) {
    return new Trivia(Kind.BLOCK_COMMENT, text);
  }

  /** Returns true for line comments, which must be followed by a line break. */
  public boolean isLineComment() {
    return kind == Kind.LINE_COMMENT;
  }

  /**
   * Renders this comment with its markers. Line comments get a single space after {@code //}
   * unless the content already starts with one.
   *
   * @return the comment source text
   */
  public String render() {
    if (kind == Kind.BLOCK_COMMENT) {
      return "/*" + text + "*/";
    }
    return text.isEmpty() || text.startsWith(" ") ? "//" + text : "// " + text;
  }
}
