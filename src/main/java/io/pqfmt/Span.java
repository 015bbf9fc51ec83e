package io.pqfmt;

/**
 * A region of the source text.
 *
 * <p>Offsets are UTF-8 byte positions. Line and column describe the start of the region and are
 * 1-based; columns count code points.
 *
 * @param start the start offset (inclusive)
 * @param end the end offset (exclusive)
 * @param line the line of the first character
 * @param column the column of the first character
 */
public record Span(int start, int end, int line, int column) {
  /**
   * Returns the length of this span, never less than one.
   *
   * @return the number of bytes covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns the smallest span covering both this span and {@code other}.
   *
   * @param other the span to merge with
   * @return the merged span, keeping this span's line and column
   */
  public Span merge(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end), line, column);
  }
}
