package io.pqfmt.format;

/**
 * Options controlling the formatter's layout decisions.
 *
 * <p>Instances are immutable. Start from {@link #defaults()}, {@link #compact()} or {@link
 * #expanded()} and adjust with the {@code withX} methods.
 *
 * @param indentSize spaces per indentation level when not using tabs
 * @param useTabs indent with one tab per level instead of spaces
 * @param maxLineLength the target line width
 * @param trailingComma write a comma after the last item of expanded records, lists and argument
 *     lists
 * @param spaceInBrackets pad the inside of single-line records: {@code [ A = 1 ]}
 * @param spaceInBraces pad the inside of single-line lists: {@code { 1, 2 }}
 * @param spaceInParens pad the inside of parenthesized expressions: {@code ( 1 + 2 )}
 * @param alignEquals align the {@code =} of expanded let bindings and record fields
 * @param multilineThreshold records, lists and calls with more entries than this are candidates
 *     for expansion
 * @param alwaysExpandLet never write a let on one line
 * @param alwaysExpandRecords never write a non-empty record on one line
 * @param alwaysExpandLists never write a non-empty list on one line
 * @param preserveBlankLines keep blank lines between bindings; reserved, currently has no effect
 * @param maxBlankLines the most consecutive blank lines kept; reserved, currently has no effect
 */
public record FormatConfig(
    int indentSize,
    boolean useTabs,
    int maxLineLength,
    boolean trailingComma,
    boolean spaceInBrackets,
    boolean spaceInBraces,
    boolean spaceInParens,
    boolean alignEquals,
    int multilineThreshold,
    boolean alwaysExpandLet,
    boolean alwaysExpandRecords,
    boolean alwaysExpandLists,
    boolean preserveBlankLines,
    int maxBlankLines) {

  /** Validates the size options. */
  public FormatConfig {
    requireNonNegative("indentSize", indentSize);
    requireNonNegative("maxLineLength", maxLineLength);
    requireNonNegative("multilineThreshold", multilineThreshold);
    requireNonNegative("maxBlankLines", maxBlankLines);
  }

  /**
   * Returns the default layout: four-space indents, 120 columns, and every let expanded.
   *
   * @return the default configuration
   */
  public static FormatConfig defaults() {
    return new FormatConfig(4, false, 120, false, false, false, false, false, 1, true, false, false,
        true, 2);
  }

  /**
   * Returns a dense layout that keeps short constructs on one line.
   *
   * @return the compact configuration
   */
  public static FormatConfig compact() {
    return defaults()
        .withMaxLineLength(200)
        .withMultilineThreshold(100)
        .withAlwaysExpandLet(false)
        .withAlwaysExpandRecords(false)
        .withAlwaysExpandLists(false);
  }

  /**
   * Returns a layout that expands every let, record and list.
   *
   * @return the expanded configuration
   */
  public static FormatConfig expanded() {
    return defaults()
        .withMultilineThreshold(1)
        .withAlwaysExpandLet(true)
        .withAlwaysExpandRecords(true)
        .withAlwaysExpandLists(true);
  }

  /**
   * Returns the text of one indentation level.
   *
   * @return a tab, or {@link #indentSize()} spaces
   */
  public String indentUnit() {
    return useTabs ? "\t" : " ".repeat(indentSize);
  }

  /**
   * Returns the indentation text for a nesting level.
   *
   * @param level the nesting level, zero or more
   * @return the indentation text
   */
  public String indentAt(int level) {
    return indentUnit().repeat(Math.max(0, level));
  }

  public FormatConfig withIndentSize(int indentSize) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withUseTabs(boolean useTabs) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withMaxLineLength(int maxLineLength) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withTrailingComma(boolean trailingComma) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withSpaceInBrackets(boolean spaceInBrackets) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withSpaceInBraces(boolean spaceInBraces) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withSpaceInParens(boolean spaceInParens) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withAlignEquals(boolean alignEquals) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withMultilineThreshold(int multilineThreshold) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withAlwaysExpandLet(boolean alwaysExpandLet) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withAlwaysExpandRecords(boolean alwaysExpandRecords) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withAlwaysExpandLists(boolean alwaysExpandLists) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withPreserveBlankLines(boolean preserveBlankLines) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  public FormatConfig withMaxBlankLines(int maxBlankLines) {
    return new FormatConfig(indentSize, useTabs, maxLineLength, trailingComma, spaceInBrackets,
        spaceInBraces, spaceInParens, alignEquals, multilineThreshold, alwaysExpandLet,
        alwaysExpandRecords, alwaysExpandLists, preserveBlankLines, maxBlankLines);
  }

  private static void requireNonNegative(String name, int value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must not be negative: " + value);
    }
  }
}
