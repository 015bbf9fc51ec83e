package io.pqfmt;

import io.pqfmt.ast.Document;
import io.pqfmt.format.FormatConfig;
import io.pqfmt.format.Formatter;
import io.pqfmt.parser.Parser;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for formatting and validating Power Query M source.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * String formatted = PqFormatter.format("let x=1,y=2 in x+y", FormatConfig.compact());
 * List<Diagnostic> problems = PqFormatter.validate("[A = 1");
 * }</pre>
 */
public final class PqFormatter {
  private static final Logger log = LoggerFactory.getLogger(PqFormatter.class);

  private PqFormatter() {}

  /**
   * Formats source text with the default configuration.
   *
   * @param input the source text
   * @return the formatted text, ending with a newline
   * @throws PqfmtException if the input does not parse
   */
  public static String format(String input) throws PqfmtException {
    return format(input, FormatConfig.defaults());
  }

  /**
   * Formats source text.
   *
   * @param input the source text
   * @param config the layout options
   * @return the formatted text, ending with a newline
   * @throws PqfmtException if the input does not parse
   */
  public static String format(String input, FormatConfig config) throws PqfmtException {
    Objects.requireNonNull(config, "config");
    log.debug("Formatting {} characters with {}", input.length(), config);
    Document document = Parser.parse(input);
    String output = Formatter.format(document, config);
    log.debug("Formatted output is {} characters", output.length());
    return output;
  }

  /**
   * Parses source text without formatting it.
   *
   * @param input the source text
   * @return the parsed document
   * @throws PqfmtException if the input does not parse
   */
  public static Document parse(String input) throws PqfmtException {
    return Parser.parse(input);
  }

  /**
   * Checks source text for syntax errors without throwing.
   *
   * @param input the source text
   * @return the problems found; empty if the input parses
   */
  public static List<Diagnostic> validate(String input) {
    try {
      Parser.parse(input);
      return List.of();
    } catch (PqfmtException e) {
      log.debug("Validation failed: {}", e.diagnostic());
      return e.diagnostics();
    }
  }

  /**
   * Checks whether source text parses.
   *
   * @param input the source text
   * @return true if the input is a well-formed expression
   */
  public static boolean isValid(String input) {
    return validate(input).isEmpty();
  }
}
