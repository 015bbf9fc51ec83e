package io.pqfmt;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pqfmt.format.FormatConfig;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance/format.json. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode CASES;

  @BeforeAll
  static void loadCases() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance/format.json")) {
      assertNotNull(in, "conformance/format.json not on the test classpath");
      CASES = MAPPER.readTree(in);
    }
  }

  private static FormatConfig preset(String name) {
    return switch (name) {
      case "compact" -> FormatConfig.compact();
      case "expanded" -> FormatConfig.expanded();
      case "defaults" -> FormatConfig.defaults();
      default -> throw new IllegalArgumentException("unknown preset: " + name);
    };
  }

  @TestFactory
  Stream<DynamicTest> formatTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("format")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      String expected = tc.get("expected").asText();
      FormatConfig config = preset(tc.get("preset").asText());

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                String output = PqFormatter.format(input, config);
                assertEquals(expected, output, "format(" + input + ")");

                // Formatting is idempotent
                assertEquals(output, PqFormatter.format(output, config), "reformat: " + name);
                assertTrue(PqFormatter.isValid(output), "output does not parse: " + name);
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> invalidTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("invalid")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      JsonNode message = tc.get("message");

      tests.add(
          DynamicTest.dynamicTest(
              "invalid/" + name,
              () -> {
                PqfmtException e =
                    assertThrows(PqfmtException.class, () -> PqFormatter.format(input));
                if (message != null) {
                  assertEquals(message.asText(), e.getMessage());
                }
                assertFalse(PqFormatter.isValid(input));
              }));
    }
    return tests.stream();
  }
}
