package io.pqfmt;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Unit tests for Span. */
public class SpanTest {

  @Test
  void testMergeCoversBoth() {
    Span merged = new Span(4, 6, 1, 5).merge(new Span(10, 15, 2, 3));
    assertEquals(4, merged.start());
    assertEquals(15, merged.end());
  }

  @Test
  void testMergeKeepsReceiverPosition() {
    Span merged = new Span(10, 12, 2, 5).merge(new Span(0, 3, 1, 1));
    assertEquals(new Span(0, 12, 2, 5), merged);
  }

  @Test
  void testMergeOfNestedSpan() {
    Span outer = new Span(0, 20, 1, 1);
    assertEquals(outer, outer.merge(new Span(5, 8, 1, 6)));
  }

  @Test
  void testLength() {
    assertEquals(3, new Span(2, 5, 1, 3).length());
    assertEquals(1, new Span(7, 7, 1, 8).length());
  }
}
