package io.blockperf.collector.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlankAndNull() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("test", null));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("apiKey", "v\u2603l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("apiKey", "abc", 2));
  }
}
