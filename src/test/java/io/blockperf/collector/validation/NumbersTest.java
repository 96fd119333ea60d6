package io.blockperf.collector.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(30, Numbers.requireRange("reconcileIntervalSeconds", 30, 1, 86_400));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("localPort", 0, 1, 65_535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("localPort", 65_536, 1, 65_535));
  }

  @Test
  void parseRangeParsesTrimmedText() {
    assertEquals(764_824_073L, Numbers.parseRange("networkMagic", " 764824073 ", 0, 0xFFFF_FFFFL));
  }

  @Test
  void parseRangeRejectsNonNumericText() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("nodePid", "abc", 1, 100));
    assertEquals("nodePid must be numeric (was abc)", ex.getMessage());
  }
}
