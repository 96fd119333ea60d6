package io.blockperf.collector.validation;

/**
 * Numeric validation helpers used by configuration parsing.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal long and validates its range.
   *
   * @param name logical parameter name
   * @param raw text to parse
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException when the text is not numeric or out of range
   */
  public static long parseRange(String name, String raw, long min, long max) {
    String text = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name) + " must be numeric (was " + text + ")", ex);
    }
    return requireRange(name, value, min, max);
  }
}
