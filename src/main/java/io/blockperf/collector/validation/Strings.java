package io.blockperf.collector.validation;

import java.util.Objects;

/**
 * Checks for text settings taken from the command line or YAML before they reach HTTP headers, paths or logs.
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {

  private Strings() {}

  /**
   * Trims a required value.
   *
   * @param name setting name used in messages; {@code null} reads as {@code value}
   * @param value raw text
   * @return trimmed text
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or holds a control character anywhere
   */
  public static String requireNonBlank(String name, String value) {
    String label = label(name);
    Objects.requireNonNull(value, label);
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Trims a required value limited to visible ASCII ({@code 0x20..0x7E}), such as an API key.
   *
   * @param name setting name used in messages
   * @param value raw text
   * @param maxLength upper bound on the trimmed length; must be positive
   * @return trimmed text
   * @throws IllegalArgumentException if the value is blank, longer than {@code maxLength}, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " must be at most " + maxLength + " characters");
    }
    if (trimmed.chars().anyMatch(c -> c < 0x20 || c > 0x7E)) {
      throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters only");
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
