package io.blockperf.collector.api;

import io.blockperf.collector.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} tokens into a settings map. Stateless.
 */
public final class CliArgsParser {
  private static final Pattern KEY = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");

  private CliArgsParser() {}

  /**
   * Parses tokens, splitting each on its first {@code '='}. Later tokens win for repeated keys.
   *
   * @param args tokens; {@code null} yields an empty map
   * @return mutable map in command-line order
   * @throws IllegalArgumentException for tokens without a key, an invalid key, or control characters in a value
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int eq = arg.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("expected key=value but was '" + arg + "'");
      }
      String key = arg.substring(0, eq).trim();
      String value = arg.substring(eq + 1).trim();
      if (!KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid setting name: " + key);
      }
      for (int i = 0; i < value.length(); i++) {
        if (Character.isISOControl(value.charAt(i))) {
          throw new IllegalArgumentException("setting " + key + " must not contain control characters");
        }
      }
      // An empty value clears a YAML setting back to its default.
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      settings.put(key, value);
    }
    return settings;
  }
}
