package io.blockperf.collector.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {
  private static final Set<String> SECRET_KEYS = Set.of("apiKey");

  private ConfigMerger() {}

  /**
   * Builds the effective settings map.
   *
   * @param mode active command
   * @param yaml optional YAML settings for the command
   * @param cli CLI overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn receives a message for each CLI key that overrides a YAML key
   * @return immutable merged settings
   * @throws IllegalArgumentException when a key is not known for the command
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    requireKnownKeys("YAML", yamlCopy, defaultsCopy);
    merged.putAll(yamlCopy);

    requireKnownKeys("CLI", cliCopy, defaultsCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  /**
   * Indicates whether a key holds a credential that must be redacted when printed.
   *
   * @param key settings key
   * @return {@code true} for secret keys
   */
  public static boolean isSecret(String key) {
    return SECRET_KEYS.contains(key);
  }

  private static void requireKnownKeys(String source, Map<String, String> settings, Map<String, String> defaults) {
    if (defaults.isEmpty()) {
      return;
    }
    for (String key : settings.keySet()) {
      if (key == null || !defaults.containsKey(key)) {
        throw new IllegalArgumentException(source + " setting '" + key + "' is not recognized");
      }
    }
  }
}
