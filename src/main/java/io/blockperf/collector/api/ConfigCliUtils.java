package io.blockperf.collector.api;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls the YAML file location out of CLI settings before they are merged.
 */
final class ConfigCliUtils {
  static final Path DEFAULT_CONFIG = Path.of("/etc/blockperf/blockperf.yaml");

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=} from {@code args}.
   *
   * @param args mutable CLI settings
   * @return the explicit path, or empty when none was given
   * @throws IllegalArgumentException if the value is not a valid path
   */
  static Optional<Path> extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return Optional.empty();
    }
    String value = args.remove("config");
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String explicit = value.trim();
    try {
      return Optional.of(Path.of(explicit));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("config is not a valid path: " + explicit, ex);
    }
  }
}
