package io.blockperf.collector.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the collector YAML file: the {@code common} section first, then the command's own section on top of it.
 * Section names match case-insensitively and nested mappings become dotted keys.
 *
 * <pre>
 * common:
 *   network: preprod
 * run:
 *   logFile: /var/log/cardano/node.json
 *   sink: http
 *   apiUrl: https://api.example.org
 * </pre>
 *
 * <p>Scalars are kept as their YAML text ({@code 3001}, {@code true}); an empty value reads as {@code ""}.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads and flattens one command's settings.
   *
   * @param path YAML file
   * @param mode command section merged over {@code common}, e.g. {@code run}
   * @return settings, empty when the file does not exist, an empty map for an empty document
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or a section is not a mapping of scalars
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (NoSuchFileException missing) {
      return Optional.empty();
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config at " + path + " must be a mapping of sections");
    }

    Map<String, String> settings = new LinkedHashMap<>();
    for (String wanted : new String[] {COMMON_SECTION, section}) {
      for (Map.Entry<?, ?> entry : root.entrySet()) {
        if (entry.getKey() instanceof String name && name.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
          if (!(entry.getValue() instanceof Map<?, ?> body)) {
            throw new IllegalArgumentException("YAML section '" + name + "' must be a mapping");
          }
          flatten("", body, settings);
        }
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static void flatten(String prefix, Map<?, ?> node, Map<String, String> out) {
    node.forEach((rawKey, value) -> {
      if (!(rawKey instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException("YAML keys must be non-blank strings (under '" + prefix + "')");
      }
      String path = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(path, nested, out);
      } else if (value instanceof Collection<?>) {
        throw new IllegalArgumentException("YAML lists are not supported (key " + path + ")");
      } else {
        out.put(path, value == null ? "" : value.toString());
      }
    });
  }
}
