package io.blockperf.collector.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private static final Map<String, String> DEFAULTS = Map.of("logFile", "", "sink", "log", "localPort", "3001");

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(Map.of("logFile", "/yaml/node.json", "sink", "file")),
        Map.of("sink", "http"),
        DEFAULTS,
        warnings::add);

    assertEquals("/yaml/node.json", merged.get("logFile"));
    assertEquals("http", merged.get("sink"));
    assertEquals("3001", merged.get("localPort"));
    assertEquals(List.of("CLI overrides YAML for key: sink"), warnings);
  }

  @Test
  void missingYamlUsesDefaultsAndCli() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run", Optional.empty(), Map.of("logFile", "/cli/node.json"), DEFAULTS, null);

    assertEquals("/cli/node.json", merged.get("logFile"));
    assertEquals("log", merged.get("sink"));
  }

  @Test
  void unknownKeysAreRejectedFromEitherSource() {
    IllegalArgumentException fromYaml = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("run", Optional.of(Map.of("logfile", "x")), Map.of(), DEFAULTS, null));
    assertEquals("YAML setting 'logfile' is not recognized", fromYaml.getMessage());

    IllegalArgumentException fromCli = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("run", Optional.empty(), Map.of("bogus", "1"), DEFAULTS, null));
    assertEquals("CLI setting 'bogus' is not recognized", fromCli.getMessage());
  }

  @Test
  void onlyApiKeyIsSecret() {
    assertTrue(ConfigMerger.isSecret("apiKey"));
    assertFalse(ConfigMerger.isSecret("apiUrl"));
  }
}
