package io.blockperf.collector.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded default settings per CLI command, flattened to strings like YAML and CLI values.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested command merged over the common defaults.
   *
   * @param mode CLI command; only {@code run} has settings
   * @return unmodifiable defaults
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("network", CollectorConfig.DEFAULT_NETWORK);
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("source", CollectorConfig.DEFAULT_SOURCE.name().toLowerCase(Locale.ROOT));
    map.put("logFile", "");
    map.put("unit", CollectorConfig.DEFAULT_UNIT);
    map.put("follow", Boolean.toString(CollectorConfig.DEFAULT_FOLLOW));
    map.put("pollMillis", Integer.toString(CollectorConfig.DEFAULT_POLL_MILLIS));
    map.put("networkMagic", "");
    map.put("systemStart", "");
    map.put("slotLengthMillis", Integer.toString(CollectorConfig.DEFAULT_SLOT_LENGTH_MILLIS));
    map.put("localAddress", CollectorConfig.DEFAULT_LOCAL_ADDRESS);
    map.put("localPort", Integer.toString(CollectorConfig.DEFAULT_LOCAL_PORT));
    map.put("nodePid", "");
    map.put("reconcileIntervalSeconds", Integer.toString(CollectorConfig.DEFAULT_RECONCILE_SECONDS));
    map.put("sweepIntervalSeconds", Integer.toString(CollectorConfig.DEFAULT_SWEEP_SECONDS));
    map.put("staleAfterSeconds", Integer.toString(CollectorConfig.DEFAULT_STALE_AFTER_SECONDS));
    map.put("retiredHashCapacity", Integer.toString(CollectorConfig.DEFAULT_RETIRED_HASH_CAPACITY));
    map.put("reportIntervalSeconds", Integer.toString(CollectorConfig.DEFAULT_REPORT_SECONDS));
    map.put("sink", CollectorConfig.DEFAULT_SINK.name().toLowerCase(Locale.ROOT));
    map.put("apiUrl", "");
    map.put("apiKey", "");
    map.put("clientId", "");
    map.put("sinkFile", "");
    return map;
  }
}
