package io.blockperf.collector.config;

import io.blockperf.collector.application.block.BlockCorrelationSettings;
import io.blockperf.collector.application.pipeline.CollectorSettings;
import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.validation.Net;
import io.blockperf.collector.validation.Numbers;
import io.blockperf.collector.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Effective configuration of the {@code run} command.
 *
 * @param source where trace events are read from
 * @param logFile node JSON trace log to read (file source only)
 * @param unit systemd unit whose journal is read (journald source only)
 * @param follow {@code true} to tail the log, {@code false} to read it once and stop (file source only)
 * @param pollInterval wait between reads when the log has no new data
 * @param network chain profile supplying magic and slot times
 * @param localEndpoint address and port of the tracked node, stamped onto samples and used to classify sockets
 * @param nodePid node process id used to select its sockets, when known
 * @param reconcileInterval period of OS-connection reconciliation
 * @param sweepInterval period of the stale block-record sweep
 * @param staleAfter age after which an unadopted block record is dropped
 * @param retiredHashCapacity number of finished block hashes remembered
 * @param reportInterval period of the peer summary log
 * @param sink sample destination
 * @param apiUrl sample API base URL (HTTP sink only)
 * @param apiKey sample API key (HTTP sink only, may be {@code null})
 * @param clientId collector identity sent to the sample API (HTTP sink only, may be {@code null})
 * @param sinkFile output file (file sink only)
 * @since 0.1.0
 */
public record CollectorConfig(
    SourceType source,
    Path logFile,
    String unit,
    boolean follow,
    Duration pollInterval,
    NetworkProfile network,
    Endpoint localEndpoint,
    OptionalLong nodePid,
    Duration reconcileInterval,
    Duration sweepInterval,
    Duration staleAfter,
    int retiredHashCapacity,
    Duration reportInterval,
    SinkType sink,
    String apiUrl,
    String apiKey,
    String clientId,
    Path sinkFile) {

  static final SourceType DEFAULT_SOURCE = SourceType.FILE;
  static final String DEFAULT_UNIT = "cardano-node";
  static final boolean DEFAULT_FOLLOW = true;
  static final int DEFAULT_POLL_MILLIS = 250;
  static final String DEFAULT_NETWORK = "mainnet";
  static final String DEFAULT_LOCAL_ADDRESS = "0.0.0.0";
  static final int DEFAULT_LOCAL_PORT = 3001;
  static final int DEFAULT_RECONCILE_SECONDS = 30;
  static final int DEFAULT_SWEEP_SECONDS = 10;
  static final int DEFAULT_STALE_AFTER_SECONDS = 600;
  static final int DEFAULT_RETIRED_HASH_CAPACITY = 8_192;
  static final int DEFAULT_REPORT_SECONDS = 60;
  static final SinkType DEFAULT_SINK = SinkType.LOG;
  static final int DEFAULT_SLOT_LENGTH_MILLIS = 1_000;

  private static final int MAX_POLL_MILLIS = 60_000;
  private static final int MAX_INTERVAL_SECONDS = 86_400;
  private static final int MAX_RETIRED_HASH_CAPACITY = 1_000_000;
  private static final int MAX_API_KEY_LENGTH = 512;
  private static final int MAX_CLIENT_ID_LENGTH = 128;
  private static final Pattern UNIT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9:_.@\\-]{0,255}");

  public CollectorConfig {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(network, "network");
    Objects.requireNonNull(localEndpoint, "localEndpoint");
    Objects.requireNonNull(nodePid, "nodePid");
    Objects.requireNonNull(reconcileInterval, "reconcileInterval");
    Objects.requireNonNull(sweepInterval, "sweepInterval");
    Objects.requireNonNull(staleAfter, "staleAfter");
    Objects.requireNonNull(reportInterval, "reportInterval");
    Objects.requireNonNull(sink, "sink");
    if (source == SourceType.FILE && logFile == null) {
      throw new IllegalArgumentException("logFile is required when source=file");
    }
    if (source == SourceType.JOURNALD && (unit == null || unit.isBlank())) {
      throw new IllegalArgumentException("unit is required when source=journald");
    }
    if (sink == SinkType.HTTP && (apiUrl == null || apiUrl.isBlank())) {
      throw new IllegalArgumentException("apiUrl is required when sink=http");
    }
    if (sink == SinkType.FILE && sinkFile == null) {
      throw new IllegalArgumentException("sinkFile is required when sink=file");
    }
  }

  /**
   * Builds a configuration from flattened {@code key=value} settings.
   *
   * @param kv effective settings (defaults, YAML, and CLI already merged)
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static CollectorConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    SourceType source = SourceType.from(kv.get("source"), DEFAULT_SOURCE);
    Path logFile = null;
    String unit = null;
    switch (source) {
      case FILE -> {
        String logFileRaw = kv.get("logFile");
        if (logFileRaw == null || logFileRaw.isBlank()) {
          throw new IllegalArgumentException("logFile is required");
        }
        logFile = parsePath("logFile", logFileRaw);
      }
      case JOURNALD -> unit = parseUnit(firstNonBlank(kv.get("unit"), DEFAULT_UNIT));
    }
    boolean follow = parseBoolean(kv.get("follow"), DEFAULT_FOLLOW);
    int pollMillis = parseBoundedInt(kv, "pollMillis", DEFAULT_POLL_MILLIS, 0, MAX_POLL_MILLIS);

    NetworkProfile network = parseNetwork(kv);

    String localAddress = Net.requireIpLiteral(
        "localAddress", firstNonBlank(kv.get("localAddress"), DEFAULT_LOCAL_ADDRESS));
    int localPort = parseBoundedInt(kv, "localPort", DEFAULT_LOCAL_PORT, 1, 65_535);
    OptionalLong nodePid = OptionalLong.empty();
    String pidRaw = kv.get("nodePid");
    if (pidRaw != null && !pidRaw.isBlank()) {
      nodePid = OptionalLong.of(Numbers.parseRange("nodePid", pidRaw.trim(), 1, Integer.MAX_VALUE));
    }

    int reconcileSeconds =
        parseBoundedInt(kv, "reconcileIntervalSeconds", DEFAULT_RECONCILE_SECONDS, 1, MAX_INTERVAL_SECONDS);
    int sweepSeconds = parseBoundedInt(kv, "sweepIntervalSeconds", DEFAULT_SWEEP_SECONDS, 1, MAX_INTERVAL_SECONDS);
    int staleSeconds =
        parseBoundedInt(kv, "staleAfterSeconds", DEFAULT_STALE_AFTER_SECONDS, 1, MAX_INTERVAL_SECONDS);
    int retiredCapacity = parseBoundedInt(
        kv, "retiredHashCapacity", DEFAULT_RETIRED_HASH_CAPACITY, 1, MAX_RETIRED_HASH_CAPACITY);
    int reportSeconds = parseBoundedInt(kv, "reportIntervalSeconds", DEFAULT_REPORT_SECONDS, 1, MAX_INTERVAL_SECONDS);

    SinkType sink = SinkType.from(kv.get("sink"), DEFAULT_SINK);
    String apiUrl = null;
    String apiKey = null;
    String clientId = null;
    Path sinkFile = null;
    switch (sink) {
      case HTTP -> {
        String rawUrl = kv.get("apiUrl");
        if (rawUrl == null || rawUrl.isBlank()) {
          rawUrl = network.defaultApiUrl().orElseThrow(() -> new IllegalArgumentException(
              "apiUrl is required when sink=http and network=" + network.name()));
        }
        apiUrl = Net.validateHttpUrl("apiUrl", rawUrl);
        String rawKey = kv.get("apiKey");
        if (rawKey != null && !rawKey.isBlank()) {
          apiKey = Strings.requirePrintableAscii("apiKey", rawKey, MAX_API_KEY_LENGTH);
        }
        String rawClientId = kv.get("clientId");
        if (rawClientId != null && !rawClientId.isBlank()) {
          clientId = Strings.requirePrintableAscii("clientId", rawClientId, MAX_CLIENT_ID_LENGTH);
        }
      }
      case FILE -> {
        String rawFile = kv.get("sinkFile");
        if (rawFile == null || rawFile.isBlank()) {
          throw new IllegalArgumentException("sinkFile is required when sink=file");
        }
        sinkFile = parsePath("sinkFile", rawFile);
      }
      case LOG -> {
        // Nothing else to configure.
      }
    }

    return new CollectorConfig(
        source,
        logFile,
        unit,
        follow,
        Duration.ofMillis(pollMillis),
        network,
        new Endpoint(localAddress, localPort),
        nodePid,
        Duration.ofSeconds(reconcileSeconds),
        Duration.ofSeconds(sweepSeconds),
        Duration.ofSeconds(staleSeconds),
        retiredCapacity,
        Duration.ofSeconds(reportSeconds),
        sink,
        apiUrl,
        apiKey,
        clientId,
        sinkFile);
  }

  /** Timer periods for the collector use case. */
  public CollectorSettings collectorSettings() {
    return new CollectorSettings(reconcileInterval, sweepInterval, reportInterval);
  }

  /** Staleness and retired-hash tuning for the correlation engine. */
  public BlockCorrelationSettings correlationSettings() {
    return new BlockCorrelationSettings(staleAfter, retiredHashCapacity);
  }

  private static NetworkProfile parseNetwork(Map<String, String> kv) {
    String name = firstNonBlank(kv.get("network"), DEFAULT_NETWORK).trim().toLowerCase(Locale.ROOT);
    if (!name.equals("custom")) {
      return NetworkProfile.named(name);
    }
    String magicRaw = kv.get("networkMagic");
    String startRaw = kv.get("systemStart");
    if (magicRaw == null || magicRaw.isBlank() || startRaw == null || startRaw.isBlank()) {
      throw new IllegalArgumentException("network=custom requires networkMagic and systemStart");
    }
    long magic = Numbers.parseRange("networkMagic", magicRaw.trim(), 0, 0xFFFF_FFFFL);
    long start = Numbers.parseRange("systemStart", startRaw.trim(), 0, Long.MAX_VALUE / 1_000);
    int slotMillis = parseBoundedInt(kv, "slotLengthMillis", DEFAULT_SLOT_LENGTH_MILLIS, 1, 3_600_000);
    return new NetworkProfile("custom", magic, Instant.ofEpochSecond(start), Duration.ofMillis(slotMillis));
  }

  private static String parseUnit(String raw) {
    String unit = Strings.requireNonBlank("unit", raw);
    if (!UNIT_NAME.matcher(unit).matches()) {
      throw new IllegalArgumentException("unit is not a valid systemd unit name (was " + unit + ")");
    }
    return unit;
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("expected true or false but was " + value.trim());
    };
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
