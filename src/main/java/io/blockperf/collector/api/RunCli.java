package io.blockperf.collector.api;

import io.blockperf.collector.application.pipeline.CollectorUseCase;
import io.blockperf.collector.config.CollectorConfig;
import io.blockperf.collector.config.CollectorVersion;
import io.blockperf.collector.config.CompositionRoot;
import io.blockperf.collector.config.ConfigMerger;
import io.blockperf.collector.config.DefaultsForMode;
import io.blockperf.collector.config.YamlConfigLoader;
import io.blockperf.collector.logging.LoggingConfigurator;
import io.blockperf.collector.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the collector against a node trace log.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String MODE = "run";
  private static final long SHUTDOWN_WAIT_SECONDS = 10;
  private static final String SUMMARY_USAGE =
      "usage: blockperf run logFile=PATH|source=journald [config=FILE] [network=mainnet|preprod|preview|custom] "
          + "[sink=log|http|file] [apiUrl=URL] [apiKey=KEY] [clientId=ID] [sinkFile=PATH] [follow=true|false] "
          + "[localAddress=IP] [localPort=N] [nodePid=N] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      blockperf run: block propagation and peer state collector

      Usage:
        blockperf run logFile=PATH [options]
        blockperf run source=journald [unit=NAME] [options]

      Source:
        source=file|journald         Read a trace file or the node unit's journal (default file)
        logFile=PATH                 Node JSON trace log, required when source=file
        unit=NAME                    systemd unit read with journalctl when source=journald (default cardano-node)
        follow=true|false            Tail the log (default true) or read it once and exit
        pollMillis=0-60000           Idle wait between reads when tailing (default 250)

      Chain:
        network=NAME                 mainnet, preprod, preview, or custom (default mainnet)
        networkMagic=N               Network magic when network=custom
        systemStart=EPOCH_SECONDS    Slot 0 start time when network=custom
        slotLengthMillis=N           Slot length when network=custom (default 1000)

      Node:
        localAddress=IP              Address stamped onto samples (default 0.0.0.0)
        localPort=1-65535            Node listening port (default 3001)
        nodePid=N                    Node process id; selects its sockets during reconciliation

      Timers:
        reconcileIntervalSeconds=N   Peer reconciliation against OS sockets (default 30)
        sweepIntervalSeconds=N       Stale block record sweep (default 10)
        staleAfterSeconds=N          Age at which unadopted blocks are dropped (default 600)
        retiredHashCapacity=N        Finished block hashes remembered (default 8192)
        reportIntervalSeconds=N      Peer summary log (default 60)

      Samples:
        sink=log|http|file           Sample destination (default log)
        apiUrl=URL                   Sample API base URL when sink=http (default per built-in network)
        apiKey=KEY                   API key sent as X-Api-Key when sink=http
        clientId=ID                  Collector identity sent as X-Client-Id when sink=http
        sinkFile=PATH                JSON-lines output when sink=file

      Telemetry:
        metricsExporter=otlp|none    OpenTelemetry metrics exporter (default none)
        otelEndpoint=URL             OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V   Comma-separated resource attributes

      Other:
        config=FILE                  YAML file with common/run sections (default /etc/blockperf/blockperf.yaml)
        --dry-run                    Validate settings and print the plan without reading the log
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private RunCli() {}

  /**
   * Entry point when launched directly.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Parses settings, builds the collector, and runs it until the log is exhausted or the process is stopped.
   *
   * @param args raw CLI arguments without the command name
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run");
    }
    List<String> unknownFlags = input.unknownFlags("--dry-run");
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", String.join(", ", unknownFlags));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> cli;
    Optional<Path> explicitConfig;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
      explicitConfig = ConfigCliUtils.extractConfigPath(cli);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path configPath = explicitConfig.orElse(ConfigCliUtils.DEFAULT_CONFIG);
    if (explicitConfig.isPresent() && !Files.exists(configPath)) {
      log.error("Config file {} does not exist", configPath);
      return ExitCode.CONFIG_ERROR;
    }
    Optional<Map<String, String>> yaml;
    try {
      yaml = YamlConfigLoader.load(configPath, MODE);
    } catch (IOException ex) {
      log.error("Failed to read config file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid config file {}: {}", configPath, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    yaml.ifPresent(values -> log.debug("Loaded {} settings from {}", values.size(), configPath));

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(MODE, yaml, cli, DefaultsForMode.asFlatMap(MODE), log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid setting: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    log.debug("Effective settings: {}", redactSecrets(effective));
    String exporter = effective.getOrDefault("metricsExporter", "none");
    CollectorConfig config;
    try {
      TelemetryConfigurator.configureMetrics(effective);
      config = CollectorConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid collector configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (dryRun) {
      CliPrinter.printLines(dryRunPlan(config, exporter));
      return ExitCode.SUCCESS;
    }
    return execute(config);
  }

  private static ExitCode execute(CollectorConfig config) {
    CompositionRoot root = new CompositionRoot(config);
    CountDownLatch finished = new CountDownLatch(1);
    Thread shutdownHook = null;
    try {
      CollectorUseCase useCase = root.collectorUseCase();
      shutdownHook = new Thread(() -> stopAndWait(useCase, finished), "blockperf-shutdown");
      Runtime.getRuntime().addShutdownHook(shutdownHook);
      log.info(
          "Starting blockperf {} on {} (network {}, sink {})",
          CollectorVersion.current(),
          describeSource(config),
          config.network().name(),
          config.sink().name().toLowerCase(Locale.ROOT));
      useCase.run();
      log.info("Collector finished after {} events", useCase.eventCount());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Collector I/O failure on {}", describeSource(config), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Collector configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Collector interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in collector", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in collector", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      root.close();
      finished.countDown();
      removeHook(shutdownHook);
    }
  }

  // Waits on the latch rather than the main thread, which blocks in System.exit once hooks are running.
  private static void stopAndWait(CollectorUseCase useCase, CountDownLatch finished) {
    log.info("Shutdown requested; stopping collector");
    useCase.stop();
    try {
      if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Collector did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for collector to stop");
    }
  }

  private static void removeHook(Thread hook) {
    if (hook == null) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; leaving shutdown hook registered");
    }
  }

  private static Map<String, String> redactSecrets(Map<String, String> settings) {
    Map<String, String> copy = new LinkedHashMap<>(settings);
    copy.replaceAll((key, value) -> ConfigMerger.isSecret(key) ? Logs.redact(value) : value);
    return copy;
  }

  private static String describeSource(CollectorConfig config) {
    return switch (config.source()) {
      case FILE -> config.logFile().toString();
      case JOURNALD -> "journal of unit " + config.unit();
    };
  }

  static List<String> dryRunPlan(CollectorConfig config, String metricsExporter) {
    List<String> lines = new ArrayList<>();
    lines.add("Collector dry-run: the node log will not be read.");
    switch (config.source()) {
      case FILE -> lines.add(
          " Log file          : " + config.logFile() + (config.follow() ? " (follow)" : " (once)"));
      case JOURNALD -> lines.add(" Journal unit      : " + config.unit());
    }
    lines.add(" Network           : " + config.network().name() + " (magic " + config.network().magic() + ")");
    lines.add(" Local endpoint    : " + config.localEndpoint());
    lines.add(" Node pid          : "
        + (config.nodePid().isPresent() ? Long.toString(config.nodePid().getAsLong()) : "<none>"));
    lines.add(" Reconcile every   : " + config.reconcileInterval().toSeconds() + "s");
    lines.add(" Sweep every       : " + config.sweepInterval().toSeconds() + "s (stale after "
        + config.staleAfter().toSeconds() + "s)");
    lines.add(" Report every      : " + config.reportInterval().toSeconds() + "s");
    lines.add(" Sink              : " + config.sink().name().toLowerCase(Locale.ROOT));
    switch (config.sink()) {
      case HTTP -> {
        lines.add(" API URL           : " + config.apiUrl());
        lines.add(" API key           : " + Logs.redact(config.apiKey()));
        lines.add(" Client id         : " + (config.clientId() == null ? "<none>" : config.clientId()));
      }
      case FILE -> lines.add(" Sample file       : " + config.sinkFile());
      case LOG -> {
        // Samples go to the log only.
      }
    }
    lines.add(" Metrics exporter  : " + (metricsExporter.isBlank() ? "none" : metricsExporter));
    lines.add(" Re-run without --dry-run to start collecting.");
    return lines;
  }
}
