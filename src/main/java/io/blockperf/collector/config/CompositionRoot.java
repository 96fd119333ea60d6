package io.blockperf.collector.config;

import io.blockperf.collector.application.block.BlockCorrelationEngine;
import io.blockperf.collector.application.block.SampleMetadata;
import io.blockperf.collector.application.classify.EventClassifier;
import io.blockperf.collector.application.peer.PeerStateTracker;
import io.blockperf.collector.application.pipeline.CollectorUseCase;
import io.blockperf.collector.application.pipeline.EventDispatcher;
import io.blockperf.collector.application.port.BlockSampleSink;
import io.blockperf.collector.application.port.ClockPort;
import io.blockperf.collector.application.port.EventSource;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.application.port.OsConnectionSnapshot;
import io.blockperf.collector.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.blockperf.collector.infrastructure.os.ProcNetTcpConnectionSnapshot;
import io.blockperf.collector.infrastructure.report.LoggingPeerReporter;
import io.blockperf.collector.infrastructure.sink.BlockSampleJson;
import io.blockperf.collector.infrastructure.sink.FileBlockSampleSink;
import io.blockperf.collector.infrastructure.sink.HttpBlockSampleSink;
import io.blockperf.collector.infrastructure.sink.LoggingBlockSampleSink;
import io.blockperf.collector.infrastructure.source.JournaldEventSource;
import io.blockperf.collector.infrastructure.source.JsonLinesFileEventSource;
import io.blockperf.collector.infrastructure.source.NodeLogLineParser;
import io.blockperf.collector.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the collector use case to its concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from {@link CollectorConfig} to a runnable graph in one place so the
 * CLI and tests build identical pipelines.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on the startup thread.</p>
 * <p><strong>Lifecycle:</strong> Owns the metrics adapter it creates; {@link #close()} flushes and shuts it down.
 * Injected metrics are left to the caller.</p>
 *
 * @since 0.1.0
 * @see CollectorUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private final CollectorConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final OsConnectionSnapshot osSnapshot;
  private final OpenTelemetryMetricsAdapter ownedMetrics;

  /**
   * Creates a root backed by OpenTelemetry metrics, the system clock, and {@code /proc}.
   *
   * @param config validated collector configuration
   */
  public CompositionRoot(CollectorConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(CollectorVersion.current()));
  }

  /**
   * Creates a root with caller-supplied metrics, clock, and OS snapshot.
   *
   * @param config validated collector configuration
   * @param metrics metrics sink shared by all components
   * @param clock collector clock
   * @param osSnapshot OS connection source used for reconciliation
   */
  public CompositionRoot(
      CollectorConfig config, MetricsPort metrics, ClockPort clock, OsConnectionSnapshot osSnapshot) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.osSnapshot = Objects.requireNonNull(osSnapshot, "osSnapshot");
    this.ownedMetrics = null;
  }

  private CompositionRoot(CollectorConfig config, OpenTelemetryMetricsAdapter metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics;
    this.clock = new SystemClockAdapter();
    this.osSnapshot = new ProcNetTcpConnectionSnapshot(config.localEndpoint().port(), config.nodePid());
    this.ownedMetrics = metrics;
  }

  /**
   * Builds the collector graph.
   *
   * @return a fresh use case; each call creates new trackers, engine, source, and sink
   * @throws IOException if the sample sink cannot be opened
   */
  public CollectorUseCase collectorUseCase() throws IOException {
    EventClassifier classifier = new EventClassifier(metrics);
    PeerStateTracker peers = new PeerStateTracker(metrics, clock);
    BlockSampleSink sink = newSink();
    SampleMetadata metadata = new SampleMetadata(CollectorVersion.current(), config.localEndpoint());
    BlockCorrelationEngine blocks = new BlockCorrelationEngine(
        config.network(), metadata, sink, clock, metrics, config.correlationSettings());
    EventDispatcher dispatcher = new EventDispatcher(classifier, peers, blocks, metrics);
    return new CollectorUseCase(
        newSource(),
        dispatcher,
        peers,
        blocks,
        osSnapshot,
        new LoggingPeerReporter(metrics),
        sink,
        metrics,
        config.collectorSettings());
  }

  /** Metrics sink shared by the graph. */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Clock shared by the graph. */
  public ClockPort clock() {
    return clock;
  }

  /** Configuration this root was built from. */
  public CollectorConfig config() {
    return config;
  }

  private EventSource newSource() {
    return switch (config.source()) {
      case FILE -> new JsonLinesFileEventSource(
          config.logFile(), config.follow(), config.pollInterval(), new NodeLogLineParser(), metrics);
      case JOURNALD -> new JournaldEventSource(
          JournaldEventSource.journalctlCommand(config.unit()),
          config.pollInterval(),
          new NodeLogLineParser(),
          metrics);
    };
  }

  private BlockSampleSink newSink() throws IOException {
    BlockSampleJson json = new BlockSampleJson();
    return switch (config.sink()) {
      case LOG -> new LoggingBlockSampleSink(json, metrics);
      case FILE -> new FileBlockSampleSink(config.sinkFile(), json, metrics);
      case HTTP -> new HttpBlockSampleSink(config.apiUrl(), config.apiKey(), config.clientId(), json, metrics);
    };
  }

  @Override
  public void close() {
    if (ownedMetrics != null) {
      ownedMetrics.close();
    }
  }
}
