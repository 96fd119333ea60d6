package io.blockperf.collector.infrastructure.metrics;

import io.blockperf.collector.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Forwards collector counters and observations to OpenTelemetry.
 *
 * <p>{@link #increment(String)} maps to a {@link LongCounter} and {@link #observe(String, long)} to a
 * {@link LongHistogram}, one instrument per key, named after the key with characters outside
 * {@code [a-z0-9._-]} replaced by {@code _}. The original key travels as the {@code blockperf.metric.key}
 * attribute.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("blockperf.metric.key");
  private static final String FALLBACK_METRIC_NAME = "blockperf.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter configured through {@code otel.*} properties.
   *
   * @param serviceVersion collector version reported as {@code service.version}
   */
  public OpenTelemetryMetricsAdapter(String serviceVersion) {
    this(OpenTelemetryBootstrap.initialize(Objects.requireNonNull(serviceVersion, "serviceVersion")));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Counter instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /** Indicates whether metrics are discarded. */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Counter createCounter(String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("blockperf counter " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram createHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("blockperf observation " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder result = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Counter(LongCounter counter, Attributes attributes) {}

  private record Histogram(LongHistogram histogram, Attributes attributes) {}
}
