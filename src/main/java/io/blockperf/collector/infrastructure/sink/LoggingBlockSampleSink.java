package io.blockperf.collector.infrastructure.sink;

import io.blockperf.collector.application.port.BlockSampleSink;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.domain.block.BlockSample;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each sample as a JSON line at INFO on the {@code io.blockperf.collector.samples} logger.
 *
 * @since 0.1.0
 */
public final class LoggingBlockSampleSink implements BlockSampleSink {
  static final String LOGGER_NAME = "io.blockperf.collector.samples";
  private static final Logger samples = LoggerFactory.getLogger(LOGGER_NAME);

  private final BlockSampleJson json;
  private final MetricsPort metrics;

  public LoggingBlockSampleSink(BlockSampleJson json, MetricsPort metrics) {
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void accept(BlockSample sample) {
    samples.info(json.encode(sample));
    metrics.increment("sink.log.written");
  }
}
