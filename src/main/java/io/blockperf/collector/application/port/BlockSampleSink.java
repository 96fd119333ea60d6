package io.blockperf.collector.application.port;

import io.blockperf.collector.domain.block.BlockSample;

/**
 * <strong>What:</strong> Port receiving each finalized block sample exactly once.
 * <p><strong>Why:</strong> The correlation engine only guarantees at-most-once emission; delivery, serialization,
 * and any retry policy belong to the sink.</p>
 * <p><strong>Thread-safety:</strong> Called from the dispatcher thread. Implementations must not block for network
 * I/O on that thread and should not throw; failures are to be logged and counted by the sink.</p>
 *
 * @since 0.1.0
 */
public interface BlockSampleSink extends AutoCloseable {
  /**
   * Hands a finalized sample to the sink.
   *
   * @param sample sample to deliver; never {@code null}
   */
  void accept(BlockSample sample);

  /**
   * Releases sink resources, waiting briefly for in-flight deliveries.
   */
  @Override
  default void close() {}
}
