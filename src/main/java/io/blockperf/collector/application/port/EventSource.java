package io.blockperf.collector.application.port;

import io.blockperf.collector.domain.event.NormalizedEvent;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that yields node trace events in arrival order.
 * <p><strong>Why:</strong> Isolates the dispatcher from how the node log is transported (file tailing, journal
 * readers, replay fixtures).</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code JsonLinesFileEventSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and release the underlying transport.</li>
 *   <li>Return events one at a time, strictly in the order the node emitted them.</li>
 *   <li>Signal exhaustion for finite sources so the dispatcher can stop.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Only the dispatcher thread calls a source; implementations need not be
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface EventSource extends AutoCloseable {
  /**
   * Opens the underlying transport.
   *
   * @throws Exception when the transport cannot be opened
   */
  void start() throws Exception;

  /**
   * Returns the next event, or empty when none is available yet.
   *
   * @return next event in arrival order
   * @throws Exception when reading fails; {@link InterruptedException} when the calling thread is interrupted
   */
  Optional<NormalizedEvent> poll() throws Exception;

  /**
   * Indicates that a finite source has delivered every event.
   *
   * @return {@code true} when no further events will arrive
   */
  default boolean isExhausted() {
    return false;
  }

  @Override
  void close() throws Exception;
}
