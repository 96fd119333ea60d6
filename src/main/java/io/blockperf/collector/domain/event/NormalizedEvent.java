package io.blockperf.collector.domain.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable trace record emitted by the node's tracing subsystem.
 *
 * <p><strong>Why:</strong> Decouples the log transport (file tailing, journal readers) from classification; the
 * collector never mutates an event after it is produced.</p>
 * <p><strong>Thread-safety:</strong> The top-level payload map is unmodifiable. Nested maps and lists come straight
 * from the JSON parser and must be treated as read-only.</p>
 *
 * @param at event timestamp with nanosecond precision
 * @param namespace dotted namespace acting as kind discriminator (e.g. {@code ChainSync.Client.DownloadedHeader})
 * @param severity severity label ({@code Info}, {@code Debug}, ...); empty when absent
 * @param thread emitting thread id; empty when absent
 * @param host emitting host; empty when absent
 * @param data kind-specific payload
 * @since 0.1.0
 */
public record NormalizedEvent(
    Instant at,
    String namespace,
    String severity,
    String thread,
    String host,
    Map<String, Object> data) {

  public NormalizedEvent {
    Objects.requireNonNull(at, "at");
    Objects.requireNonNull(namespace, "namespace");
    severity = severity == null ? "" : severity;
    thread = thread == null ? "" : thread;
    host = host == null ? "" : host;
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /**
   * Convenience factory used by tests and replay tooling.
   *
   * @param at event timestamp
   * @param namespace event namespace
   * @param data payload
   * @return event with empty severity, thread, and host
   */
  public static NormalizedEvent of(Instant at, String namespace, Map<String, Object> data) {
    return new NormalizedEvent(at, namespace, "", "", "", data);
  }
}
