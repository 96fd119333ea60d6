/**
 * Metrics adapter bridging {@link io.blockperf.collector.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Thread-safe; instruments are created lazily and cached per key.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code classifier.*}, {@code peers.*}, {@code block.*},
 * {@code sink.*}, and {@code source.*}.</p>
 */
package io.blockperf.collector.infrastructure.metrics;
