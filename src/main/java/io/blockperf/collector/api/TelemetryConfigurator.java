package io.blockperf.collector.api;

import io.blockperf.collector.validation.Net;
import io.blockperf.collector.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves OpenTelemetry settings out of the collector settings and into the {@code otel.*} system properties read
 * by the metrics bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static void configureMetrics(Map<String, String> settings) {
    configureMetrics(settings, System::setProperty);
  }

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes} from
   * {@code settings} and publishes the non-blank ones.
   *
   * @param settings mutable effective settings
   * @param properties receives {@code otel.*} property names and values
   * @throws IllegalArgumentException for an unknown exporter, a non-HTTP endpoint, or non-ASCII attributes
   */
  static void configureMetrics(Map<String, String> settings, BiConsumer<String, String> properties) {
    if (settings == null || settings.isEmpty()) {
      return;
    }
    String exporter = trimmed(settings.remove("metricsExporter"));
    if (!exporter.isEmpty()) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Metrics exporter: {}", normalized);
      properties.accept("otel.metrics.exporter", normalized);
    }

    String endpoint = trimmed(settings.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      String validated = Net.validateHttpUrl("otelEndpoint", endpoint);
      log.debug("OTLP endpoint: {}", validated);
      properties.accept("otel.exporter.otlp.endpoint", validated);
    }

    String attributes = trimmed(settings.remove("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      properties.accept("otel.resource.attributes", attributes);
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
