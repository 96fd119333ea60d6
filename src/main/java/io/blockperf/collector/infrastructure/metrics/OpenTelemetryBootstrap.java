package io.blockperf.collector.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the collector's meter from {@code otel.*} system properties, falling back to the matching {@code OTEL_*}
 * environment variables.
 *
 * <p>Metrics are off unless the exporter is {@code otlp}. Any failure while wiring the exporter yields a noop meter;
 * metrics never stop the collector.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.blockperf.collector";
  static final String SERVICE = "blockperf-collector";

  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final long DEFAULT_INTERVAL_MILLIS = 30_000L;
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> HOST_NAME = AttributeKey.stringKey("host.name");

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize(String serviceVersion) {
    ExportSettings settings = ExportSettings.resolve();
    if (!settings.enabled()) {
      log.info("Collector metrics not exported (exporter={})", settings.exporter());
      return BootstrapResult.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(settings.interval())
          .build();
      BootstrapResult result = build(reader, serviceVersion, settings.resourceAttributes());
      log.info("Exporting collector metrics to {} every {} ms", settings.endpoint(), settings.interval().toMillis());
      return result;
    } catch (RuntimeException ex) {
      log.error("OTLP metrics exporter could not be created for {}; metrics disabled", settings.endpoint(), ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), "test", Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, String serviceVersion, Attributes extras) {
    AttributesBuilder identity = Attributes.builder()
        .put(SERVICE_NAME, SERVICE)
        .put(SERVICE_VERSION, serviceVersion);
    String host = localHostName();
    if (!host.isEmpty()) {
      identity.put(HOST_NAME, host);
    }
    Resource resource = Resource.getDefault()
        .merge(Resource.create(identity.build()))
        .merge(Resource.create(extras));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(
        provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(serviceVersion).build(), provider);
  }

  /**
   * Parses {@code key=value} pairs separated by commas; entries without a key or value are skipped.
   *
   * @param raw attribute list, may be {@code null}
   * @return parsed attributes
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      int eq = entry.indexOf('=');
      String key = eq < 0 ? "" : entry.substring(0, eq).trim();
      String value = eq < 0 ? "" : entry.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Skipping resource attribute without key or value: {}", entry.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("host.name omitted from metrics resource", ex);
      return "";
    }
  }

  private static String lookup(String property, String env) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null ? "" : value.trim();
  }

  private record ExportSettings(String exporter, String endpoint, Duration interval, Attributes resourceAttributes) {
    static ExportSettings resolve() {
      String exporter = lookup("otel.metrics.exporter", "OTEL_METRICS_EXPORTER").toLowerCase(Locale.ROOT);
      if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
        log.warn("Unsupported metrics exporter '{}'; metrics disabled", exporter);
      }
      String endpoint = lookup("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT");
      return new ExportSettings(
          exporter.isEmpty() ? "none" : exporter,
          endpoint.isEmpty() ? DEFAULT_ENDPOINT : endpoint,
          Duration.ofMillis(intervalMillis(lookup("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL"))),
          parseResourceAttributes(lookup("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES")));
    }

    boolean enabled() {
      return exporter.equals("otlp");
    }

    private static long intervalMillis(String raw) {
      if (raw.isEmpty()) {
        return DEFAULT_INTERVAL_MILLIS;
      }
      try {
        long parsed = Long.parseLong(raw);
        if (parsed > 0) {
          return parsed;
        }
      } catch (NumberFormatException ex) {
        log.debug("Export interval '{}' is not a number", raw, ex);
      }
      log.warn("Ignoring metric export interval '{}'; using {} ms", raw, DEFAULT_INTERVAL_MILLIS);
      return DEFAULT_INTERVAL_MILLIS;
    }
  }

  /** Meter plus the provider that must be flushed and shut down with it; {@code provider} is null when noop. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null && !await(provider.forceFlush())) {
        log.warn("Collector metrics flush did not finish within {}s", SHUTDOWN_WAIT.toSeconds());
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        if (!await(provider.shutdown())) {
          log.warn("Meter provider shutdown did not finish within {}s", SHUTDOWN_WAIT.toSeconds());
        }
      } catch (RuntimeException ex) {
        log.warn("Meter provider shutdown failed", ex);
      }
    }

    private static boolean await(CompletableResultCode code) {
      return code.join(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS).isSuccess();
    }
  }
}
