package io.blockperf.collector.infrastructure.sink;

import io.blockperf.collector.application.port.BlockSampleSink;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.domain.block.BlockSample;
import io.blockperf.collector.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Submits samples to the block sample API ({@code POST <apiUrl>/api/v0/submit/blocksample}).
 * <p><strong>Why:</strong> The collector's purpose is to feed a central propagation dataset; the dispatcher must
 * not wait on the network, so requests run on a dedicated single-thread executor with a bounded queue.</p>
 * <p><strong>Failure policy:</strong> No retries. Non-2xx responses, I/O errors, and queue overflow are logged at
 * WARN and counted ({@code sink.http.failed}, {@code sink.http.rejected}).</p>
 *
 * @since 0.1.0
 */
public final class HttpBlockSampleSink implements BlockSampleSink {
  private static final Logger log = LoggerFactory.getLogger(HttpBlockSampleSink.class);

  static final String SUBMIT_PATH = "/api/v0/submit/blocksample";
  static final String API_KEY_HEADER = "X-Api-Key";
  static final String CLIENT_ID_HEADER = "X-Client-Id";
  private static final int QUEUE_CAPACITY = 256;
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final URI endpoint;
  private final String apiKey;
  private final String clientId;
  private final BlockSampleJson json;
  private final MetricsPort metrics;
  private final HttpClient client;
  private final ExecutorService executor;

  /**
   * Creates the sink.
   *
   * @param apiUrl API base URL without trailing slash
   * @param apiKey value of the {@code X-Api-Key} header; {@code null} omits the header
   * @param clientId value of the {@code X-Client-Id} header; {@code null} omits the header
   * @param json sample encoder
   * @param metrics metrics sink
   */
  public HttpBlockSampleSink(
      String apiUrl, String apiKey, String clientId, BlockSampleJson json, MetricsPort metrics) {
    this.endpoint = URI.create(Objects.requireNonNull(apiUrl, "apiUrl") + SUBMIT_PATH);
    this.apiKey = apiKey;
    this.clientId = clientId;
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.client = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(REQUEST_TIMEOUT)
        .build();
    this.executor = ExecutorFactories.newSinkExecutor(
        QUEUE_CAPACITY,
        "blockperf-http-sink",
        (thread, ex) -> log.error("HTTP sink thread {} failed", thread.getName(), ex));
  }

  @Override
  public void accept(BlockSample sample) {
    String body = json.encode(sample);
    try {
      executor.execute(() -> submit(sample.blockHash(), body));
    } catch (RejectedExecutionException ex) {
      metrics.increment("sink.http.rejected");
      log.warn("HTTP sink queue full or closed; dropping sample {}", sample.blockHash());
    }
  }

  private void submit(String blockHash, String body) {
    HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
        .timeout(REQUEST_TIMEOUT)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
    if (apiKey != null && !apiKey.isEmpty()) {
      request.header(API_KEY_HEADER, apiKey);
    }
    if (clientId != null && !clientId.isEmpty()) {
      request.header(CLIENT_ID_HEADER, clientId);
    }
    try {
      HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
      int status = response.statusCode();
      if (status >= 200 && status < 300) {
        metrics.increment("sink.http.submitted");
        log.debug("Submitted sample {} ({})", blockHash, status);
        return;
      }
      metrics.increment("sink.http.failed");
      log.warn("Sample API rejected block {} with HTTP {}", blockHash, status);
    } catch (IOException ex) {
      metrics.increment("sink.http.failed");
      log.warn("Failed to submit sample {} to {}: {}", blockHash, endpoint, ex.toString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("sink.http.failed");
      log.warn("Interrupted while submitting sample {}", blockHash);
    }
  }

  /**
   * Stops accepting samples and waits briefly for queued submissions.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        int dropped = executor.shutdownNow().size();
        log.warn("HTTP sink did not drain within {}; dropped {} queued samples", CLOSE_TIMEOUT, dropped);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
      log.warn("Interrupted while draining HTTP sink");
    }
  }
}
