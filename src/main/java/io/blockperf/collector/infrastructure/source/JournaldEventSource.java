package io.blockperf.collector.infrastructure.source;

import io.blockperf.collector.application.port.EventSource;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.domain.event.NormalizedEvent;
import io.blockperf.collector.infrastructure.exec.ExecutorFactories;
import io.blockperf.collector.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EventSource} reading trace lines that the node writes to the systemd journal.
 * <p><strong>How:</strong> Runs {@code journalctl -u <unit> -o cat -f -n 0} as a child process; {@code -o cat} prints
 * only the message, which is the node's JSON trace line. A daemon thread copies stdout lines into a bounded queue
 * that {@link #poll()} drains, so a full queue pauses the reader instead of dropping lines.</p>
 * <p><strong>Lifecycle:</strong> The source is exhausted once the child process has ended and every line it wrote
 * has been polled. {@link #close()} terminates the child.</p>
 * <p><strong>Thread-safety:</strong> Single consumer; only the dispatcher thread may call {@link #poll()}.</p>
 * <p><strong>Observability:</strong> {@code source.line.read}, {@code source.line.malformed},
 * {@code source.process.exited}.</p>
 *
 * @since 0.1.0
 */
public final class JournaldEventSource implements EventSource {
  private static final Logger log = LoggerFactory.getLogger(JournaldEventSource.class);

  private static final int QUEUE_CAPACITY = 4_096;
  private static final int MAX_LOGGED_LINE_BYTES = 256;
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(2);

  private final List<String> command;
  private final Duration pollInterval;
  private final NodeLogLineParser parser;
  private final MetricsPort metrics;
  private final BlockingQueue<String> lines = new LinkedBlockingQueue<>(QUEUE_CAPACITY);

  private Process process;
  private ExecutorService reader;
  private volatile boolean readerDone;
  private volatile boolean closing;

  /**
   * Creates a journal source.
   *
   * @param command child process printing one trace line per output line, see {@link #journalctlCommand(String)}
   * @param pollInterval longest wait in {@link #poll()} for the next line
   * @param parser trace line parser
   * @param metrics metrics sink
   */
  public JournaldEventSource(
      List<String> command, Duration pollInterval, NodeLogLineParser parser, MetricsPort metrics) {
    this.command = List.copyOf(Objects.requireNonNull(command, "command"));
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (this.command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    if (pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must not be negative");
    }
  }

  /**
   * Builds the {@code journalctl} invocation following new entries of one unit.
   *
   * @param unit systemd unit name, e.g. {@code cardano-node}
   * @return command line
   */
  public static List<String> journalctlCommand(String unit) {
    return List.of("journalctl", "-u", Objects.requireNonNull(unit, "unit"), "-o", "cat", "-f", "-n", "0");
  }

  @Override
  public void start() throws IOException {
    if (process != null) {
      throw new IllegalStateException("Source already started");
    }
    process = new ProcessBuilder(command)
        .redirectError(ProcessBuilder.Redirect.INHERIT)
        .start();
    process.getOutputStream().close();
    reader = ExecutorFactories.newSourceReader(
        "blockperf-journal",
        (thread, ex) -> log.error("Journal reader thread {} failed", thread.getName(), ex));
    reader.execute(this::drainOutput);
    log.info("Reading node trace lines from {} (pid {})", String.join(" ", command), process.pid());
  }

  @Override
  public Optional<NormalizedEvent> poll() throws InterruptedException {
    if (process == null) {
      throw new IllegalStateException("Source not started");
    }
    while (true) {
      String line = lines.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
      if (line == null) {
        return Optional.empty();
      }
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      Optional<NormalizedEvent> event = parseLine(trimmed);
      if (event.isPresent()) {
        return event;
      }
    }
  }

  @Override
  public boolean isExhausted() {
    return readerDone && lines.isEmpty();
  }

  /**
   * Terminates the child process and the reader thread.
   */
  @Override
  public void close() throws InterruptedException {
    closing = true;
    Process current = process;
    if (current == null) {
      return;
    }
    current.destroy();
    if (!current.waitFor(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
      log.warn("{} did not stop within {}; killing it", command.get(0), STOP_TIMEOUT);
      current.destroyForcibly();
    }
    reader.shutdownNow();
    if (!reader.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
      log.warn("Journal reader thread did not stop within {}", STOP_TIMEOUT);
    }
  }

  /** Indicates whether the child process is still running. */
  boolean isProcessAlive() {
    return process != null && process.isAlive();
  }

  private void drainOutput() {
    try (BufferedReader out = new BufferedReader(
        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = out.readLine()) != null) {
        lines.put(line);
      }
      int status = process.waitFor();
      if (!closing) {
        metrics.increment("source.process.exited");
        log.warn("{} exited with status {}", command.get(0), status);
      }
    } catch (IOException ex) {
      if (closing) {
        log.debug("Output of {} closed during shutdown: {}", command.get(0), ex.toString());
      } else {
        log.error("Failed reading output of {}", command.get(0), ex);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      readerDone = true;
    }
  }

  private Optional<NormalizedEvent> parseLine(String line) {
    metrics.increment("source.line.read");
    try {
      return Optional.of(parser.parse(line));
    } catch (IllegalArgumentException ex) {
      metrics.increment("source.line.malformed");
      log.debug("Skipping malformed trace line ({}): {}", ex.getMessage(), Logs.truncate(line, MAX_LOGGED_LINE_BYTES));
      return Optional.empty();
    }
  }
}
