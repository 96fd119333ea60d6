package io.blockperf.collector.infrastructure.source;

import io.blockperf.collector.application.port.EventSource;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.domain.event.NormalizedEvent;
import io.blockperf.collector.logging.Logs;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EventSource} reading the node's JSON-lines trace file.
 * <p><strong>Modes:</strong> In follow mode the source starts at the current end of the file and tails it,
 * re-opening from the start when the file is rotated (replaced or truncated). Otherwise it reads the whole file once
 * and reports {@link #isExhausted()} at end-of-file.</p>
 * <p><strong>Thread-safety:</strong> Single consumer; only the dispatcher thread may call it.</p>
 * <p><strong>Observability:</strong> {@code source.line.read}, {@code source.line.malformed},
 * {@code source.rotated}.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesFileEventSource implements EventSource {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesFileEventSource.class);

  private static final int READ_CHUNK_BYTES = 64 * 1024;
  private static final int MAX_LOGGED_LINE_BYTES = 256;

  private final Path file;
  private final boolean follow;
  private final Duration pollInterval;
  private final NodeLogLineParser parser;
  private final MetricsPort metrics;

  private final ByteBuffer readBuffer = ByteBuffer.allocate(READ_CHUNK_BYTES);
  private final ByteArrayOutputStream partialLine = new ByteArrayOutputStream();
  private final Deque<String> pendingLines = new ArrayDeque<>();

  private FileChannel channel;
  private Object fileKey;
  private long position;
  private boolean exhausted;

  /**
   * Creates a file source.
   *
   * @param file node log file
   * @param follow {@code true} to tail the file, {@code false} to read it once
   * @param pollInterval wait between reads when no new data is available in follow mode
   * @param parser trace line parser
   * @param metrics metrics sink
   */
  public JsonLinesFileEventSource(
      Path file, boolean follow, Duration pollInterval, NodeLogLineParser parser, MetricsPort metrics) {
    this.file = Objects.requireNonNull(file, "file");
    this.follow = follow;
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must not be negative");
    }
  }

  @Override
  public void start() throws IOException {
    if (channel != null) {
      throw new IllegalStateException("Source already started");
    }
    open(follow);
    log.info("Reading node log {} ({}, starting at byte {})", file, follow ? "follow" : "once", position);
  }

  @Override
  public Optional<NormalizedEvent> poll() throws IOException, InterruptedException {
    if (channel == null) {
      throw new IllegalStateException("Source not started");
    }
    while (true) {
      String line = pendingLines.pollFirst();
      if (line != null) {
        Optional<NormalizedEvent> event = parseLine(line);
        if (event.isPresent()) {
          return event;
        }
        continue;
      }
      if (exhausted) {
        return Optional.empty();
      }
      if (readChunk() > 0) {
        continue;
      }
      if (!follow) {
        flushPartialLine();
        exhausted = true;
        continue;
      }
      if (checkRotation()) {
        continue;
      }
      if (!pollInterval.isZero()) {
        Thread.sleep(pollInterval.toMillis());
      }
      return Optional.empty();
    }
  }

  @Override
  public boolean isExhausted() {
    return exhausted && pendingLines.isEmpty();
  }

  @Override
  public void close() throws IOException {
    FileChannel current = channel;
    channel = null;
    if (current != null) {
      current.close();
    }
  }

  private void open(boolean atEnd) throws IOException {
    channel = FileChannel.open(file, StandardOpenOption.READ);
    fileKey = fileKey(file);
    position = atEnd ? channel.size() : 0L;
    partialLine.reset();
  }

  private int readChunk() throws IOException {
    readBuffer.clear();
    int read = channel.read(readBuffer, position);
    if (read <= 0) {
      return 0;
    }
    position += read;
    readBuffer.flip();
    byte[] bytes = readBuffer.array();
    int start = 0;
    for (int i = 0; i < read; i++) {
      if (bytes[i] == '\n') {
        partialLine.write(bytes, start, i - start);
        emitLine();
        start = i + 1;
      }
    }
    if (start < read) {
      partialLine.write(bytes, start, read - start);
    }
    return read;
  }

  private void flushPartialLine() {
    if (partialLine.size() > 0) {
      emitLine();
    }
  }

  private void emitLine() {
    String line = partialLine.toString(StandardCharsets.UTF_8).strip();
    partialLine.reset();
    if (!line.isEmpty()) {
      pendingLines.addLast(line);
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

  /**
   * Re-opens the file from the start when it was replaced or truncated.
   *
   * @return {@code true} when the file was re-opened
   */
  private boolean checkRotation() throws IOException {
    Object currentKey;
    long currentSize;
    try {
      currentKey = fileKey(file);
      currentSize = Files.size(file);
    } catch (NoSuchFileException ex) {
      // Between rename and re-create; keep the old handle until the new file shows up.
      return false;
    }
    boolean replaced = fileKey != null && currentKey != null && !fileKey.equals(currentKey);
    boolean truncated = currentSize < position;
    if (!replaced && !truncated) {
      return false;
    }
    log.info("Node log {} was {}; re-opening from the start", file, replaced ? "rotated" : "truncated");
    metrics.increment("source.rotated");
    flushPartialLine();
    channel.close();
    open(false);
    return true;
  }

  private static Object fileKey(Path path) throws IOException {
    return Files.readAttributes(path, BasicFileAttributes.class).fileKey();
  }
}
