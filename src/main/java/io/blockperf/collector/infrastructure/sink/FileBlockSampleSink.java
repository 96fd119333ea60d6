package io.blockperf.collector.infrastructure.sink;

import io.blockperf.collector.application.port.BlockSampleSink;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.domain.block.BlockSample;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends samples as JSON lines to a file, flushing after every sample.
 *
 * <p>Write failures are logged and counted ({@code sink.file.failed}); the sample is lost.</p>
 *
 * @since 0.1.0
 */
public final class FileBlockSampleSink implements BlockSampleSink {
  private static final Logger log = LoggerFactory.getLogger(FileBlockSampleSink.class);

  private final Path file;
  private final BlockSampleJson json;
  private final MetricsPort metrics;
  private final BufferedWriter writer;

  /**
   * Opens (creating if needed) the output file in append mode.
   *
   * @param file destination file; parent directories are created
   * @param json sample encoder
   * @param metrics metrics sink
   * @throws IOException when the file cannot be opened
   */
  public FileBlockSampleSink(Path file, BlockSampleJson json, MetricsPort metrics) throws IOException {
    this.file = Objects.requireNonNull(file, "file");
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    this.writer = Files.newBufferedWriter(
        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  @Override
  public synchronized void accept(BlockSample sample) {
    try {
      writer.write(json.encode(sample));
      writer.newLine();
      writer.flush();
      metrics.increment("sink.file.written");
    } catch (IOException ex) {
      metrics.increment("sink.file.failed");
      log.warn("Failed to append sample {} to {}", sample.blockHash(), file, ex);
    }
  }

  @Override
  public synchronized void close() {
    try {
      writer.close();
    } catch (IOException ex) {
      log.warn("Failed to close sample file {}", file, ex);
    }
  }
}
