package io.blockperf.collector.infrastructure.source;

import static org.junit.jupiter.api.Assertions.*;

import io.blockperf.collector.domain.event.NormalizedEvent;
import io.blockperf.collector.testing.RecordingMetricsPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesFileEventSourceTest {
  @TempDir Path tempDir;

  @Test
  void onceModeReadsWholeFileSkippingMalformedLines() throws Exception {
    Path log = tempDir.resolve("node.json");
    Files.writeString(log, line("A.One") + "\n" + "garbage\n\n" + line("A.Two") + "\n" + line("A.Three"),
        StandardCharsets.UTF_8);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    List<String> namespaces = new ArrayList<>();
    try (JsonLinesFileEventSource source = newSource(log, false, metrics)) {
      source.start();
      while (!source.isExhausted()) {
        source.poll().ifPresent(event -> namespaces.add(event.namespace()));
      }
      assertTrue(source.poll().isEmpty());
    }

    assertEquals(List.of("A.One", "A.Two", "A.Three"), namespaces);
    assertEquals(4, metrics.count("source.line.read"));
    assertEquals(1, metrics.count("source.line.malformed"));
  }

  @Test
  void followModeStartsAtEndAndPicksUpAppendedLines() throws Exception {
    Path log = tempDir.resolve("node.json");
    Files.writeString(log, line("Old.Event") + "\n", StandardCharsets.UTF_8);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    try (JsonLinesFileEventSource source = newSource(log, true, metrics)) {
      source.start();
      assertTrue(source.poll().isEmpty());
      assertFalse(source.isExhausted());

      append(log, line("New.Event") + "\n" + "{\"at\":\"2024-05-01T10:00:00Z\",");
      Optional<NormalizedEvent> next = source.poll();
      assertEquals("New.Event", next.orElseThrow().namespace());
      assertTrue(source.poll().isEmpty());

      append(log, "\"ns\":\"Late.Event\"}\n");
      assertEquals("Late.Event", source.poll().orElseThrow().namespace());
    }

    assertEquals(0, metrics.count("source.line.malformed"));
  }

  @Test
  void followModeReopensTruncatedFile() throws Exception {
    Path log = tempDir.resolve("node.json");
    Files.writeString(log, "", StandardCharsets.UTF_8);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    try (JsonLinesFileEventSource source = newSource(log, true, metrics)) {
      source.start();
      append(log, line("Before.Truncate") + "\n" + line("Second.Line") + "\n");
      assertEquals("Before.Truncate", source.poll().orElseThrow().namespace());
      assertEquals("Second.Line", source.poll().orElseThrow().namespace());

      Files.writeString(log, line("X") + "\n", StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
      assertEquals("X", source.poll().orElseThrow().namespace());
    }

    assertEquals(1, metrics.count("source.rotated"));
  }

  @Test
  void startFailsForMissingFile() {
    JsonLinesFileEventSource source =
        newSource(tempDir.resolve("missing.json"), false, new RecordingMetricsPort());

    assertThrows(NoSuchFileException.class, source::start);
  }

  @Test
  void pollBeforeStartIsRejected() {
    JsonLinesFileEventSource source = newSource(tempDir.resolve("x.json"), false, new RecordingMetricsPort());

    assertThrows(IllegalStateException.class, source::poll);
  }

  private static JsonLinesFileEventSource newSource(Path file, boolean follow, RecordingMetricsPort metrics) {
    return new JsonLinesFileEventSource(file, follow, Duration.ZERO, new NodeLogLineParser(), metrics);
  }

  private static String line(String namespace) {
    return "{\"at\":\"2024-05-01T10:00:00Z\",\"ns\":\"" + namespace + "\",\"data\":{}}";
  }

  private static void append(Path file, String text) throws IOException {
    Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
  }
}
