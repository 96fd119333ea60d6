package io.blockperf.collector.infrastructure.source;

import static org.junit.jupiter.api.Assertions.*;

import io.blockperf.collector.domain.event.NormalizedEvent;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NodeLogLineParserTest {
  private final NodeLogLineParser parser = new NodeLogLineParser();

  @Test
  void parsesEnvelopeAndNestedPayload() {
    NormalizedEvent event = parser.parse("{\"at\":\"2024-05-01T10:00:00.123456Z\","
        + "\"ns\":\"ChainSync.Client.DownloadedHeader\",\"sev\":\"Info\",\"thread\":\"42\",\"host\":\"relay1\","
        + "\"data\":{\"block\":\"abc\",\"blockNo\":7,\"slot\":1000,\"delay\":0.25,\"ok\":true,\"none\":null,"
        + "\"peer\":{\"connectionId\":\"1.2.3.4:1 5.6.7.8:2\"},\"tags\":[\"a\",\"b\"]}}");

    assertEquals(Instant.parse("2024-05-01T10:00:00.123456Z"), event.at());
    assertEquals("ChainSync.Client.DownloadedHeader", event.namespace());
    assertEquals("Info", event.severity());
    assertEquals("42", event.thread());
    assertEquals("relay1", event.host());
    Map<String, Object> data = event.data();
    assertEquals("abc", data.get("block"));
    assertEquals(7, ((Number) data.get("blockNo")).intValue());
    assertEquals(0.25, ((Number) data.get("delay")).doubleValue());
    assertEquals(Boolean.TRUE, data.get("ok"));
    assertTrue(data.containsKey("none"));
    assertNull(data.get("none"));
    assertEquals(Map.of("connectionId", "1.2.3.4:1 5.6.7.8:2"), data.get("peer"));
    assertEquals(List.of("a", "b"), data.get("tags"));
  }

  @Test
  void joinsNamespaceSegmentsAndAcceptsOffsetTimestamps() {
    NormalizedEvent event = parser.parse(
        "{\"at\":\"2024-05-01T12:00:00+02:00\",\"ns\":[\"Net\",\"Server\",\"Local\",\"Started\"]}");

    assertEquals("Net.Server.Local.Started", event.namespace());
    assertEquals(Instant.parse("2024-05-01T10:00:00Z"), event.at());
    assertTrue(event.data().isEmpty());
    assertEquals("", event.severity());
  }

  @Test
  void rejectsMalformedLines() {
    List<String> bad = List.of(
        "not json",
        "[1,2,3]",
        "{\"at\":\"2024-05-01T10:00:00Z\"",
        "{\"ns\":\"A.B\"}",
        "{\"at\":\"yesterday\",\"ns\":\"A.B\"}",
        "{\"at\":\"2024-05-01T10:00:00Z\",\"ns\":\"\"}",
        "{\"at\":\"2024-05-01T10:00:00Z\",\"ns\":[\"A\",3]}",
        "{\"at\":\"2024-05-01T10:00:00Z\",\"ns\":\"A.B\",\"data\":[1]}",
        "{\"at\":\"2024-05-01T10:00:00Z\",\"ns\":\"A.B\"} {}");
    for (String line : bad) {
      assertThrows(IllegalArgumentException.class, () -> parser.parse(line), line);
    }
  }
}
