package io.blockperf.collector.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"logFile=/var/log/node.json", " sink = http "});

    assertEquals(List.of("logFile", "sink"), List.copyOf(map.keySet()));
    assertEquals("/var/log/node.json", map.get("logFile"));
    assertEquals("http", map.get("sink"));
  }

  @Test
  void splitsOnFirstEqualsAndLaterTokensWin() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "otelResourceAttributes=a=b,c=d", "sink=log", "sink=file"});

    assertEquals("a=b,c=d", map.get("otelResourceAttributes"));
    assertEquals("file", map.get("sink"));
  }

  @Test
  void emptyValueIsKeptAndBlankTokensAreSkipped() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"apiKey=", " ", null});

    assertEquals(Map.of("apiKey", ""), map);
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedTokens() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"logFile"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"apiKey=a\u0007b"}));
  }
}
