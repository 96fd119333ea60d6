package io.blockperf.collector.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromSettings() {
    CliInput input = CliInput.parse(new String[] {"logFile=/x", "--DRY-RUN", "-v", "sink=log", "--bogus"});

    assertArrayEquals(new String[] {"logFile=/x", "sink=log"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertEquals(List.of("--bogus"), input.unknownFlags("--dry-run"));
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
    assertTrue(CliInput.parse(new String[] {"--help", "--verbose"}).unknownFlags().isEmpty());
  }

  @Test
  void dashedSettingStaysASetting() {
    CliInput input = CliInput.parse(new String[] {"--config=/etc/x.yaml", null, ""});

    assertArrayEquals(new String[] {"--config=/etc/x.yaml"}, input.keyValueArgs());
    assertFalse(input.hasFlag(null));
    assertTrue(CliInput.parse(null).unknownFlags().isEmpty());
  }
}
