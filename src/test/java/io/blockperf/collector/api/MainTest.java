package io.blockperf.collector.api;

import static org.junit.jupiter.api.Assertions.*;

import io.blockperf.collector.config.CollectorVersion;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
    assertTrue(buffer.toString().contains("run "));
  }

  @Test
  void helpBeforeCommandWins() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"-h", "run", "logFile=/x"}));
    assertTrue(buffer.toString().contains("Global flags:"));
  }

  @Test
  void versionPrintsCollectorVersion() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"VERSION"}));
    assertEquals("blockperf " + CollectorVersion.current(), buffer.toString().trim());
  }

  @Test
  void missingOrUnknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(null));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: blockperf <run|version>"));
  }

  @Test
  void settingsBeforeCommandAreRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"logFile=/x", "run"}));
  }

  @Test
  void delegatesToRunCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"run", "--help"}));
    assertTrue(buffer.toString().contains("blockperf run:"));
  }
}
