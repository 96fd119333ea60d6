package io.blockperf.collector.api;

import io.blockperf.collector.config.CollectorVersion;
import io.blockperf.collector.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code blockperf} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: blockperf <run|version> [options]";
  private static final String HELP_TEXT = """
      blockperf: block propagation and peer state collector for a relay node

      Usage:
        blockperf <command> [options]

      Commands:
        run        Read the node trace log and emit block samples (run --help for details)
        version    Print the collector version

      Global flags:
        --help     Show this message
        --verbose  Enable DEBUG logging before dispatching
      """;

  private Main() {}

  /**
   * JVM entry point.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a command without exiting the JVM.
   *
   * @param args arguments whose first non-flag token is the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(raw);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(raw);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput global = CliInput.parse(Arrays.copyOfRange(raw, 0, commandIndex));
    if (global.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (global.keyValueArgs().length > 0) {
      log.error("Settings must follow the command: {}", String.join(" ", global.keyValueArgs()));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "version" -> {
        CliPrinter.println("blockperf " + CollectorVersion.current());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags before the command belong to the dispatcher; everything after it belongs to the command.
  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || arg.isBlank()) {
        continue;
      }
      String trimmed = arg.trim();
      if (trimmed.startsWith("-") || trimmed.equalsIgnoreCase("help") || trimmed.indexOf('=') >= 0) {
        continue;
      }
      return i;
    }
    return -1;
  }
}
