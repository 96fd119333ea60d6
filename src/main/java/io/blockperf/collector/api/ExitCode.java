package io.blockperf.collector.api;

/**
 * <strong>What:</strong> Process exit statuses returned by the collector CLI.
 * <p><strong>Why:</strong> Service managers and scripts distinguish bad arguments from runtime failures without
 * parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments could not be parsed or named an unknown command or setting. */
  INVALID_ARGS(2),
  /** The node log, config file, or sample output could not be read or written. */
  IO_ERROR(3),
  /** Settings were syntactically valid but inconsistent or out of range. */
  CONFIG_ERROR(4),
  /** The collector failed unexpectedly. */
  RUNTIME_FAILURE(5),
  /** The collector was interrupted (SIGINT/SIGTERM). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** Numeric status handed to {@link System#exit(int)}. */
  public int code() {
    return code;
  }
}
