package io.blockperf.collector.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes usage text and dry-run plans to stdout, separately from the SLF4J log stream.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {}

  /**
   * Prints one line.
   *
   * @param line text to print
   */
  public static void println(String line) {
    PrintWriter out = writer();
    out.println(line);
    out.flush();
  }

  /**
   * Prints each line in order.
   *
   * @param lines lines to print; {@code null} prints nothing
   */
  public static void printLines(List<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = writer();
    lines.forEach(out::println);
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static PrintWriter writer() {
    PrintWriter override = testWriter;
    return override != null ? override : STDOUT;
  }
}
