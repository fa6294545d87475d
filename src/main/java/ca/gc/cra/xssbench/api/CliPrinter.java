package ca.gc.cra.xssbench.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output helper for the benchmark CLI.
 *
 * <p>The report goes to stdout; progress and fail-fast details go to stderr so that stdout stays clean when it
 * is redirected. Uses native file descriptors in order to avoid direct {@code System.out} references.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final PrintWriter STDERR = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.err), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter outOverride;
  private static volatile PrintWriter errOverride;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    out().println(message);
  }

  /**
   * Prints zero or more lines to stdout.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = out();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints a single line to stderr.
   *
   * @param message line to emit
   */
  public static void errPrintln(String message) {
    err().println(message);
  }

  /**
   * Prints text to stderr without a line break; call {@link #errFlush()} to make it visible.
   *
   * @param text text to emit
   */
  public static void errPrint(String text) {
    err().print(text);
  }

  /** Flushes pending stderr text. */
  public static void errFlush() {
    err().flush();
  }

  static void setWritersForTesting(PrintWriter out, PrintWriter err) {
    outOverride = out;
    errOverride = err;
  }

  static void clearTestWriters() {
    outOverride = null;
    errOverride = null;
  }

  private static PrintWriter out() {
    PrintWriter override = outOverride;
    return override != null ? override : STDOUT;
  }

  private static PrintWriter err() {
    PrintWriter override = errOverride;
    return override != null ? override : STDERR;
  }
}
