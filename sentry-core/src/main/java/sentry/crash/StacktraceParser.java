package sentry.crash;

import sentry.model.Frame;
import sentry.model.Stacktrace;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * Recovers crash reports from the text a native crash handler writes.
 *
 * <p>The input is line oriented. Lines starting with {@code 0x} are stack lines, anything else
 * is header text. A report is one or more header lines followed by stack lines; the first
 * header line after a stack line starts the next report. Stack lines are written innermost
 * first, so each parsed frame is prepended, which yields caller-to-callee order.
 *
 * <p>A stack line is either a bare address or {@code ADDR, FUNCTION at /ABS/PATH:LINE}.
 * Parsing never fails: a line that does not match the long form becomes a bare-address frame.
 */
public final class StacktraceParser {
  private static final String ADDRESS_PREFIX = "0x";
  private static final String LOCATION_MARKER = " at /";

  private StacktraceParser() {
  }

  public static List<CrashReport> parse(String text) {
    Objects.requireNonNull(text, "text");
    return parse(List.of(text.split("\n", -1)));
  }

  /**
   * Parses crash-log lines.
   *
   * @param lines raw lines, untrimmed
   * @return the reports in encounter order; empty if the input holds only whitespace
   */
  public static List<CrashReport> parse(List<String> lines) {
    List<CrashReport> reports = new ArrayList<>();
    List<String> header = new ArrayList<>();
    LinkedList<Frame> frames = new LinkedList<>();

    for (String rawLine : lines) {
      String line = rawLine.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (line.startsWith(ADDRESS_PREFIX)) {
        frames.addFirst(parseFrame(line));
        continue;
      }
      if (!frames.isEmpty()) {
        reports.add(new CrashReport(String.join("\n", header), new Stacktrace(frames)));
        header.clear();
        frames.clear();
      }
      header.add(line);
    }
    if (!header.isEmpty() || !frames.isEmpty()) {
      reports.add(new CrashReport(String.join("\n", header), new Stacktrace(frames)));
    }
    return reports;
  }

  static Frame parseFrame(String line) {
    int comma = line.indexOf(',');
    int at = line.indexOf(LOCATION_MARKER, comma + 1);
    int colon = line.lastIndexOf(':');
    if (comma < 0 || at < 0 || colon <= at) {
      return Frame.ofAddress(line);
    }
    String address = line.substring(0, comma);
    String function = line.substring(Math.min(comma + 2, at), at);
    String absPath = line.substring(at + LOCATION_MARKER.length() - 1, colon);
    Integer lineno;
    try {
      lineno = Integer.valueOf(line.substring(colon + 1).strip());
    } catch (NumberFormatException e) {
      lineno = null;
    }
    return new Frame(null, function, null, lineno, null, absPath, address);
  }
}
