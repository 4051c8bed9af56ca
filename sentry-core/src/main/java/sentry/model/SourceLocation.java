package sentry.model;

/**
 * Call site of a log statement. Every component is optional.
 */
public record SourceLocation(String filename, String function, Integer lineno, Integer colno,
    String absPath) {

  public static SourceLocation of(String filename, String function, Integer lineno) {
    return new SourceLocation(filename, function, lineno, null, null);
  }

  public Frame toFrame() {
    return new Frame(filename, function, null, lineno, colno, absPath, null);
  }
}
