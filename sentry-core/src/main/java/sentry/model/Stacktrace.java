package sentry.model;

import java.util.List;

/**
 * Ordered frames from caller to callee: the first frame is the oldest, the last frame is
 * the one that raised.
 */
public record Stacktrace(List<Frame> frames) {
  public static final Stacktrace EMPTY = new Stacktrace(List.of());

  public Stacktrace {
    frames = frames == null ? List.of() : List.copyOf(frames);
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }
}
