package sentry;

import sentry.model.Event;
import sentry.model.ExceptionValue;
import sentry.model.Frame;
import sentry.model.Level;
import sentry.model.Message;
import sentry.model.SourceLocation;
import sentry.model.Stacktrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds events from log messages and Java throwables.
 */
public final class EventFactory {

  private EventFactory() {
  }

  /**
   * Builds a message event. When a call site is given it travels as a single-frame exception
   * whose type is the message, which is how the ingestion service groups log messages by origin.
   *
   * @param message     the message text
   * @param level       the severity
   * @param logger      logger name, may be {@code null}
   * @param transaction transaction name, may be {@code null}
   * @param tags        tags, may be {@code null} or empty
   * @param location    call site, may be {@code null}
   * @return a builder carrying the message
   */
  public static Event.Builder message(String message, Level level, String logger, String transaction,
      Map<String, String> tags, SourceLocation location) {
    Event.Builder builder = Event.builder()
        .level(level)
        .logger(logger)
        .transaction(transaction)
        .message(Message.raw(message));
    if (tags != null && !tags.isEmpty()) {
      builder.tags(tags);
    }
    if (location != null) {
      builder.exceptions(List.of(
          new ExceptionValue(message, null, new Stacktrace(List.of(location.toFrame())))));
    }
    return builder;
  }

  /**
   * Builds an {@link Level#ERROR} event from a throwable and its causes.
   *
   * @param throwable the throwable
   * @return a builder carrying the exception chain
   */
  public static Event.Builder exception(Throwable throwable) {
    String message = throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getName();
    return Event.builder()
        .level(Level.ERROR)
        .message(Message.raw(message))
        .exceptions(exceptionChain(throwable));
  }

  /**
   * Converts a throwable and its causes, root cause first.
   *
   * @param throwable the outermost throwable
   * @return the chain
   */
  public static List<ExceptionValue> exceptionChain(Throwable throwable) {
    List<ExceptionValue> chain = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable t = throwable; t != null && seen.add(t); t = t.getCause()) {
      chain.add(new ExceptionValue(t.getClass().getName(), t.getMessage(), stacktrace(t)));
    }
    Collections.reverse(chain);
    return chain;
  }

  /**
   * Converts a Java stack trace, which lists the innermost call first, into caller-to-callee order.
   */
  static Stacktrace stacktrace(Throwable throwable) {
    StackTraceElement[] elements = throwable.getStackTrace();
    List<Frame> frames = new ArrayList<>(elements.length);
    for (int i = elements.length - 1; i >= 0; i--) {
      StackTraceElement element = elements[i];
      Integer lineno = element.getLineNumber() > 0 ? element.getLineNumber() : null;
      frames.add(new Frame(element.getFileName(), element.getClassName() + "." + element.getMethodName(),
          null, lineno, null, null, null));
    }
    return new Stacktrace(frames);
  }
}
