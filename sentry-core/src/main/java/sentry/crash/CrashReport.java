package sentry.crash;

import sentry.model.Event;
import sentry.model.ExceptionValue;
import sentry.model.Level;
import sentry.model.Message;
import sentry.model.Stacktrace;

import java.util.List;
import java.util.Objects;

/**
 * One crash recovered from a crash log: the header text and the frames that followed it.
 *
 * @param message header lines joined with {@code \n}, possibly empty
 * @param stacktrace frames in caller-to-callee order
 */
public record CrashReport(String message, Stacktrace stacktrace) {
  public static final String EXCEPTION_TYPE = "FatalError";

  public CrashReport {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(stacktrace, "stacktrace");
  }

  /**
   * Converts the report into a {@link Level#FATAL} event carrying one exception.
   *
   * @return an event builder, so callers can add server name, release and environment
   */
  public Event.Builder toEventBuilder() {
    Event.Builder builder = Event.builder()
        .level(Level.FATAL)
        .exceptions(List.of(new ExceptionValue(EXCEPTION_TYPE, message, stacktrace)));
    if (!message.isEmpty()) {
      builder.message(Message.raw(message));
    }
    return builder;
  }
}
