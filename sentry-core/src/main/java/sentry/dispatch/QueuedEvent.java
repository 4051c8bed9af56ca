package sentry.dispatch;

import sentry.envelope.Attachment;
import sentry.model.Event;

import java.util.List;
import java.util.Objects;

/**
 * Pending-queue entry: a filtered event, its attachments, and how many deliveries of it have
 * already failed at the transport level.
 */
public record QueuedEvent(Event event, List<Attachment> attachments, int attempts) {

  public QueuedEvent {
    Objects.requireNonNull(event, "event");
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  public static QueuedEvent of(Event event, List<Attachment> attachments) {
    return new QueuedEvent(event, attachments, 0);
  }

  QueuedEvent nextAttempt() {
    return new QueuedEvent(event, attachments, attempts + 1);
  }
}
