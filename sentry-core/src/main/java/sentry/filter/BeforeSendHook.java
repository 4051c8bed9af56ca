package sentry.filter;

import sentry.model.Event;

/**
 * Hook called just before an event is queued or sent.
 *
 * <p>Return the event (or a replacement built with {@link Event#toBuilder()}) to keep it,
 * or {@code null} to drop it.
 *
 * <pre>{@code
 * Sentry.builder()
 *     .dsn(dsn)
 *     .beforeSend(event -> event.tags().containsKey("health-check") ? null : event)
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface BeforeSendHook {

  /**
   * @param event the event about to be sent
   * @return the event to send, or {@code null} to discard it
   */
  Event beforeSend(Event event);
}
