package sentry.dispatch;

/**
 * Outcome of one {@link EventDispatcher#flush()}.
 */
public enum FlushResult {
  /** Nothing was queued. */
  EMPTY,
  /** A rate-limit window was active; the queue was left untouched. */
  RATE_LIMITED,
  /** The server accepted the batch. */
  DELIVERED,
  /** The service answered with a non-success status and a JSON body, or with 429; the batch was dropped. */
  REJECTED,
  /** The server answered with a success status but no decodable event id; the batch was dropped. */
  PROTOCOL_ERROR,
  /**
   * The transport failed, or an error status came without a service body; the batch was put back
   * at the front of the queue.
   */
  REQUEUED
}
