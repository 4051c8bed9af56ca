package sentry.dispatch;

/**
 * Counts send operations that have started and not yet finished, so shutdown can wait for them.
 */
public interface InFlightTracker {
  void acquire();

  void release();

  int inFlight();
}
