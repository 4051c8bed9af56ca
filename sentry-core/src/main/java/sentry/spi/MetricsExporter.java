package sentry.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events that survived filtering and were queued.
     */
    void incrementCaptured();

    /**
     * Increments the count of events dropped because the pending queue was full.
     */
    void incrementDropped();

    /**
     * Increments the count of events rejected by probabilistic sampling.
     */
    void incrementSampledOut();

    /**
     * Increments the count of events vetoed by the {@code beforeSend} hook.
     */
    void incrementVetoed();

    /**
     * Adds to the count of events accepted by the ingestion service.
     *
     * @param events number of events in the delivered batch
     */
    void incrementDelivered(int events);

    /**
     * Adds to the count of events in batches the server rejected or answered with a
     * malformed body. These are not retried.
     *
     * @param events number of events in the rejected batch
     */
    void incrementRejected(int events);

    /**
     * Adds to the count of events put back at the front of the queue after a transport failure.
     *
     * @param events number of events requeued
     */
    void incrementRequeued(int events);

    /**
     * Increments the count of HTTP 429 responses.
     */
    default void incrementRateLimited() {
    }

    /**
     * Records the current depth of the pending queue.
     *
     * @param depth number of events awaiting delivery
     */
    void recordQueueDepth(int depth);

    /**
     * Records the number of sends currently in flight.
     *
     * @param inFlight outstanding send operations
     */
    default void recordInFlight(int inFlight) {
    }

    /**
     * Records the time one HTTP send took, success or not.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordSendLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementCaptured() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void incrementSampledOut() {
        }

        @Override
        public void incrementVetoed() {
        }

        @Override
        public void incrementDelivered(int events) {
        }

        @Override
        public void incrementRejected(int events) {
        }

        @Override
        public void incrementRequeued(int events) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
