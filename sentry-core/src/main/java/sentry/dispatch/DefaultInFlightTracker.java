package sentry.dispatch;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * {@link AtomicInteger}-based in-flight counter.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private static final Logger logger = Logger.getLogger(DefaultInFlightTracker.class.getName());

    private final AtomicInteger inflight = new AtomicInteger();

    @Override
    public void acquire() {
        inflight.incrementAndGet();
    }

    @Override
    public void release() {
        int remaining = inflight.decrementAndGet();
        if (remaining < 0) {
            // unbalanced release; clamp so shutdown accounting stays usable
            inflight.compareAndSet(remaining, 0);
            logger.warning("In-flight counter released more often than acquired");
        }
    }

    @Override
    public int inFlight() {
        return inflight.get();
    }
}
