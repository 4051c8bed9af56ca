package sentry.dispatch;

import sentry.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically triggers {@link EventDispatcher#flush()} on a single daemon thread.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 */
public final class FlushScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(FlushScheduler.class.getName());

    private final EventDispatcher dispatcher;
    private final long intervalMs;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> flushTask;
    private volatile boolean closed;

    /**
     * @param dispatcher the dispatcher to flush
     * @param interval   delay between the end of one flush and the start of the next
     * @throws IllegalArgumentException if {@code interval} is not positive
     */
    public FlushScheduler(EventDispatcher dispatcher, Duration interval) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.intervalMs = interval.toMillis();
    }

    /**
     * Starts the flush schedule. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("FlushScheduler has been closed");
        }
        if (flushTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("sentry-flush-scheduler-"));
        flushTask = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public boolean isStarted() {
        return flushTask != null;
    }

    /**
     * Runs one flush. Called by the scheduler, may also be invoked directly.
     */
    public void tick() {
        if (closed) {
            return;
        }
        try {
            dispatcher.flush();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Scheduled flush failed", t);
        }
    }

    /**
     * Cancels the schedule. A flush already running is allowed to finish.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (flushTask != null) {
            flushTask.cancel(false);
            flushTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.log(Level.WARNING, "Scheduled flush still running after 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
