package sentry.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names the client's background threads and marks them as daemons.
 *
 * <p>A thread dump shows {@code sentry-flush-3} or {@code sentry-flush-scheduler-1}, so pending
 * deliveries are easy to tell apart from application threads. Events still queued when the JVM
 * exits are lost unless the client was closed first.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    return thread;
  }
}
