package sentry.spi;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MetricsExporter} that remembers every count, for assertions.
 */
public final class CountingMetricsExporter implements MetricsExporter, AutoCloseable {
  public final AtomicInteger captured = new AtomicInteger();
  public final AtomicInteger dropped = new AtomicInteger();
  public final AtomicInteger sampledOut = new AtomicInteger();
  public final AtomicInteger vetoed = new AtomicInteger();
  public final AtomicInteger delivered = new AtomicInteger();
  public final AtomicInteger rejected = new AtomicInteger();
  public final AtomicInteger requeued = new AtomicInteger();
  public final AtomicInteger rateLimited = new AtomicInteger();
  public final AtomicInteger queueDepth = new AtomicInteger();
  public volatile boolean closed;

  @Override
  public void incrementCaptured() {
    captured.incrementAndGet();
  }

  @Override
  public void incrementDropped() {
    dropped.incrementAndGet();
  }

  @Override
  public void incrementSampledOut() {
    sampledOut.incrementAndGet();
  }

  @Override
  public void incrementVetoed() {
    vetoed.incrementAndGet();
  }

  @Override
  public void incrementDelivered(int events) {
    delivered.addAndGet(events);
  }

  @Override
  public void incrementRejected(int events) {
    rejected.addAndGet(events);
  }

  @Override
  public void incrementRequeued(int events) {
    requeued.addAndGet(events);
  }

  @Override
  public void incrementRateLimited() {
    rateLimited.incrementAndGet();
  }

  @Override
  public void recordQueueDepth(int depth) {
    queueDepth.set(depth);
  }

  @Override
  public void close() {
    closed = true;
  }
}
