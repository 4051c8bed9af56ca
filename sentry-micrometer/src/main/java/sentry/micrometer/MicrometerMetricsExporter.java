package sentry.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import sentry.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MetricsExporter} backed by a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code sentry.events.captured}: events accepted into the pending queue</li>
 *   <li>{@code sentry.events.dropped}: events refused because the queue was full</li>
 *   <li>{@code sentry.events.sampled_out}: events discarded by sampling</li>
 *   <li>{@code sentry.events.vetoed}: events discarded by the {@code beforeSend} hook</li>
 *   <li>{@code sentry.events.delivered}: events the ingestion service accepted</li>
 *   <li>{@code sentry.events.rejected}: events dropped after a rejection or bad response</li>
 *   <li>{@code sentry.events.requeued}: events put back after a transport failure</li>
 *   <li>{@code sentry.rate_limited}: 429 responses received</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code sentry.queue.depth}: pending queue size</li>
 *   <li>{@code sentry.sends.in_flight}: flushes currently running</li>
 *   <li>{@code sentry.send.latency}: time spent in the transport per request</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter captured;
  private final Counter dropped;
  private final Counter sampledOut;
  private final Counter vetoed;
  private final Counter delivered;
  private final Counter rejected;
  private final Counter requeued;
  private final Counter rateLimited;
  private final Gauge queueDepthGauge;
  private final Gauge inFlightGauge;
  private final Timer sendLatency;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the metric name prefix {@code "sentry"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "sentry");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names, e.g. {@code "checkout.sentry"} when several
   *                   clients share a registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.captured = counter(namePrefix + ".events.captured", "Events accepted into the pending queue");
    this.dropped = counter(namePrefix + ".events.dropped", "Events refused because the queue was full");
    this.sampledOut = counter(namePrefix + ".events.sampled_out", "Events discarded by sampling");
    this.vetoed = counter(namePrefix + ".events.vetoed", "Events discarded by the beforeSend hook");
    this.delivered = counter(namePrefix + ".events.delivered", "Events accepted by the ingestion service");
    this.rejected = counter(namePrefix + ".events.rejected", "Events dropped after a rejection");
    this.requeued = counter(namePrefix + ".events.requeued", "Events requeued after a transport failure");
    this.rateLimited = counter(namePrefix + ".rate_limited", "Rate-limit responses received");

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.inFlightGauge = Gauge.builder(namePrefix + ".sends.in_flight", inFlight, AtomicInteger::get)
        .register(registry);
    this.sendLatency = Timer.builder(namePrefix + ".send.latency")
        .description("Time spent in the transport per request")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementCaptured() {
    if (closed) return;
    captured.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementSampledOut() {
    if (closed) return;
    sampledOut.increment();
  }

  @Override
  public void incrementVetoed() {
    if (closed) return;
    vetoed.increment();
  }

  @Override
  public void incrementDelivered(int events) {
    if (closed) return;
    delivered.increment(events);
  }

  @Override
  public void incrementRejected(int events) {
    if (closed) return;
    rejected.increment(events);
  }

  @Override
  public void incrementRequeued(int events) {
    if (closed) return;
    requeued.increment(events);
  }

  @Override
  public void incrementRateLimited() {
    if (closed) return;
    rateLimited.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordInFlight(int sends) {
    if (closed) return;
    inFlight.set(sends);
  }

  @Override
  public void recordSendLatencyMs(long latencyMs) {
    if (closed) return;
    sendLatency.record(Duration.ofMillis(latencyMs));
  }

  /**
   * Removes every meter this exporter registered, so a closed client leaves no stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(captured, dropped, sampledOut, vetoed, delivered, rejected, requeued,
        rateLimited, queueDepthGauge, inFlightGauge, sendLatency)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
