package sentry.dispatch;

import sentry.DeliveryException;
import sentry.envelope.Attachment;
import sentry.envelope.Envelope;
import sentry.envelope.EnvelopeCodec;
import sentry.envelope.EnvelopeHeader;
import sentry.envelope.EnvelopeItem;
import sentry.envelope.EventSerializer;
import sentry.envelope.SdkInfo;
import sentry.filter.EventFilter;
import sentry.model.Event;
import sentry.model.EventId;
import sentry.ratelimit.RateLimiter;
import sentry.spi.MetricsExporter;
import sentry.transport.IngestClient;
import sentry.transport.TransportResponse;
import sentry.util.DaemonThreadFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the pending queue and moves captured events to the ingestion service.
 *
 * <p>{@link #capture} runs the {@link EventFilter} on the caller's thread and appends survivors
 * to the {@link EventBuffer}; it never performs I/O. {@link #flush()} is the only operation that
 * talks to the network: it swaps out the whole queue, sends it as one envelope and, if the
 * transport fails, puts the batch back at the front of the queue. An error status without a
 * JSON body counts as a transport failure, since it comes from a proxy in front of the service.
 * A batch the service itself answered is never retried, whatever the answer.
 *
 * <p>Concurrent flushes cannot double-send: the second one finds the queue already drained.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for a final drain bounded by the configured timeout.
 *
 * @see FlushScheduler
 */
public final class EventDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private static final long SHUTDOWN_POLL_INTERVAL_MS = 10;

  private final IngestClient ingestClient;
  private final EventFilter filter;
  private final RateLimiter rateLimiter;
  private final EventBuffer buffer;
  private final InFlightTracker inFlightTracker;
  private final EventSerializer serializer;
  private final EnvelopeCodec envelopeCodec;
  private final MetricsExporter metrics;
  private final SdkInfo sdk;
  private final int maxAttachmentSize;
  private final long drainTimeoutMs;
  private final ExecutorService flushExecutor;
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private EventDispatcher(Builder builder) {
    this.ingestClient = Objects.requireNonNull(builder.ingestClient, "ingestClient");
    this.filter = Objects.requireNonNull(builder.filter, "filter");
    this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.serializer = builder.serializer != null ? builder.serializer : new EventSerializer();
    this.envelopeCodec = builder.envelopeCodec != null ? builder.envelopeCodec : new EnvelopeCodec();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sdk = builder.sdk;

    if (builder.maxQueueSize < 0) {
      throw new IllegalArgumentException("maxQueueSize must be >= 0");
    }
    if (builder.maxAttachmentSize <= 0) {
      throw new IllegalArgumentException("maxAttachmentSize must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.buffer = new EventBuffer(builder.maxQueueSize);
    this.maxAttachmentSize = builder.maxAttachmentSize;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.flushExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("sentry-flush-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Filters an event and, if it survives, appends it to the pending queue.
   *
   * @param event       the event
   * @param attachments files to send with it, may be empty
   * @return the event's id (as replaced by the {@code beforeSend} hook, if it was), or empty if
   *     the event was sampled out, vetoed, the queue is full or the dispatcher is closed
   */
  public Optional<EventId> capture(Event event, List<Attachment> attachments) {
    Objects.requireNonNull(event, "event");
    if (!accepting.get()) {
      logger.log(Level.FINE, "Dispatcher closed, event dropped: " + event.eventId());
      return Optional.empty();
    }
    Event filtered = filter.shouldSend(event);
    if (filtered == null) {
      return Optional.empty();
    }
    if (!buffer.offer(QueuedEvent.of(filtered, attachments))) {
      metrics.incrementDropped();
      logger.log(Level.WARNING, "Pending queue full (" + buffer.maxSize() + "), event dropped: "
          + filtered.eventId());
      return Optional.empty();
    }
    metrics.incrementCaptured();
    metrics.recordQueueDepth(buffer.size());
    return Optional.of(filtered.eventId());
  }

  /**
   * Sends everything queued as one envelope, on the calling thread.
   *
   * @return what happened to the batch
   */
  public FlushResult flush() {
    inFlightTracker.acquire();
    metrics.recordInFlight(inFlightTracker.inFlight());
    try {
      return drainAndSend();
    } finally {
      inFlightTracker.release();
      metrics.recordInFlight(inFlightTracker.inFlight());
    }
  }

  /**
   * Runs {@link #flush()} on a background thread. The send counts as in flight from the moment
   * this method returns, so a following {@link #shutdownFlush} waits for it.
   *
   * @return the eventual result
   */
  public CompletableFuture<FlushResult> flushAsync() {
    inFlightTracker.acquire();
    CompletableFuture<FlushResult> result = new CompletableFuture<>();
    try {
      flushExecutor.execute(() -> {
        try {
          result.complete(drainAndSend());
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Asynchronous flush failed", t);
          result.completeExceptionally(t);
        } finally {
          inFlightTracker.release();
        }
      });
    } catch (RejectedExecutionException e) {
      inFlightTracker.release();
      logger.log(Level.FINE, "Flush executor shut down, asynchronous flush skipped");
      result.complete(FlushResult.EMPTY);
    }
    return result;
  }

  private FlushResult drainAndSend() {
    if (buffer.isEmpty()) {
      return FlushResult.EMPTY;
    }
    if (rateLimiter.isBlocked()) {
      logger.log(Level.FINE, "Rate limited until " + rateLimiter.blockedUntil() + ", "
          + buffer.size() + " event(s) kept queued");
      return FlushResult.RATE_LIMITED;
    }
    List<QueuedEvent> batch = buffer.drainAll();
    if (batch.isEmpty()) {
      return FlushResult.EMPTY;
    }
    metrics.recordQueueDepth(buffer.size());
    return send(batch);
  }

  private FlushResult send(List<QueuedEvent> batch) {
    Envelope envelope = toEnvelope(batch);
    if (envelope.items().isEmpty()) {
      // every event failed to serialize and was already counted
      return FlushResult.REJECTED;
    }
    byte[] body = envelopeCodec.encode(envelope);

    TransportResponse response;
    try {
      response = ingestClient.postEnvelope(body);
    } catch (IOException e) {
      return requeue(batch, "Envelope delivery failed", e);
    }

    if (!response.isSuccess()) {
      if (response.status() != RateLimiter.TOO_MANY_REQUESTS && !ingestClient.hasServiceBody(response)) {
        return requeue(batch, "Envelope delivery failed with status " + response.status()
            + " and no service response", null);
      }
      metrics.incrementRejected(batch.size());
      if (response.status() == RateLimiter.TOO_MANY_REQUESTS) {
        logger.log(Level.WARNING, "Batch of " + batch.size() + " event(s) dropped by rate limiting");
      } else {
        logger.log(Level.WARNING, "Batch of " + batch.size() + " event(s) rejected with status "
            + response.status() + ": " + response.bodyAsString());
      }
      return FlushResult.REJECTED;
    }
    try {
      EventId accepted = ingestClient.readEventId(response);
      metrics.incrementDelivered(batch.size());
      logger.log(Level.FINE, "Delivered " + batch.size() + " event(s), server id " + accepted);
      return FlushResult.DELIVERED;
    } catch (DeliveryException e) {
      metrics.incrementRejected(batch.size());
      logger.log(Level.WARNING, "Malformed ingestion response for batch of " + batch.size()
          + " event(s), not retried", e);
      return FlushResult.PROTOCOL_ERROR;
    }
  }

  private FlushResult requeue(List<QueuedEvent> batch, String reason, Throwable cause) {
    List<QueuedEvent> retry = new ArrayList<>(batch.size());
    int maxAttempts = 0;
    for (QueuedEvent queued : batch) {
      QueuedEvent next = queued.nextAttempt();
      maxAttempts = Math.max(maxAttempts, next.attempts());
      retry.add(next);
    }
    buffer.requeueFront(retry);
    metrics.incrementRequeued(batch.size());
    metrics.recordQueueDepth(buffer.size());
    logger.log(Level.WARNING, reason + ", " + batch.size() + " event(s) requeued for the next flush"
        + " (most retried event has failed " + maxAttempts + " time(s))", cause);
    return FlushResult.REQUEUED;
  }

  private Envelope toEnvelope(List<QueuedEvent> batch) {
    List<EnvelopeItem> items = new ArrayList<>();
    for (QueuedEvent queued : batch) {
      Event event = queued.event();
      try {
        items.add(serializer.toEnvelopeItem(event));
      } catch (RuntimeException e) {
        metrics.incrementRejected(1);
        logger.log(Level.SEVERE, "Failed to serialize event " + event.eventId() + ", dropped", e);
        continue;
      }
      for (Attachment attachment : queued.attachments()) {
        try {
          items.add(attachment.toEnvelopeItem(maxAttachmentSize));
        } catch (IllegalArgumentException e) {
          logger.log(Level.WARNING, "Attachment dropped from event " + event.eventId() + ": "
              + e.getMessage());
        }
      }
    }
    EventId headerId = batch.size() == 1 ? batch.get(0).event().eventId() : null;
    EnvelopeHeader header = new EnvelopeHeader(headerId, ingestClient.dsn().withoutSecret(), sdk);
    return new Envelope(header, items);
  }

  /**
   * Waits until no send is in flight or the timeout elapses. Never cancels a send.
   *
   * @param timeout the longest time to wait
   * @return {@code true} if nothing was in flight when this method returned
   */
  public boolean shutdownFlush(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (inFlightTracker.inFlight() > 0) {
      if (System.nanoTime() - deadline >= 0) {
        logger.log(Level.WARNING, "Shutdown drain timed out with " + inFlightTracker.inFlight()
            + " send(s) in flight and " + buffer.size() + " event(s) queued");
        return false;
      }
      try {
        Thread.sleep(SHUTDOWN_POLL_INTERVAL_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return inFlightTracker.inFlight() == 0;
      }
    }
    return true;
  }

  public int queueSize() {
    return buffer.size();
  }

  public int inFlight() {
    return inFlightTracker.inFlight();
  }

  EventBuffer buffer() {
    return buffer;
  }

  /**
   * Stops accepting events, starts a final flush and waits up to the drain timeout for it and
   * any other outstanding send.
   */
  @Override
  public void close() {
    if (!accepting.getAndSet(false)) {
      return;
    }
    flushAsync();
    shutdownFlush(Duration.ofMillis(drainTimeoutMs));
    flushExecutor.shutdown();
    try {
      if (!flushExecutor.awaitTermination(SHUTDOWN_POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
        logger.log(Level.FINE, "Flush threads still running after close; they finish in the background");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventDispatcher}. */
  public static final class Builder {
    private IngestClient ingestClient;
    private EventFilter filter;
    private RateLimiter rateLimiter;
    private InFlightTracker inFlightTracker;
    private EventSerializer serializer;
    private EnvelopeCodec envelopeCodec;
    private MetricsExporter metrics;
    private SdkInfo sdk;
    private int maxQueueSize;
    private int maxAttachmentSize = 20_971_520;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the client that posts envelopes. It must share {@link #rateLimiter} so 429 responses
     * suppress later flushes.
     *
     * <p><b>Required.</b>
     *
     * @param ingestClient the ingestion client
     * @return this builder
     */
    public Builder ingestClient(IngestClient ingestClient) {
      this.ingestClient = ingestClient;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param filter sampling and {@code beforeSend} stage applied on capture
     * @return this builder
     */
    public Builder filter(EventFilter filter) {
      this.filter = filter;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param rateLimiter limiter consulted before each flush
     * @return this builder
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    public Builder serializer(EventSerializer serializer) {
      this.serializer = serializer;
      return this;
    }

    public Builder envelopeCodec(EnvelopeCodec envelopeCodec) {
      this.envelopeCodec = envelopeCodec;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder sdk(SdkInfo sdk) {
      this.sdk = sdk;
      return this;
    }

    /**
     * Bounds the pending queue. Events captured while it is full are dropped and counted.
     *
     * <p>Optional. Defaults to {@code 0}, meaning unbounded: an unreachable endpoint then grows
     * the queue without limit.
     *
     * @param maxQueueSize maximum queued events, or {@code 0}
     * @return this builder
     */
    public Builder maxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    /**
     * Optional. Defaults to 20 MiB. Larger attachments are dropped, their event is still sent.
     *
     * @param maxAttachmentSize largest attachment in bytes
     * @return this builder
     */
    public Builder maxAttachmentSize(int maxAttachmentSize) {
      this.maxAttachmentSize = maxAttachmentSize;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for in-flight sends.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * @return a new dispatcher
     * @throws NullPointerException if {@code ingestClient}, {@code filter} or {@code rateLimiter}
     *     is null
     * @throws IllegalArgumentException if a size or timeout is out of range
     */
    public EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }
}
