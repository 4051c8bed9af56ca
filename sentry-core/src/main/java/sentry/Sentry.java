package sentry;

import sentry.crash.CrashLogReader;
import sentry.crash.CrashReport;
import sentry.crash.StacktraceParser;
import sentry.dispatch.EventDispatcher;
import sentry.dispatch.FlushResult;
import sentry.dispatch.FlushScheduler;
import sentry.envelope.Attachment;
import sentry.envelope.Envelope;
import sentry.envelope.EnvelopeCodec;
import sentry.envelope.EventSerializer;
import sentry.envelope.SdkInfo;
import sentry.filter.BeforeSendHook;
import sentry.filter.EventFilter;
import sentry.model.Event;
import sentry.model.EventId;
import sentry.model.SourceLocation;
import sentry.ratelimit.RateLimiter;
import sentry.spi.MetricsExporter;
import sentry.transport.HttpTransport;
import sentry.transport.IngestClient;
import sentry.transport.Transport;
import sentry.util.JsonCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires the filter, rate limiter, ingestion client, dispatcher and flush
 * schedule into a single {@link AutoCloseable} client.
 *
 * <p>Two styles of delivery are offered:
 * <ul>
 *   <li><b>Fire-and-forget</b>: {@code capture*} methods filter the event and queue it. The
 *       queue is flushed periodically and on {@link #flush()}; transport failures are retried
 *       on the next flush.</li>
 *   <li><b>Request/response</b>: {@code send} methods post immediately and return the id the
 *       server echoed, raising {@link IOException} or {@link DeliveryException}. Nothing is
 *       retried.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Sentry sentry = Sentry.builder()
 *     .options(SentryOptions.builder()
 *         .dsn("https://public@o1.ingest.example.com/42")
 *         .release("shop@1.4.2")
 *         .build())
 *     .build()) {
 *   sentry.captureMessage("cache warmed", Level.INFO);
 * }
 * }</pre>
 */
public final class Sentry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Sentry.class.getName());

  public static final String SDK_NAME = "sentry-client-java";
  public static final String SDK_VERSION = "1.0.0";
  public static final String USER_AGENT = SDK_NAME + "/" + SDK_VERSION;

  private final SentryOptions options;
  private final Transport transport;
  private final RateLimiter rateLimiter;
  private final EventFilter filter;
  private final IngestClient ingestClient;
  private final EventSerializer serializer;
  private final EnvelopeCodec envelopeCodec;
  private final EventDispatcher dispatcher;
  private final FlushScheduler scheduler;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private Sentry(Builder builder) {
    this.options = Objects.requireNonNull(builder.options, "options");
    this.transport = builder.transport != null ? builder.transport : new HttpTransport();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.rateLimiter = new RateLimiter();
    this.filter = new EventFilter(options.sampleRate(), builder.beforeSend,
        builder.random != null ? builder.random : () -> ThreadLocalRandom.current().nextDouble(),
        metrics);
    JsonCodec jsonCodec = JsonCodec.getDefault();
    this.serializer = new EventSerializer(jsonCodec);
    this.envelopeCodec = new EnvelopeCodec(jsonCodec);
    this.ingestClient = new IngestClient(options.dsn(), transport, rateLimiter, jsonCodec, metrics,
        USER_AGENT, options.requestTimeout());
    this.dispatcher = EventDispatcher.builder()
        .ingestClient(ingestClient)
        .filter(filter)
        .rateLimiter(rateLimiter)
        .serializer(serializer)
        .envelopeCodec(envelopeCodec)
        .metrics(metrics)
        .sdk(new SdkInfo(SDK_NAME, SDK_VERSION))
        .maxQueueSize(options.maxQueueSize())
        .maxAttachmentSize(options.maxAttachmentSize())
        .drainTimeoutMs(options.drainTimeout().toMillis())
        .build();
    this.scheduler = new FlushScheduler(dispatcher, options.flushInterval());
    if (builder.scheduleFlush) {
      scheduler.start();
    }
    logger.log(Level.FINE, "Sentry client started: " + options);
  }

  public static Builder builder() {
    return new Builder();
  }

  public SentryOptions options() {
    return options;
  }

  // ── Fire-and-forget ─────────────────────────────────────────────

  /**
   * Queues an event. Server name, release and environment are filled in from the options where
   * the event leaves them unset.
   *
   * @param event the event
   * @return the queued event's id, or empty if it was sampled out, vetoed or dropped
   */
  public Optional<EventId> capture(Event event) {
    return capture(event, List.of());
  }

  public Optional<EventId> capture(Event event, List<Attachment> attachments) {
    return dispatcher.capture(applyDefaults(event), attachments);
  }

  public Optional<EventId> captureMessage(String message, sentry.model.Level level) {
    return captureMessage(message, level, null, null, null, null);
  }

  /**
   * Queues a log message.
   *
   * @param message     the message text
   * @param level       the severity
   * @param loggerName  logger name, may be {@code null}
   * @param transaction transaction name, may be {@code null}
   * @param tags        tags, may be {@code null}
   * @param location    call site, may be {@code null}
   * @return the queued event's id, or empty if it was suppressed
   */
  public Optional<EventId> captureMessage(String message, sentry.model.Level level, String loggerName,
      String transaction, Map<String, String> tags, SourceLocation location) {
    return capture(EventFactory.message(message, level, loggerName, transaction, tags, location).build());
  }

  public Optional<EventId> captureException(Throwable throwable) {
    return capture(EventFactory.exception(throwable).build());
  }

  /**
   * Reads the crash log at {@code path}, truncates it and queues one {@code fatal} event per
   * crash found.
   *
   * @param path the crash log written by a native crash handler
   * @return ids of the queued events; empty if the file is missing or holds no crash
   * @throws IOException if the file exists but cannot be read or truncated
   */
  public List<EventId> uploadCrashLog(Path path) throws IOException {
    List<CrashReport> reports = StacktraceParser.parse(CrashLogReader.readAndTruncate(path));
    List<EventId> ids = new ArrayList<>(reports.size());
    for (CrashReport report : reports) {
      capture(report.toEventBuilder().build()).ifPresent(ids::add);
    }
    if (!reports.isEmpty()) {
      logger.log(Level.INFO, "Recovered " + reports.size() + " crash report(s) from " + path);
    }
    return ids;
  }

  // ── Request/response ────────────────────────────────────────────

  /**
   * Filters and posts one event to the store endpoint on the calling thread.
   *
   * @param event the event
   * @return the id echoed by the server, or empty if rate limited, sampled out or vetoed
   * @throws IOException       on transport failure
   * @throws DeliveryException if the server rejected the event or answered without an id
   */
  public Optional<EventId> send(Event event) throws IOException, DeliveryException {
    if (rateLimiter.isBlocked()) {
      return Optional.empty();
    }
    Event filtered = filter.shouldSend(applyDefaults(event));
    if (filtered == null) {
      return Optional.empty();
    }
    return Optional.of(ingestClient.readEventId(ingestClient.postEvent(serializer.serialize(filtered))));
  }

  /**
   * Posts an envelope on the calling thread. Envelopes bypass sampling and the
   * {@code beforeSend} hook.
   *
   * @param envelope the envelope
   * @return the id echoed by the server, or empty if rate limited
   * @throws IOException       on transport failure
   * @throws DeliveryException if the server rejected the envelope or answered without an id
   */
  public Optional<EventId> send(Envelope envelope) throws IOException, DeliveryException {
    if (rateLimiter.isBlocked()) {
      return Optional.empty();
    }
    return Optional.of(ingestClient.readEventId(ingestClient.postEnvelope(envelopeCodec.encode(envelope))));
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  public FlushResult flush() {
    return dispatcher.flush();
  }

  public CompletableFuture<FlushResult> flushAsync() {
    return dispatcher.flushAsync();
  }

  /**
   * Waits for outstanding sends.
   *
   * @param timeout the longest time to wait
   * @return {@code true} if no send was in flight when this method returned
   */
  public boolean shutdownFlush(Duration timeout) {
    return dispatcher.shutdownFlush(timeout);
  }

  public int pendingEvents() {
    return dispatcher.queueSize();
  }

  public boolean isRateLimited() {
    return rateLimiter.isBlocked();
  }

  private Event applyDefaults(Event event) {
    Objects.requireNonNull(event, "event");
    boolean needsServerName = event.serverName() == null && options.serverName() != null;
    boolean needsRelease = event.release() == null && options.release() != null;
    boolean needsEnvironment = event.environment() == null && options.environment() != null;
    if (!needsServerName && !needsRelease && !needsEnvironment) {
      return event;
    }
    Event.Builder builder = event.toBuilder();
    if (needsServerName) {
      builder.serverName(options.serverName());
    }
    if (needsRelease) {
      builder.release(options.release());
    }
    if (needsEnvironment) {
      builder.environment(options.environment());
    }
    return builder.build();
  }

  /**
   * Shuts down in order: flush schedule, dispatcher (final flush and drain), transport,
   * metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      transport.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Sentry}. */
  public static final class Builder {
    private SentryOptions options;
    private BeforeSendHook beforeSend;
    private Transport transport;
    private MetricsExporter metrics;
    private DoubleSupplier random;
    private boolean scheduleFlush = true;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param options validated client options
     * @return this builder
     */
    public Builder options(SentryOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Sets a hook that may replace or veto each event after sampling.
     *
     * @param beforeSend the hook, may be {@code null}
     * @return this builder
     */
    public Builder beforeSend(BeforeSendHook beforeSend) {
      this.beforeSend = beforeSend;
      return this;
    }

    /**
     * Optional. Defaults to an {@link HttpTransport}. The transport is closed with the client.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    Builder random(DoubleSupplier random) {
      this.random = random;
      return this;
    }

    /**
     * Whether to flush every {@link SentryOptions#flushInterval()}. Defaults to {@code true};
     * when disabled, events leave only on {@link Sentry#flush()} and {@link Sentry#close()}.
     *
     * @param scheduleFlush {@code false} to flush manually
     * @return this builder
     */
    public Builder scheduleFlush(boolean scheduleFlush) {
      this.scheduleFlush = scheduleFlush;
      return this;
    }

    /**
     * @return a started client
     * @throws NullPointerException if {@code options} is null
     */
    public Sentry build() {
      return new Sentry(this);
    }
  }
}
