/**
 * Client for an error-tracking ingestion service.
 *
 * <h2>Core Design</h2>
 * <p>Applications hand events to {@link sentry.Sentry}, directly or through the
 * {@linkplain sentry.logging.SentryHandler java.util.logging handler}. Each event passes the
 * {@linkplain sentry.filter.EventFilter sampler and beforeSend hook} on the caller's thread and is
 * appended to the {@linkplain sentry.dispatch.EventBuffer pending queue}. A
 * {@linkplain sentry.dispatch.FlushScheduler periodic flush} swaps the queue out, encodes it as one
 * {@linkplain sentry.envelope.EnvelopeCodec envelope} and posts it. If the post fails at the
 * transport level the batch goes back to the front of the queue; once the server has answered,
 * the batch is never sent again. HTTP 429 answers suspend flushing through the
 * {@linkplain sentry.ratelimit.RateLimiter rate limiter}.
 *
 * <p>Crash text left behind by a native crash handler is recovered with
 * {@link sentry.Sentry#uploadCrashLog(java.nio.file.Path)}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>sentry-core</b>: event model, pipeline, transport (zero external deps)</li>
 *   <li><b>sentry-micrometer</b>: {@code MetricsExporter} backed by Micrometer</li>
 *   <li><b>sentry-spring-boot-starter</b>: auto-configuration from {@code sentry.*} properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (Sentry sentry = Sentry.builder()
 *     .options(SentryOptions.builder()
 *         .dsn("https://public@o1.ingest.example.com/42")
 *         .environment("production")
 *         .sampleRate(0.5)
 *         .build())
 *     .beforeSend(event -> event.tags().containsKey("synthetic") ? null : event)
 *     .build()) {
 *
 *     Logger.getLogger("").addHandler(new SentryHandler(sentry));
 *
 *     try {
 *         checkout.run();
 *     } catch (RuntimeException e) {
 *         sentry.captureException(e);
 *     }
 * }
 * }</pre>
 *
 * @see sentry.Sentry
 * @see sentry.SentryOptions
 * @see sentry.model.Event
 */
package sentry;
