package sentry.transport;

import sentry.DeliveryException;
import sentry.envelope.EnvelopeCodec;
import sentry.model.EventId;
import sentry.ratelimit.RateLimiter;
import sentry.spi.MetricsExporter;
import sentry.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Posts serialized payloads to the ingestion endpoints of one {@link Dsn}.
 *
 * <p>Every response, whatever its status, is forwarded to the {@link RateLimiter} before it is
 * returned. Deciding what to do with the response (retry, drop, surface) is left to the caller.
 */
public final class IngestClient {
  public static final String JSON_CONTENT_TYPE = "application/json";
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final Dsn dsn;
  private final Transport transport;
  private final RateLimiter rateLimiter;
  private final JsonCodec jsonCodec;
  private final MetricsExporter metrics;
  private final String userAgent;
  private final Duration requestTimeout;

  public IngestClient(Dsn dsn, Transport transport, RateLimiter rateLimiter, String userAgent) {
    this(dsn, transport, rateLimiter, JsonCodec.getDefault(), MetricsExporter.NOOP, userAgent,
        DEFAULT_REQUEST_TIMEOUT);
  }

  public IngestClient(Dsn dsn, Transport transport, RateLimiter rateLimiter, JsonCodec jsonCodec,
      MetricsExporter metrics, String userAgent, Duration requestTimeout) {
    this.dsn = Objects.requireNonNull(dsn, "dsn");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  public Dsn dsn() {
    return dsn;
  }

  /**
   * Posts one JSON-encoded event to the store endpoint.
   *
   * @param eventJson the serialized event
   * @return the response
   * @throws IOException on transport failure
   */
  public TransportResponse postEvent(byte[] eventJson) throws IOException {
    return post(dsn.storeUri(), JSON_CONTENT_TYPE, eventJson);
  }

  /**
   * Posts an encoded envelope to the envelope endpoint.
   *
   * @param envelope the encoded envelope
   * @return the response
   * @throws IOException on transport failure
   */
  public TransportResponse postEnvelope(byte[] envelope) throws IOException {
    return post(dsn.envelopeUri(), EnvelopeCodec.CONTENT_TYPE, envelope);
  }

  private TransportResponse post(URI uri, String contentType, byte[] body) throws IOException {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", contentType);
    headers.put("User-Agent", userAgent);
    headers.put("X-Sentry-Auth", dsn.authHeader(userAgent));
    TransportRequest request = new TransportRequest(uri, headers, body, requestTimeout);

    long start = System.nanoTime();
    TransportResponse response;
    try {
      response = transport.send(request);
    } finally {
      metrics.recordSendLatencyMs(Math.max(0L, (System.nanoTime() - start) / 1_000_000L));
    }
    if (rateLimiter.update(response)) {
      metrics.incrementRateLimited();
    }
    return response;
  }

  /**
   * Extracts the event id echoed by the server.
   *
   * @param response a response from one of the post methods
   * @return the accepted event id
   * @throws DeliveryException if the status is not a success, or the body has no decodable
   *     {@code id} member
   */
  /**
   * Tells whether the response body is a JSON object. Gateways and proxies in front of the
   * ingestion service answer with empty or HTML bodies; the service itself always answers
   * with an object.
   *
   * @param response a response from either endpoint
   * @return {@code true} if the body parses as a JSON object
   */
  public boolean hasServiceBody(TransportResponse response) {
    String body = response.bodyAsString();
    if (body.isBlank()) {
      return false;
    }
    try {
      jsonCodec.parseObject(body);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  public EventId readEventId(TransportResponse response) throws DeliveryException {
    if (!response.isSuccess()) {
      throw new DeliveryException(response.status(),
          "Ingestion service rejected the request with status " + response.status());
    }
    String body = response.bodyAsString();
    if (body.isBlank()) {
      throw new DeliveryException(response.status(), "Response has no body");
    }
    try {
      String id = jsonCodec.parseObject(body).get("id");
      if (id == null) {
        throw new DeliveryException(response.status(), "Response has no event id: " + body);
      }
      return EventId.fromHex(id);
    } catch (IllegalArgumentException e) {
      throw new DeliveryException(response.status(), "Undecodable response body: " + body, e);
    }
  }
}
