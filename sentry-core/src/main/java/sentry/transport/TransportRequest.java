package sentry.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One POST to an ingestion endpoint.
 */
public final class TransportRequest {
  private final URI uri;
  private final Map<String, String> headers;
  private final byte[] body;
  private final Duration timeout;

  public TransportRequest(URI uri, Map<String, String> headers, byte[] body, Duration timeout) {
    this.uri = Objects.requireNonNull(uri, "uri");
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(headers, "headers")));
    Objects.requireNonNull(body, "body");
    this.body = Arrays.copyOf(body, body.length);
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public URI uri() {
    return uri;
  }

  public Map<String, String> headers() {
    return headers;
  }

  public byte[] body() {
    return Arrays.copyOf(body, body.length);
  }

  public Duration timeout() {
    return timeout;
  }

  @Override
  public String toString() {
    return "TransportRequest{uri=" + uri + ", bytes=" + body.length + "}";
  }
}
