package sentry.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Status, headers and body of an ingestion response. Header lookup is case-insensitive.
 */
public final class TransportResponse {
  private final int status;
  private final Map<String, List<String>> headers;
  private final byte[] body;

  public TransportResponse(int status, Map<String, List<String>> headers, byte[] body) {
    this.status = status;
    Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) {
      headers.forEach((name, values) -> {
        if (name != null && values != null) {
          copy.put(name, List.copyOf(values));
        }
      });
    }
    this.headers = copy;
    this.body = body == null ? new byte[0] : Arrays.copyOf(body, body.length);
  }

  public static TransportResponse of(int status, String body) {
    return new TransportResponse(status, Map.of(), Objects.requireNonNull(body, "body").getBytes(StandardCharsets.UTF_8));
  }

  public int status() {
    return status;
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  /**
   * Returns the first value of a header, or {@code null}.
   *
   * @param name header name, any case
   * @return the first value, or {@code null} if absent
   */
  public String header(String name) {
    List<String> values = headers.get(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  public byte[] body() {
    return Arrays.copyOf(body, body.length);
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "TransportResponse{status=" + status + ", bytes=" + body.length + "}";
  }
}
