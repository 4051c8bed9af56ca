package sentry.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Transport} backed by {@link java.net.http.HttpClient}.
 *
 * <p>Each request carries its own timeout. A request that has been issued is never cancelled
 * by this class; it either completes or times out. Response bodies larger than
 * {@value #MAX_RESPONSE_BYTES} bytes are treated as a transport failure.
 */
public final class HttpTransport implements Transport {
  public static final int MAX_RESPONSE_BYTES = 1024 * 1024;

  private final HttpClient httpClient;

  public HttpTransport() {
    this(HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  public HttpTransport(HttpClient httpClient) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  @Override
  public TransportResponse send(TransportRequest request) throws IOException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
        .timeout(request.timeout())
        .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()));
    for (Map.Entry<String, String> header : request.headers().entrySet()) {
      builder.header(header.getKey(), header.getValue());
    }
    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("Interrupted while sending to " + request.uri());
      interrupted.initCause(e);
      throw interrupted;
    }
    byte[] body = response.body();
    if (body != null && body.length > MAX_RESPONSE_BYTES) {
      throw new IOException("Response body of " + body.length + " bytes exceeds " + MAX_RESPONSE_BYTES);
    }
    return new TransportResponse(response.statusCode(), response.headers().map(), body);
  }
}
