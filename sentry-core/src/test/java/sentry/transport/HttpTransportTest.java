package sentry.transport;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpTransportTest {

  private HttpServer server;
  private URI baseUri;
  private final HttpTransport transport = new HttpTransport();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
    baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void postsBodyAndHeaders() throws Exception {
    AtomicReference<String> auth = new AtomicReference<>();
    AtomicReference<String> method = new AtomicReference<>();
    AtomicReference<String> received = new AtomicReference<>();
    server.createContext("/api/1/envelope/", exchange -> {
      method.set(exchange.getRequestMethod());
      auth.set(exchange.getRequestHeaders().getFirst("X-Sentry-Auth"));
      try (InputStream in = exchange.getRequestBody()) {
        received.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
      }
      respond(exchange, 200, "{\"id\":\"fc6d8c0c43fc4630ad850ee518f1b9d0\"}");
    });

    TransportResponse response = transport.send(request("/api/1/envelope/", "payload"));

    assertEquals(200, response.status());
    assertEquals("{\"id\":\"fc6d8c0c43fc4630ad850ee518f1b9d0\"}", response.bodyAsString());
    assertEquals("POST", method.get());
    assertEquals("Sentry sentry_key=k", auth.get());
    assertEquals("payload", received.get());
  }

  @Test
  void responseHeadersAreExposed() throws Exception {
    server.createContext("/limited", exchange -> {
      exchange.getResponseHeaders().add("Retry-After", "42");
      respond(exchange, 429, "slow down");
    });

    TransportResponse response = transport.send(request("/limited", "x"));

    assertEquals(429, response.status());
    assertEquals("42", response.header("retry-after"));
  }

  @Test
  void oversizedResponseIsTransportError() {
    server.createContext("/big", exchange -> {
      byte[] body = new byte[HttpTransport.MAX_RESPONSE_BYTES + 1];
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });

    assertThrows(IOException.class, () -> transport.send(request("/big", "x")));
  }

  @Test
  void unreachableHostIsTransportError() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }

    TransportRequest request = new TransportRequest(URI.create("http://127.0.0.1:" + port + "/x"),
        Map.of(), new byte[0], Duration.ofSeconds(5));

    assertThrows(IOException.class, () -> transport.send(request));
  }

  private TransportRequest request(String path, String body) {
    return new TransportRequest(baseUri.resolve(path), Map.of("X-Sentry-Auth", "Sentry sentry_key=k"),
        body.getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(5));
  }

  private static void respond(HttpExchange exchange, int status, String body)
      throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
