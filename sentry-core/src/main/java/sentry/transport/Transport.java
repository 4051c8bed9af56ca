package sentry.transport;

import java.io.IOException;

/**
 * Performs one HTTP POST. Implementations do not retry: requeue-on-failure is the
 * dispatcher's policy.
 *
 * @see HttpTransport
 */
public interface Transport extends AutoCloseable {

  /**
   * Sends a request and returns the complete response.
   *
   * @param request the request
   * @return the response, whatever its status
   * @throws IOException on timeout, connection failure or an unreadable response
   */
  TransportResponse send(TransportRequest request) throws IOException;

  /**
   * Releases resources held by the transport. The default does nothing.
   */
  @Override
  default void close() {
  }
}
