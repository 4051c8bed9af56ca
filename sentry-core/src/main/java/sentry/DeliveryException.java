package sentry;

/**
 * The ingestion service answered, but not with an accepted event id.
 *
 * <p>Raised to synchronous callers when the response body is missing or undecodable, or the
 * status is not a success. Unlike an {@link java.io.IOException} from the transport, a
 * delivery exception means the request reached the server, so the payload is never retried.
 */
public class DeliveryException extends Exception {

  private final int status;

  public DeliveryException(int status, String message) {
    super(message);
    this.status = status;
  }

  public DeliveryException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  /**
   * Returns the HTTP status of the offending response.
   *
   * @return the status code
   */
  public int status() {
    return status;
  }
}
