package sentry.util;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the name of the local machine for the {@code server_name} event attribute.
 */
public final class Hostnames {
  private static final Logger logger = Logger.getLogger(Hostnames.class.getName());

  private Hostnames() {
  }

  /**
   * Returns the local host name, falling back to the {@code HOSTNAME} environment variable
   * and finally to an empty string.
   *
   * @return the host name (never {@code null})
   */
  public static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      logger.log(Level.FINE, "Local host name lookup failed", e);
      String env = System.getenv("HOSTNAME");
      return env == null ? "" : env;
    }
  }
}
