package sentry.transport;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed connection descriptor.
 *
 * <p>Format: {@code {scheme}://{publicKey}[:{secretKey}]@{host}[:{port}]{/path}/{projectId}}.
 * Resolves into the store endpoint (single JSON event), the envelope endpoint, and the value of
 * the {@code X-Sentry-Auth} header.
 */
public final class Dsn {
  public static final int PROTOCOL_VERSION = 7;

  private final String raw;
  private final String publicKey;
  private final String secretKey;
  private final String projectId;
  private final URI storeUri;
  private final URI envelopeUri;

  private Dsn(String raw, String publicKey, String secretKey, String projectId, String apiBase) {
    this.raw = raw;
    this.publicKey = publicKey;
    this.secretKey = secretKey;
    this.projectId = projectId;
    this.storeUri = URI.create(apiBase + "store/");
    this.envelopeUri = URI.create(apiBase + "envelope/");
  }

  /**
   * Parses a DSN string.
   *
   * @param dsn the connection descriptor
   * @return the parsed descriptor
   * @throws IllegalArgumentException if the DSN is malformed
   */
  public static Dsn parse(String dsn) {
    Objects.requireNonNull(dsn, "dsn");
    URI uri;
    try {
      uri = new URI(dsn.trim());
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid DSN: " + dsn, e);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("DSN scheme must be http or https: " + dsn);
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("DSN is missing a host: " + dsn);
    }
    String userInfo = uri.getRawUserInfo();
    if (userInfo == null || userInfo.isEmpty()) {
      throw new IllegalArgumentException("DSN is missing a public key: " + dsn);
    }
    String publicKey;
    String secretKey = null;
    int colon = userInfo.indexOf(':');
    if (colon >= 0) {
      publicKey = userInfo.substring(0, colon);
      secretKey = userInfo.substring(colon + 1);
      if (secretKey.isEmpty()) {
        secretKey = null;
      }
    } else {
      publicKey = userInfo;
    }
    if (publicKey.isEmpty()) {
      throw new IllegalArgumentException("DSN is missing a public key: " + dsn);
    }

    String path = uri.getRawPath() == null ? "" : uri.getRawPath();
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    int slash = path.lastIndexOf('/');
    String projectId = slash >= 0 ? path.substring(slash + 1) : path;
    if (projectId.isEmpty()) {
      throw new IllegalArgumentException("DSN is missing a project id: " + dsn);
    }
    String prefix = slash >= 0 ? path.substring(0, slash) : "";

    StringBuilder base = new StringBuilder()
        .append(scheme.toLowerCase(Locale.ROOT)).append("://").append(uri.getHost());
    if (uri.getPort() >= 0) {
      base.append(':').append(uri.getPort());
    }
    base.append(prefix).append("/api/").append(projectId).append('/');
    return new Dsn(dsn, publicKey, secretKey, projectId, base.toString());
  }

  public String publicKey() {
    return publicKey;
  }

  public String secretKey() {
    return secretKey;
  }

  public String projectId() {
    return projectId;
  }

  public URI storeUri() {
    return storeUri;
  }

  public URI envelopeUri() {
    return envelopeUri;
  }

  /**
   * Returns the DSN with the secret key removed. This form is safe to embed in payloads such as
   * envelope headers.
   */
  public String withoutSecret() {
    if (secretKey == null) {
      return raw;
    }
    String trimmed = raw.trim();
    int userInfoStart = trimmed.indexOf("://") + 3;
    int at = trimmed.indexOf('@', userInfoStart);
    return trimmed.substring(0, userInfoStart) + publicKey + trimmed.substring(at);
  }

  /**
   * Builds the {@code X-Sentry-Auth} header value.
   *
   * @param userAgent SDK identifier sent as {@code sentry_client}
   * @return the header value
   */
  public String authHeader(String userAgent) {
    StringBuilder sb = new StringBuilder("Sentry sentry_version=").append(PROTOCOL_VERSION)
        .append(", sentry_client=").append(userAgent)
        .append(", sentry_key=").append(publicKey);
    if (secretKey != null) {
      sb.append(", sentry_secret=").append(secretKey);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Dsn other)) {
      return false;
    }
    return raw.equals(other.raw);
  }

  @Override
  public int hashCode() {
    return raw.hashCode();
  }

  /**
   * Returns the original DSN string, secret key included.
   */
  @Override
  public String toString() {
    return raw;
  }
}
