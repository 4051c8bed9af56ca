package sentry;

import sentry.filter.EventFilter;
import sentry.transport.Dsn;
import sentry.util.Hostnames;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable client configuration. Every value is validated when {@link Builder#build()} runs,
 * so a bad DSN or sample rate fails at start-up rather than on the first event.
 */
public final class SentryOptions {
  public static final int DEFAULT_MAX_ATTACHMENT_SIZE = 20_971_520;
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final Dsn dsn;
  private final String serverName;
  private final String release;
  private final String environment;
  private final double sampleRate;
  private final int maxAttachmentSize;
  private final int maxQueueSize;
  private final Duration flushInterval;
  private final Duration drainTimeout;
  private final Duration requestTimeout;

  private SentryOptions(Builder builder) {
    if (builder.dsn == null || builder.dsn.isBlank()) {
      throw new IllegalArgumentException("dsn is required");
    }
    this.dsn = Dsn.parse(builder.dsn);
    this.serverName = builder.serverNameSet ? builder.serverName : Hostnames.localHostName();
    this.release = builder.release;
    this.environment = builder.environment;
    this.sampleRate = EventFilter.validateSampleRate(builder.sampleRate);

    if (builder.maxAttachmentSize <= 0) {
      throw new IllegalArgumentException("maxAttachmentSize must be > 0");
    }
    if (builder.maxQueueSize < 0) {
      throw new IllegalArgumentException("maxQueueSize must be >= 0");
    }
    this.maxAttachmentSize = builder.maxAttachmentSize;
    this.maxQueueSize = builder.maxQueueSize;
    this.flushInterval = requirePositive(builder.flushInterval, "flushInterval");
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.requestTimeout = requirePositive(builder.requestTimeout, "requestTimeout");
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Dsn dsn() {
    return dsn;
  }

  /**
   * Returns the value for {@code server_name}; the local host name unless overridden.
   */
  public String serverName() {
    return serverName;
  }

  public String release() {
    return release;
  }

  public String environment() {
    return environment;
  }

  public double sampleRate() {
    return sampleRate;
  }

  public int maxAttachmentSize() {
    return maxAttachmentSize;
  }

  /**
   * Returns the pending queue bound, {@code 0} meaning unbounded.
   */
  public int maxQueueSize() {
    return maxQueueSize;
  }

  public Duration flushInterval() {
    return flushInterval;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  public Duration requestTimeout() {
    return requestTimeout;
  }

  @Override
  public String toString() {
    return "SentryOptions{project=" + dsn.projectId() + ", serverName=" + serverName
        + ", release=" + release + ", environment=" + environment + ", sampleRate=" + sampleRate
        + ", maxQueueSize=" + maxQueueSize + ", flushInterval=" + flushInterval + "}";
  }

  /** Builder for {@link SentryOptions}. */
  public static final class Builder {
    private String dsn;
    private String serverName;
    private boolean serverNameSet;
    private String release;
    private String environment;
    private double sampleRate = 1.0;
    private int maxAttachmentSize = DEFAULT_MAX_ATTACHMENT_SIZE;
    private int maxQueueSize;
    private Duration flushInterval = DEFAULT_FLUSH_INTERVAL;
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param dsn connection descriptor, e.g. {@code https://key@example.com/42}
     * @return this builder
     */
    public Builder dsn(String dsn) {
      this.dsn = dsn;
      return this;
    }

    /**
     * Overrides the host name lookup. {@code null} omits {@code server_name} from events.
     *
     * @param serverName the server name
     * @return this builder
     */
    public Builder serverName(String serverName) {
      this.serverName = serverName;
      this.serverNameSet = true;
      return this;
    }

    public Builder release(String release) {
      this.release = release;
      return this;
    }

    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1.0}. Must lie in [0.0, 1.0].
     *
     * @param sampleRate probability that a captured event is kept
     * @return this builder
     */
    public Builder sampleRate(double sampleRate) {
      this.sampleRate = sampleRate;
      return this;
    }

    public Builder maxAttachmentSize(int maxAttachmentSize) {
      this.maxAttachmentSize = maxAttachmentSize;
      return this;
    }

    /**
     * Optional. Defaults to {@code 0} (unbounded).
     *
     * @param maxQueueSize the pending queue bound
     * @return this builder
     */
    public Builder maxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * @return the validated options
     * @throws IllegalArgumentException if the DSN is missing or malformed, or a value is out of range
     */
    public SentryOptions build() {
      return new SentryOptions(this);
    }
  }
}
