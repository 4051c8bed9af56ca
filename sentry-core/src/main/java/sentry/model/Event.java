package sentry.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable error/log event.
 *
 * <p>Each event is assigned a random {@link EventId} and the current time unless the builder
 * supplies them. A {@code beforeSend} hook that wants to change an event builds a replacement
 * with {@link #toBuilder()}.
 *
 * @see sentry.envelope.EventSerializer
 */
public final class Event {
  public static final String PLATFORM = "java";

  private final EventId eventId;
  private final Instant timestamp;
  private final Level level;
  private final String logger;
  private final String transaction;
  private final String serverName;
  private final String release;
  private final String environment;
  private final Map<String, String> tags;
  private final Message message;
  private final List<ExceptionValue> exceptions;
  private final List<Breadcrumb> breadcrumbs;
  private final User user;

  private Event(Builder builder) {
    this.eventId = builder.eventId == null ? EventId.random() : builder.eventId;
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.level = builder.level == null ? Level.ERROR : builder.level;
    this.logger = builder.logger;
    this.transaction = builder.transaction;
    this.serverName = builder.serverName;
    this.release = builder.release;
    this.environment = builder.environment;

    Map<String, String> tagCopy = builder.tags == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    if (tagCopy.containsKey(null)) {
      throw new IllegalArgumentException("tags cannot contain null keys");
    }
    if (tagCopy.containsValue(null)) {
      throw new IllegalArgumentException("tags cannot contain null values");
    }
    this.tags = tagCopy;

    this.message = builder.message;
    this.exceptions = builder.exceptions == null ? List.of() : List.copyOf(builder.exceptions);
    this.breadcrumbs = builder.breadcrumbs == null ? List.of() : List.copyOf(builder.breadcrumbs);
    this.user = builder.user;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates an event at {@link Level#ERROR} carrying a raw message.
   *
   * @param message the message text
   * @return a new event
   */
  public static Event ofMessage(String message) {
    return builder().message(Message.raw(message)).build();
  }

  /**
   * Returns a builder pre-populated with every field of this event, including its id.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder()
        .eventId(eventId)
        .timestamp(timestamp)
        .level(level)
        .logger(logger)
        .transaction(transaction)
        .serverName(serverName)
        .release(release)
        .environment(environment)
        .tags(tags)
        .message(message)
        .exceptions(exceptions)
        .breadcrumbs(breadcrumbs)
        .user(user);
  }

  public EventId eventId() {
    return eventId;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public Level level() {
    return level;
  }

  public String logger() {
    return logger;
  }

  public String transaction() {
    return transaction;
  }

  public String serverName() {
    return serverName;
  }

  public String release() {
    return release;
  }

  public String environment() {
    return environment;
  }

  public Map<String, String> tags() {
    return tags;
  }

  public Message message() {
    return message;
  }

  /**
   * Returns the chained exceptions, oldest (root cause) first.
   *
   * @return the exception chain (never {@code null})
   */
  public List<ExceptionValue> exceptions() {
    return exceptions;
  }

  public List<Breadcrumb> breadcrumbs() {
    return breadcrumbs;
  }

  public User user() {
    return user;
  }

  @Override
  public String toString() {
    return "Event{eventId=" + eventId + ", level=" + level + ", logger=" + logger
        + ", message=" + message + ", exceptions=" + exceptions.size() + "}";
  }

  /** Builder for {@link Event}. */
  public static final class Builder {
    private EventId eventId;
    private Instant timestamp;
    private Level level;
    private String logger;
    private String transaction;
    private String serverName;
    private String release;
    private String environment;
    private Map<String, String> tags;
    private Message message;
    private List<ExceptionValue> exceptions;
    private List<Breadcrumb> breadcrumbs;
    private User user;

    private Builder() {}

    public Builder eventId(EventId eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    /**
     * Sets the severity. Defaults to {@link Level#ERROR}.
     *
     * @param level the severity
     * @return this builder
     */
    public Builder level(Level level) {
      this.level = level;
      return this;
    }

    public Builder logger(String logger) {
      this.logger = logger;
      return this;
    }

    public Builder transaction(String transaction) {
      this.transaction = transaction;
      return this;
    }

    public Builder serverName(String serverName) {
      this.serverName = serverName;
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

    public Builder tags(Map<String, String> tags) {
      this.tags = tags == null ? null : new LinkedHashMap<>(tags);
      return this;
    }

    public Builder tag(String key, String value) {
      if (this.tags == null) {
        this.tags = new LinkedHashMap<>();
      }
      this.tags.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder message(Message message) {
      this.message = message;
      return this;
    }

    public Builder exceptions(List<ExceptionValue> exceptions) {
      this.exceptions = exceptions;
      return this;
    }

    public Builder breadcrumbs(List<Breadcrumb> breadcrumbs) {
      this.breadcrumbs = breadcrumbs;
      return this;
    }

    public Builder user(User user) {
      this.user = user;
      return this;
    }

    /**
     * Builds the event.
     *
     * @return a new immutable event
     * @throws IllegalArgumentException if tags contain null keys or values
     */
    public Event build() {
      return new Event(this);
    }
  }
}
