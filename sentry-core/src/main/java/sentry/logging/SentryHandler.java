package sentry.logging;

import sentry.EventFactory;
import sentry.Sentry;
import sentry.envelope.Attachment;
import sentry.model.Event;
import sentry.model.Message;
import sentry.model.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.ErrorManager;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * {@link java.util.logging.Handler} that queues log records as events.
 *
 * <p>Record parameters carry structured data: a {@link Map} parameter is merged into the
 * event's tags (overriding the handler's static tags) and an {@link Attachment} parameter is
 * sent alongside the event. The {@value #TRANSACTION_TAG} tag also becomes the event's
 * transaction. A thrown exception becomes the event's exception chain.
 *
 * <p>Records from {@code sentry.*} loggers are ignored, so the pipeline never reports its own
 * diagnostics. The handler does not own the client; {@link #close()} leaves it running.
 */
public class SentryHandler extends Handler {
  public static final String TRANSACTION_TAG = "transaction";

  private static final String OWN_LOGGER_PREFIX = "sentry.";

  private final Sentry client;
  private final Map<String, String> tags = Collections.synchronizedMap(new LinkedHashMap<>());
  private volatile boolean closed;

  /**
   * Creates a handler publishing {@link Level#WARNING} and above.
   *
   * @param client the client events are queued on
   */
  public SentryHandler(Sentry client) {
    this(client, Level.WARNING);
  }

  public SentryHandler(Sentry client, Level level) {
    this.client = Objects.requireNonNull(client, "client");
    setLevel(Objects.requireNonNull(level, "level"));
    setFormatter(new SimpleFormatter());
  }

  /**
   * Adds a tag to every event this handler produces.
   *
   * @param key   tag name
   * @param value tag value
   */
  public void setTag(String key, String value) {
    tags.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  @Override
  public void publish(LogRecord record) {
    if (closed || record == null || !isLoggable(record) || isOwnRecord(record)) {
      return;
    }
    try {
      Map<String, String> eventTags;
      synchronized (tags) {
        eventTags = new LinkedHashMap<>(tags);
      }
      List<Attachment> attachments = new ArrayList<>();
      Object[] params = record.getParameters();
      if (params != null) {
        for (Object param : params) {
          if (param instanceof Attachment attachment) {
            attachments.add(attachment);
          } else if (param instanceof Map<?, ?> metadata) {
            metadata.forEach((k, v) -> {
              if (k != null && v != null) {
                eventTags.put(k.toString(), v.toString());
              }
            });
          }
        }
      }
      client.capture(toEvent(record, eventTags), attachments);
    } catch (RuntimeException e) {
      reportError("Failed to capture log record", e, ErrorManager.WRITE_FAILURE);
    }
  }

  Event toEvent(LogRecord record, Map<String, String> eventTags) {
    String message = getFormatter().formatMessage(record);
    sentry.model.Level level = mapLevel(record.getLevel());
    String transaction = eventTags.get(TRANSACTION_TAG);
    if (record.getThrown() != null) {
      return EventFactory.exception(record.getThrown())
          .level(level)
          .message(Message.raw(message))
          .logger(record.getLoggerName())
          .transaction(transaction)
          .tags(eventTags.isEmpty() ? null : eventTags)
          .timestamp(record.getInstant())
          .build();
    }
    SourceLocation location = null;
    if (record.getSourceClassName() != null) {
      String function = record.getSourceMethodName() == null
          ? record.getSourceClassName()
          : record.getSourceClassName() + "." + record.getSourceMethodName();
      location = new SourceLocation(null, function, null, null, null);
    }
    return EventFactory.message(message, level, record.getLoggerName(), transaction, eventTags, location)
        .timestamp(record.getInstant())
        .build();
  }

  /**
   * Maps JUL levels onto the five event severities: above SEVERE is fatal, SEVERE is error,
   * WARNING is warning, INFO and CONFIG are info, everything finer is debug.
   */
  static sentry.model.Level mapLevel(Level level) {
    int value = level.intValue();
    if (value > Level.SEVERE.intValue()) {
      return sentry.model.Level.FATAL;
    }
    if (value >= Level.SEVERE.intValue()) {
      return sentry.model.Level.ERROR;
    }
    if (value >= Level.WARNING.intValue()) {
      return sentry.model.Level.WARNING;
    }
    if (value >= Level.CONFIG.intValue()) {
      return sentry.model.Level.INFO;
    }
    return sentry.model.Level.DEBUG;
  }

  private static boolean isOwnRecord(LogRecord record) {
    String name = record.getLoggerName();
    return name != null && (name.equals("sentry") || name.startsWith(OWN_LOGGER_PREFIX));
  }

  /**
   * Starts an asynchronous flush of the client's queue.
   */
  @Override
  public void flush() {
    if (!closed) {
      client.flushAsync();
    }
  }

  @Override
  public void close() {
    closed = true;
  }
}
