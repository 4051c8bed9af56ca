package sentry.envelope;

import sentry.model.Breadcrumb;
import sentry.model.Event;
import sentry.model.ExceptionValue;
import sentry.model.Frame;
import sentry.model.Stacktrace;
import sentry.model.User;
import sentry.util.JsonCodec;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps {@link Event} instances onto the JSON document accepted by the ingestion service.
 *
 * <p>Keys use the protocol's snake_case names; absent fields are omitted. Timestamps are
 * fractional seconds since the Unix epoch.
 */
public final class EventSerializer {
  private final JsonCodec jsonCodec;

  public EventSerializer() {
    this(JsonCodec.getDefault());
  }

  public EventSerializer(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  public byte[] serialize(Event event) {
    return jsonCodec.toJson(toMap(event)).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Wraps a serialized event into an {@code event} envelope item.
   *
   * @param event the event
   * @return a new envelope item
   */
  public EnvelopeItem toEnvelopeItem(Event event) {
    return new EnvelopeItem(EnvelopeItemHeader.event(), serialize(event));
  }

  Map<String, Object> toMap(Event event) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("event_id", event.eventId().toHex());
    map.put("timestamp", epochSeconds(event.timestamp()));
    map.put("platform", Event.PLATFORM);
    map.put("level", event.level().wireName());
    map.put("logger", event.logger());
    map.put("transaction", event.transaction());
    map.put("server_name", event.serverName());
    map.put("release", event.release());
    map.put("tags", event.tags().isEmpty() ? null : event.tags());
    map.put("environment", event.environment());
    map.put("message", event.message() == null ? null : event.message().toWireValue());
    if (!event.exceptions().isEmpty()) {
      List<Object> values = new ArrayList<>();
      for (ExceptionValue exception : event.exceptions()) {
        values.add(exceptionMap(exception));
      }
      map.put("exception", Map.of("values", values));
    }
    if (!event.breadcrumbs().isEmpty()) {
      List<Object> values = new ArrayList<>();
      for (Breadcrumb breadcrumb : event.breadcrumbs()) {
        values.add(breadcrumbMap(breadcrumb));
      }
      map.put("breadcrumbs", Map.of("values", values));
    }
    if (event.user() != null) {
      map.put("user", userMap(event.user()));
    }
    return map;
  }

  private static Map<String, Object> exceptionMap(ExceptionValue exception) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", exception.type());
    map.put("value", exception.value());
    if (exception.stacktrace() != null) {
      map.put("stacktrace", stacktraceMap(exception.stacktrace()));
    }
    return map;
  }

  private static Map<String, Object> stacktraceMap(Stacktrace stacktrace) {
    List<Object> frames = new ArrayList<>();
    for (Frame frame : stacktrace.frames()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("filename", frame.filename());
      map.put("function", frame.function());
      map.put("raw_function", frame.rawFunction());
      map.put("lineno", frame.lineno());
      map.put("colno", frame.colno());
      map.put("abs_path", frame.absPath());
      map.put("instruction_addr", frame.instructionAddr());
      frames.add(map);
    }
    return Map.of("frames", frames);
  }

  private static Map<String, Object> breadcrumbMap(Breadcrumb breadcrumb) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("message", breadcrumb.message());
    map.put("level", breadcrumb.level() == null ? null : breadcrumb.level().wireName());
    map.put("timestamp", breadcrumb.timestamp() == null ? null : epochSeconds(breadcrumb.timestamp()));
    return map;
  }

  private static Map<String, Object> userMap(User user) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("id", user.id());
    map.put("ip_address", user.ipAddress());
    return map;
  }

  static BigDecimal epochSeconds(Instant instant) {
    return BigDecimal.valueOf(instant.getEpochSecond())
        .add(BigDecimal.valueOf(instant.getNano(), 9))
        .stripTrailingZeros();
  }
}
