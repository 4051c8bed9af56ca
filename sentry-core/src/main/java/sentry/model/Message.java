package sentry.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Log message carried by an event.
 *
 * <ul>
 *   <li>{@link Raw}: a plain string, encoded as a bare JSON string.</li>
 *   <li>{@link Formatted}: a template plus its parameters, encoded as
 *       {@code {"message": ..., "params": [...]}}.</li>
 * </ul>
 */
public sealed interface Message permits Message.Raw, Message.Formatted {

  static Raw raw(String message) {
    return new Raw(message);
  }

  static Formatted formatted(String message, List<String> params) {
    return new Formatted(message, params);
  }

  /**
   * Returns the value written under the event's {@code message} key.
   *
   * @return a {@link String} or a map with {@code message} and {@code params}
   */
  Object toWireValue();

  record Raw(String message) implements Message {
    public Raw {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public Object toWireValue() {
      return message;
    }
  }

  record Formatted(String message, List<String> params) implements Message {
    public Formatted {
      Objects.requireNonNull(message, "message");
      params = params == null ? List.of() : List.copyOf(params);
    }

    @Override
    public Object toWireValue() {
      Map<String, Object> value = new LinkedHashMap<>();
      value.put("message", message);
      value.put("params", params);
      return value;
    }
  }
}
