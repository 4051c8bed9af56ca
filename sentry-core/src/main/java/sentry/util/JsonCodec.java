package sentry.util;

import java.util.Map;

/**
 * JSON codec used for event payloads, envelope headers and ingestion responses.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is dependency-free. It writes nested
 * maps, lists and scalars, and reads the top-level members of the objects returned by the
 * ingestion service.
 * Applications that already ship Jackson or Gson can implement this interface to delegate to
 * their preferred library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes an object tree as compact JSON. Map entries with a {@code null} value are omitted.
   *
   * <p>Supported values: {@link Map} (string keys), {@link Iterable}, {@link CharSequence},
   * {@link Number}, {@link Boolean} and {@code null}.
   *
   * @param object the object to encode
   * @return JSON text (never {@code null})
   * @throws IllegalArgumentException if the tree contains an unsupported value or a null key
   */
  String toJson(Map<String, ?> object);

  /**
   * Parses the top level of a JSON object into a string map. String values are kept verbatim,
   * numbers and booleans keep their literal text, {@code null} and nested object/array members
   * are skipped. Returns an empty map
   * for {@code null}, empty or {@code "null"} input.
   *
   * @param json the JSON text
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, String> parseObject(String json);
}
