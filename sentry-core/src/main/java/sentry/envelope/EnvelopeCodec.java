package sentry.envelope;

import sentry.model.EventId;
import sentry.util.JsonCodec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Newline-delimited envelope wire format.
 *
 * <pre>
 * {"event_id":"...","sdk":{...}}\n
 * {"type":"event","length":123,"content_type":"application/json"}\n
 * &lt;123 payload bytes&gt;\n
 * {"type":"attachment","length":4,"filename":"a.bin","content_type":"application/octet-stream"}\n
 * &lt;4 payload bytes&gt;\n
 * </pre>
 *
 * <p>Every item header carries the payload {@code length}, so payloads may contain newlines
 * or arbitrary binary data.
 */
public final class EnvelopeCodec {
  public static final String CONTENT_TYPE = "application/x-sentry-envelope";

  private static final byte NEWLINE = '\n';

  private final JsonCodec jsonCodec;

  public EnvelopeCodec() {
    this(JsonCodec.getDefault());
  }

  public EnvelopeCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  public byte[] encode(Envelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeLine(out, jsonCodec.toJson(headerMap(envelope.header())).getBytes(StandardCharsets.UTF_8));
    for (EnvelopeItem item : envelope.items()) {
      writeLine(out, jsonCodec.toJson(itemHeaderMap(item)).getBytes(StandardCharsets.UTF_8));
      writeLine(out, item.payload());
    }
    return out.toByteArray();
  }

  /**
   * Parses an encoded envelope. Items without a {@code length} member are read up to the
   * next newline. The header's {@code sdk} member is not restored.
   *
   * @param data the encoded envelope
   * @return the decoded envelope
   * @throws IllegalArgumentException if the data is not a well-formed envelope
   */
  public Envelope decode(byte[] data) {
    Objects.requireNonNull(data, "data");
    int[] cursor = {0};
    String headerLine = readLine(data, cursor);
    if (headerLine == null) {
      throw new IllegalArgumentException("Envelope is missing its header line");
    }
    Map<String, String> header = jsonCodec.parseObject(headerLine);
    String eventId = header.get("event_id");
    EnvelopeHeader envelopeHeader = new EnvelopeHeader(
        eventId == null ? null : EventId.fromHex(eventId), header.get("dsn"), null);

    List<EnvelopeItem> items = new ArrayList<>();
    String line;
    while ((line = readLine(data, cursor)) != null) {
      if (line.isEmpty()) {
        continue;
      }
      Map<String, String> itemHeader = jsonCodec.parseObject(line);
      String type = itemHeader.get("type");
      if (type == null) {
        throw new IllegalArgumentException("Item header is missing its type: " + line);
      }
      byte[] payload;
      String length = itemHeader.get("length");
      if (length != null) {
        int size = parseLength(length);
        if (cursor[0] + size > data.length) {
          throw new IllegalArgumentException("Item payload truncated: expected " + size + " bytes");
        }
        payload = Arrays.copyOfRange(data, cursor[0], cursor[0] + size);
        cursor[0] += size;
        if (cursor[0] < data.length && data[cursor[0]] == NEWLINE) {
          cursor[0]++;
        }
      } else {
        String raw = readLine(data, cursor);
        payload = raw == null ? new byte[0] : raw.getBytes(StandardCharsets.UTF_8);
      }
      items.add(new EnvelopeItem(
          new EnvelopeItemHeader(type, itemHeader.get("filename"), itemHeader.get("content_type")),
          payload));
    }
    return new Envelope(envelopeHeader, items);
  }

  private static int parseLength(String length) {
    try {
      int size = Integer.parseInt(length);
      if (size < 0) {
        throw new IllegalArgumentException("Negative item length: " + length);
      }
      return size;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid item length: " + length, e);
    }
  }

  private static String readLine(byte[] data, int[] cursor) {
    int start = cursor[0];
    if (start >= data.length) {
      return null;
    }
    int end = start;
    while (end < data.length && data[end] != NEWLINE) {
      end++;
    }
    cursor[0] = end < data.length ? end + 1 : end;
    return new String(data, start, end - start, StandardCharsets.UTF_8);
  }

  private static void writeLine(ByteArrayOutputStream out, byte[] bytes) {
    out.write(bytes, 0, bytes.length);
    out.write(NEWLINE);
  }

  private static Map<String, Object> headerMap(EnvelopeHeader header) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("event_id", header.eventId() == null ? null : header.eventId().toHex());
    map.put("dsn", header.dsn());
    if (header.sdk() != null) {
      Map<String, Object> sdk = new LinkedHashMap<>();
      sdk.put("name", header.sdk().name());
      sdk.put("version", header.sdk().version());
      map.put("sdk", sdk);
    }
    return map;
  }

  private static Map<String, Object> itemHeaderMap(EnvelopeItem item) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", item.header().type());
    map.put("length", item.length());
    map.put("filename", item.header().filename());
    map.put("content_type", item.header().contentType());
    return map;
  }
}
