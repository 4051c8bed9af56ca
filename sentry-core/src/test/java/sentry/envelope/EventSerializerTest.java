package sentry.envelope;

import org.junit.jupiter.api.Test;
import sentry.model.Breadcrumb;
import sentry.model.Event;
import sentry.model.EventId;
import sentry.model.ExceptionValue;
import sentry.model.Frame;
import sentry.model.Level;
import sentry.model.Message;
import sentry.model.Stacktrace;
import sentry.model.User;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventSerializerTest {

  private static final EventId ID = EventId.fromHex("00000000000000000000000000000001");

  private final EventSerializer serializer = new EventSerializer();

  @Test
  void minimalEventUsesProtocolKeysAndOmitsAbsentFields() {
    Event event = Event.builder()
        .eventId(ID)
        .timestamp(Instant.ofEpochSecond(1_700_000_000L, 500_000_000))
        .level(Level.WARNING)
        .logger("checkout")
        .tag("a", "b")
        .message(Message.raw("boom"))
        .build();

    assertEquals("{\"event_id\":\"00000000000000000000000000000001\",\"timestamp\":1700000000.5,"
        + "\"platform\":\"java\",\"level\":\"warning\",\"logger\":\"checkout\",\"tags\":{\"a\":\"b\"},"
        + "\"message\":\"boom\"}", json(event));
  }

  @Test
  void formattedMessageIsAnObject() {
    Event event = Event.builder().message(Message.formatted("user %s", List.of("42"))).build();

    assertTrue(json(event).contains("\"message\":{\"message\":\"user %s\",\"params\":[\"42\"]}"));
  }

  @Test
  void exceptionsAreWrappedInValues() {
    Frame frame = new Frame(null, "a.B.c", null, 3, null, null, "0x1");
    Event event = Event.builder()
        .exceptions(List.of(new ExceptionValue("java.io.IOException", "down", new Stacktrace(List.of(frame)))))
        .build();

    assertTrue(json(event).contains("\"exception\":{\"values\":[{\"type\":\"java.io.IOException\",\"value\":\"down\","
        + "\"stacktrace\":{\"frames\":[{\"function\":\"a.B.c\",\"lineno\":3,\"instruction_addr\":\"0x1\"}]}}]}"));
  }

  @Test
  void breadcrumbsAndUserUseSnakeCase() {
    Event event = Event.builder()
        .breadcrumbs(List.of(new Breadcrumb("step", Level.INFO, Instant.ofEpochSecond(5))))
        .user(new User("u1", "10.0.0.1"))
        .build();

    String json = json(event);

    assertTrue(json.contains("\"breadcrumbs\":{\"values\":[{\"message\":\"step\",\"level\":\"info\",\"timestamp\":5}]}"));
    assertTrue(json.contains("\"user\":{\"id\":\"u1\",\"ip_address\":\"10.0.0.1\"}"));
  }

  @Test
  void wholeSecondTimestampsHaveNoExponent() {
    assertEquals("1700000000", EventSerializer.epochSeconds(Instant.ofEpochSecond(1_700_000_000L)).toPlainString());
  }

  @Test
  void envelopeItemIsJsonEvent() {
    EnvelopeItem item = serializer.toEnvelopeItem(Event.ofMessage("x"));

    assertEquals(EnvelopeItemHeader.TYPE_EVENT, item.header().type());
    assertEquals("application/json", item.header().contentType());
  }

  private String json(Event event) {
    return new String(serializer.serialize(event), StandardCharsets.UTF_8);
  }
}
