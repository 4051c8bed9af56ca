package sentry.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sentry.Sentry;
import sentry.SentryOptions;
import sentry.envelope.Attachment;
import sentry.envelope.EnvelopeCodec;
import sentry.envelope.EnvelopeItem;
import sentry.model.Event;
import sentry.model.Message;
import sentry.transport.StubTransport;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentryHandlerTest {

  private final StubTransport transport = new StubTransport();
  private final List<Event> seen = new CopyOnWriteArrayList<>();
  private Sentry client;
  private SentryHandler handler;

  @BeforeEach
  void setUp() {
    client = Sentry.builder()
        .options(SentryOptions.builder().dsn("https://key@ingest.example.com/42").serverName(null).build())
        .transport(transport)
        .scheduleFlush(false)
        .beforeSend(event -> {
          seen.add(event);
          return event;
        })
        .build();
    handler = new SentryHandler(client);
  }

  @AfterEach
  void tearDown() {
    handler.close();
    client.close();
  }

  // ── Level mapping ───────────────────────────────────────────────

  @Test
  void julLevelsMapOntoEventSeverities() {
    assertEquals(sentry.model.Level.FATAL, SentryHandler.mapLevel(Level.parse("1100")));
    assertEquals(sentry.model.Level.ERROR, SentryHandler.mapLevel(Level.SEVERE));
    assertEquals(sentry.model.Level.WARNING, SentryHandler.mapLevel(Level.WARNING));
    assertEquals(sentry.model.Level.INFO, SentryHandler.mapLevel(Level.INFO));
    assertEquals(sentry.model.Level.INFO, SentryHandler.mapLevel(Level.CONFIG));
    assertEquals(sentry.model.Level.DEBUG, SentryHandler.mapLevel(Level.FINE));
    assertEquals(sentry.model.Level.DEBUG, SentryHandler.mapLevel(Level.FINEST));
  }

  // ── Publishing ──────────────────────────────────────────────────

  @Test
  void warningRecordBecomesMessageEvent() {
    LogRecord record = record(Level.WARNING, "payment {0} retried");
    record.setParameters(new Object[] {"p-17"});

    handler.publish(record);

    assertEquals(1, seen.size());
    Event event = seen.get(0);
    assertEquals(Message.raw("payment p-17 retried"), event.message());
    assertEquals(sentry.model.Level.WARNING, event.level());
    assertEquals("app.payments", event.logger());
    assertEquals(record.getInstant(), event.timestamp());
  }

  @Test
  void recordsBelowHandlerLevelAreIgnored() {
    handler.publish(record(Level.INFO, "routine"));

    assertTrue(seen.isEmpty());
    assertEquals(0, client.pendingEvents());
  }

  @Test
  void ownDiagnosticsAreIgnored() {
    LogRecord record = new LogRecord(Level.SEVERE, "Envelope delivery failed");
    record.setLoggerName("sentry.dispatch.EventDispatcher");

    handler.publish(record);

    assertTrue(seen.isEmpty());
  }

  @Test
  void mapParameterAddsTagsAndTransaction() {
    handler.setTag("service", "shop");
    LogRecord record = record(Level.SEVERE, "checkout failed");
    record.setParameters(new Object[] {Map.of(SentryHandler.TRANSACTION_TAG, "POST /checkout", "service", "billing")});

    handler.publish(record);

    Event event = seen.get(0);
    assertEquals("POST /checkout", event.transaction());
    assertEquals("billing", event.tags().get("service"));
  }

  @Test
  void sourceLocationBecomesSingleFrame() {
    LogRecord record = record(Level.WARNING, "slow query");
    record.setSourceClassName("com.shop.OrderRepository");
    record.setSourceMethodName("findAll");

    handler.publish(record);

    Event event = seen.get(0);
    assertEquals("slow query", event.exceptions().get(0).type());
    assertEquals("com.shop.OrderRepository.findAll",
        event.exceptions().get(0).stacktrace().frames().get(0).function());
  }

  @Test
  void thrownExceptionBecomesExceptionChain() {
    LogRecord record = record(Level.SEVERE, "request failed");
    record.setThrown(new IllegalStateException("pool exhausted", new IOException("socket closed")));

    handler.publish(record);

    Event event = seen.get(0);
    assertEquals(Message.raw("request failed"), event.message());
    assertEquals(sentry.model.Level.ERROR, event.level());
    assertEquals(2, event.exceptions().size());
    assertEquals("java.io.IOException", event.exceptions().get(0).type());
    assertEquals(IllegalStateException.class.getName(), event.exceptions().get(1).type());
  }

  @Test
  void attachmentParameterTravelsWithEvent() {
    LogRecord record = record(Level.SEVERE, "report attached");
    record.setParameters(new Object[] {new Attachment("state.json", "application/json", new byte[] {'{', '}'})});

    handler.publish(record);
    client.flush();

    List<EnvelopeItem> items = new EnvelopeCodec().decode(transport.lastRequest().body()).items();
    assertEquals(2, items.size());
    assertEquals("state.json", items.get(1).header().filename());
  }

  @Test
  void closedHandlerPublishesNothing() {
    handler.close();

    handler.publish(record(Level.SEVERE, "too late"));

    assertTrue(seen.isEmpty());
  }

  @Test
  void installedOnLoggerCapturesSevereRecords() {
    Logger logger = Logger.getLogger("app.handler.test");
    logger.setUseParentHandlers(false);
    logger.addHandler(handler);
    try {
      logger.severe("disk almost full");
      logger.info("not captured");
    } finally {
      logger.removeHandler(handler);
    }

    assertEquals(1, seen.size());
    assertEquals("app.handler.test", seen.get(0).logger());
    assertNull(seen.get(0).serverName());
  }

  private static LogRecord record(Level level, String message) {
    LogRecord record = new LogRecord(level, message);
    record.setLoggerName("app.payments");
    return record;
  }
}
