package sentry;

import org.junit.jupiter.api.Test;
import sentry.model.Event;
import sentry.model.ExceptionValue;
import sentry.model.Frame;
import sentry.model.Level;
import sentry.model.Message;
import sentry.model.SourceLocation;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventFactoryTest {

  @Test
  void plainMessageHasNoException() {
    Event event = EventFactory.message("cache warmed", Level.INFO, "app.cache", "warmup", Map.of("region", "eu"), null)
        .build();

    assertEquals(Message.raw("cache warmed"), event.message());
    assertEquals(Level.INFO, event.level());
    assertEquals("app.cache", event.logger());
    assertEquals("warmup", event.transaction());
    assertEquals(Map.of("region", "eu"), event.tags());
    assertTrue(event.exceptions().isEmpty());
  }

  @Test
  void messageWithLocationBecomesSingleFrameException() {
    SourceLocation location = SourceLocation.of("Checkout.java", "Checkout.pay", 42);

    Event event = EventFactory.message("card declined", Level.WARNING, null, null, null, location).build();

    assertEquals(1, event.exceptions().size());
    ExceptionValue exception = event.exceptions().get(0);
    assertEquals("card declined", exception.type());
    assertEquals(List.of(location.toFrame()), exception.stacktrace().frames());
    assertEquals("Checkout.pay", exception.stacktrace().frames().get(0).function());
  }

  @Test
  void exceptionChainListsRootCauseFirst() {
    IllegalStateException root = new IllegalStateException("disk full");
    RuntimeException wrapper = new RuntimeException("write failed", root);

    Event event = EventFactory.exception(wrapper).build();

    assertEquals(Level.ERROR, event.level());
    assertEquals(Message.raw("write failed"), event.message());
    List<ExceptionValue> chain = event.exceptions();
    assertEquals(2, chain.size());
    assertEquals(IllegalStateException.class.getName(), chain.get(0).type());
    assertEquals("disk full", chain.get(0).value());
    assertEquals(RuntimeException.class.getName(), chain.get(1).type());
  }

  @Test
  void messagelessThrowableUsesClassName() {
    Event event = EventFactory.exception(new NullPointerException()).build();

    assertEquals(Message.raw(NullPointerException.class.getName()), event.message());
    assertNull(event.exceptions().get(0).value());
  }

  @Test
  void cyclicCausesTerminate() {
    Exception a = new Exception("a");
    Exception b = new Exception("b", a);
    a.initCause(b);

    assertEquals(2, EventFactory.exceptionChain(b).size());
  }

  @Test
  void stacktraceEndsAtThrowingMethod() {
    Exception e = new Exception("here");

    List<Frame> frames = EventFactory.stacktrace(e).frames();

    Frame last = frames.get(frames.size() - 1);
    assertEquals(EventFactoryTest.class.getName() + ".stacktraceEndsAtThrowingMethod", last.function());
    assertEquals("EventFactoryTest.java", last.filename());
    assertTrue(last.lineno() > 0);
  }
}
