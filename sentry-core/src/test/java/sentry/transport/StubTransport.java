package sentry.transport;

import sentry.model.EventId;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Scripted {@link Transport} for tests. Each send consumes the next scripted outcome, falling
 * back to a 200 response echoing a fixed event id.
 */
public final class StubTransport implements Transport {
  public static final EventId SERVER_ID = EventId.fromHex("fc6d8c0c43fc4630ad850ee518f1b9d0");

  public final List<TransportRequest> requests = new CopyOnWriteArrayList<>();
  private final Deque<Object> script = new ArrayDeque<>();
  private volatile Runnable onSend;
  private volatile CountDownLatch gate;
  private volatile CountDownLatch entered = new CountDownLatch(1);
  private volatile boolean closed;

  public static TransportResponse accepted(EventId id) {
    return TransportResponse.of(200, "{\"id\":\"" + id.toHex() + "\"}");
  }

  public synchronized StubTransport respond(TransportResponse response) {
    script.addLast(response);
    return this;
  }

  public synchronized StubTransport fail(IOException failure) {
    script.addLast(failure);
    return this;
  }

  /** Runs {@code action} inside the next sends, before the outcome is produced. */
  public StubTransport onSend(Runnable action) {
    this.onSend = action;
    return this;
  }

  /** Makes every send wait until {@code gate} opens. */
  public StubTransport blockOn(CountDownLatch gate) {
    this.gate = gate;
    return this;
  }

  public boolean awaitFirstSend(long timeoutMs) throws InterruptedException {
    return entered.await(timeoutMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public TransportResponse send(TransportRequest request) throws IOException {
    requests.add(request);
    entered.countDown();
    Runnable action = onSend;
    if (action != null) {
      action.run();
    }
    CountDownLatch g = gate;
    if (g != null) {
      try {
        if (!g.await(10, TimeUnit.SECONDS)) {
          throw new IOException("stub gate never opened");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted", e);
      }
    }
    Object outcome;
    synchronized (this) {
      outcome = script.pollFirst();
    }
    if (outcome instanceof IOException failure) {
      throw failure;
    }
    if (outcome instanceof TransportResponse response) {
      return response;
    }
    return accepted(SERVER_ID);
  }

  public TransportRequest lastRequest() {
    return requests.get(requests.size() - 1);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
  }
}
