package sentry.dispatch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * FIFO queue of events awaiting delivery.
 *
 * <p>Entries are appended at the tail. The only reordering is {@link #requeueFront}, which puts
 * a failed batch back ahead of everything captured while it was in flight, keeping its
 * original relative order.
 *
 * <p>All methods are synchronized on the buffer.
 */
public final class EventBuffer {
  private final Deque<QueuedEvent> queue = new ArrayDeque<>();
  private final int maxSize;

  /**
   * Creates an unbounded buffer.
   */
  public EventBuffer() {
    this(0);
  }

  /**
   * @param maxSize maximum number of entries accepted by {@link #offer}, or {@code 0} for no limit
   */
  public EventBuffer(int maxSize) {
    if (maxSize < 0) {
      throw new IllegalArgumentException("maxSize must be >= 0");
    }
    this.maxSize = maxSize;
  }

  /**
   * Appends an entry at the tail.
   *
   * @param event the entry
   * @return {@code false} if the buffer is bounded and full
   */
  public synchronized boolean offer(QueuedEvent event) {
    Objects.requireNonNull(event, "event");
    if (maxSize > 0 && queue.size() >= maxSize) {
      return false;
    }
    queue.addLast(event);
    return true;
  }

  /**
   * Removes and returns every entry, oldest first, leaving the buffer empty.
   *
   * @return the drained batch (never {@code null})
   */
  public synchronized List<QueuedEvent> drainAll() {
    List<QueuedEvent> batch = new ArrayList<>(queue);
    queue.clear();
    return batch;
  }

  /**
   * Puts a batch back at the head of the queue in its original order. The size bound does not
   * apply, so a requeue never loses events.
   *
   * @param batch entries previously returned by {@link #drainAll()}
   */
  public synchronized void requeueFront(List<QueuedEvent> batch) {
    ListIterator<QueuedEvent> it = batch.listIterator(batch.size());
    while (it.hasPrevious()) {
      queue.addFirst(it.previous());
    }
  }

  public synchronized int size() {
    return queue.size();
  }

  public synchronized boolean isEmpty() {
    return queue.isEmpty();
  }

  /**
   * Returns a copy of the current entries, oldest first.
   */
  public synchronized List<QueuedEvent> snapshot() {
    return List.copyOf(queue);
  }

  public int maxSize() {
    return maxSize;
  }
}
