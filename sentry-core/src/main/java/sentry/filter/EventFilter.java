package sentry.filter;

import sentry.model.Event;
import sentry.spi.MetricsExporter;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether a captured event survives: probabilistic sampling first, then the optional
 * {@link BeforeSendHook}.
 *
 * <p>A sample rate of {@code 1.0} keeps every event, {@code 0.0} drops every event. Otherwise an
 * event is dropped when a uniform draw in [0, 1) exceeds the rate. Drops are not errors; they
 * are logged at {@link Level#FINE} and counted.
 *
 * <p>This class is thread-safe if the hook is.
 */
public final class EventFilter {
  private static final Logger logger = Logger.getLogger(EventFilter.class.getName());

  private final double sampleRate;
  private final BeforeSendHook beforeSend;
  private final DoubleSupplier random;
  private final MetricsExporter metrics;

  public EventFilter(double sampleRate, BeforeSendHook beforeSend) {
    this(sampleRate, beforeSend, () -> ThreadLocalRandom.current().nextDouble(), MetricsExporter.NOOP);
  }

  /**
   * @param sampleRate probability in [0.0, 1.0] that an event is kept
   * @param beforeSend optional veto/transform hook, may be {@code null}
   * @param random     source of uniform draws in [0, 1)
   * @param metrics    metrics sink
   * @throws IllegalArgumentException if {@code sampleRate} is outside [0.0, 1.0]
   */
  public EventFilter(double sampleRate, BeforeSendHook beforeSend, DoubleSupplier random,
      MetricsExporter metrics) {
    this.sampleRate = validateSampleRate(sampleRate);
    this.beforeSend = beforeSend;
    this.random = Objects.requireNonNull(random, "random");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  public static double validateSampleRate(double sampleRate) {
    if (!(sampleRate >= 0.0 && sampleRate <= 1.0)) {
      throw new IllegalArgumentException("sampleRate must be between 0.0 and 1.0, got: " + sampleRate);
    }
    return sampleRate;
  }

  public double sampleRate() {
    return sampleRate;
  }

  /**
   * Applies sampling and the hook.
   *
   * @param event the captured event
   * @return the event to send (possibly replaced by the hook), or {@code null} to drop it
   */
  public Event shouldSend(Event event) {
    Objects.requireNonNull(event, "event");
    if (!sampled()) {
      metrics.incrementSampledOut();
      logger.log(Level.FINE, "Event dropped by sampling: " + event.eventId());
      return null;
    }
    if (beforeSend == null) {
      return event;
    }
    Event result;
    try {
      result = beforeSend.beforeSend(event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "beforeSend hook failed, sending event unmodified: " + event.eventId(), e);
      return event;
    }
    if (result == null) {
      metrics.incrementVetoed();
      logger.log(Level.FINE, "Event dropped by beforeSend hook: " + event.eventId());
    }
    return result;
  }

  boolean sampled() {
    if (sampleRate >= 1.0) {
      return true;
    }
    if (sampleRate <= 0.0) {
      return false;
    }
    return random.getAsDouble() <= sampleRate;
  }
}
