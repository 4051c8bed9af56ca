package sentry.model;

/**
 * One exception in a chain. At least one of {@code type} or {@code value} should be set,
 * otherwise the ingestion service discards it.
 *
 * @param type       exception type, e.g. {@code java.io.IOException}
 * @param value      human readable value
 * @param stacktrace frames of this exception, or {@code null}
 */
public record ExceptionValue(String type, String value, Stacktrace stacktrace) {
}
