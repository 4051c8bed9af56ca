/**
 * Spring Boot auto-configuration for the event client.
 *
 * <p>Set {@code sentry.dsn} to get a {@link sentry.Sentry} bean, a JUL handler on the root
 * logger and, with Micrometer present, delivery metrics. See
 * {@link sentry.spring.boot.SentryProperties} for the remaining keys.
 */
package sentry.spring.boot;
