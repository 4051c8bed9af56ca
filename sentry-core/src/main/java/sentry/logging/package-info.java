/**
 * {@code java.util.logging} integration.
 */
package sentry.logging;
