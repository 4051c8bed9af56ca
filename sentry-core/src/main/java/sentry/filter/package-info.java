/**
 * Sampling and the {@code beforeSend} hook, applied to every captured event.
 */
package sentry.filter;
