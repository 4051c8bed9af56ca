/**
 * Internal helpers: JSON codec, thread factory and host name lookup.
 */
package sentry.util;
