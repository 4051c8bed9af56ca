/**
 * Recovery of crash reports from a plain-text crash log.
 *
 * @see sentry.crash.StacktraceParser
 */
package sentry.crash;
