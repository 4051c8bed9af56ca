/**
 * Pending queue and batch delivery.
 *
 * <p>{@link sentry.dispatch.EventDispatcher} filters on capture, drains the whole
 * {@link sentry.dispatch.EventBuffer} per flush, requeues at the front on transport failure,
 * and counts in-flight sends so shutdown can wait for them.
 *
 * @see sentry.dispatch.EventDispatcher
 * @see sentry.dispatch.FlushScheduler
 * @see sentry.dispatch.FlushResult
 */
package sentry.dispatch;
