/**
 * Client-side suppression window driven by 429 responses.
 */
package sentry.ratelimit;
