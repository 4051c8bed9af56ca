/**
 * Event model: the event itself and the identifiers, messages, exceptions, frames,
 * breadcrumbs and user context it carries.
 *
 * @see sentry.model.Event
 */
package sentry.model;
