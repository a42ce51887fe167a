/**
 * Event fan-out to subscribers.
 *
 * <p>{@link org.tanzu.pvemcp.event.Broadcaster} delivers
 * {@link org.tanzu.pvemcp.event.PveEvent}s in one global order, starting each subscription
 * with a {@link org.tanzu.pvemcp.event.StateSnapshot}.
 */
package org.tanzu.pvemcp.event;
