/**
 * Spring Boot auto-configuration for the event store, projections and campaign module.
 *
 * <p>Configure with {@code eventsource.*} properties; see
 * {@link io.eventsource.spring.boot.EventSourcingProperties}.
 */
package io.eventsource.spring.boot;
