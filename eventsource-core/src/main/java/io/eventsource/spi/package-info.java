/**
 * Service provider interfaces: the event store, checkpoint store, unit of work,
 * connection and transaction access, and metrics export.
 *
 * <p>Implementations for JDBC live in {@code eventsource-jdbc}; Micrometer export in
 * {@code eventsource-micrometer}.
 */
package io.eventsource.spi;
