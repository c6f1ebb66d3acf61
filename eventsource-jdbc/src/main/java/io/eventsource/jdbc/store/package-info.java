/**
 * JDBC event store implementations, one per database dialect.
 *
 * <p>{@link io.eventsource.jdbc.store.JdbcEventStores} discovers them through
 * {@link java.util.ServiceLoader} and picks one from the JDBC URL.
 *
 * @see io.eventsource.jdbc.store.AbstractJdbcEventStore
 */
package io.eventsource.jdbc.store;
