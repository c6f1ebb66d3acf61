/**
 * Thread-bound JDBC transactions: {@link io.eventsource.jdbc.tx.JdbcTransactionManager}
 * opens them, {@link io.eventsource.jdbc.tx.ThreadLocalTxContext} exposes the connection
 * to stores, {@link io.eventsource.jdbc.tx.JdbcUnitOfWork} adapts them to the projection
 * engine.
 */
package io.eventsource.jdbc.tx;
