/**
 * JDBC support shared by the stores: connection provider, statement helper and table
 * name validation.
 *
 * <h2>Tables</h2>
 * <ul>
 *   <li>{@code es_event} - one row per committed event, keyed by global sequence and
 *       unique on {@code (stream_id, version)}</li>
 *   <li>{@code es_sequence} - single-row counter handing out global sequences; its row
 *       lock orders concurrent appends</li>
 *   <li>{@code es_projection_checkpoint} - one row per projection</li>
 * </ul>
 *
 * @see io.eventsource.jdbc.store.JdbcEventStores
 * @see io.eventsource.jdbc.checkpoint.JdbcCheckpointStore
 */
package io.eventsource.jdbc;
