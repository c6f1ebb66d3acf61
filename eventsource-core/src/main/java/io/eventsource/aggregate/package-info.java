/**
 * Aggregates and their repository.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link io.eventsource.aggregate.AggregateRepository#load load} replays the
 *       aggregate's stream into a fresh instance; {@code version} ends at the last
 *       replayed event.</li>
 *   <li>Command methods validate and call {@code emit}, which folds the event and buffers
 *       it. The version does not move.</li>
 *   <li>{@link io.eventsource.aggregate.AggregateRepository#save save} appends the buffer
 *       with {@code expectedVersion = version}; on success the version advances by the
 *       number of events and the buffer is cleared.</li>
 * </ol>
 *
 * <p>Aggregates are data: business rules live in their command methods, persistence in
 * the repository, and the mapping to stored payloads in an
 * {@link io.eventsource.aggregate.EventCodec}.
 */
package io.eventsource.aggregate;
