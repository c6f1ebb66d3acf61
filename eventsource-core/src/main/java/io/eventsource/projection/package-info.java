/**
 * Projection engine: one polling runner per {@link io.eventsource.projection.Projection},
 * each with its own checkpoint.
 *
 * <h2>Delivery</h2>
 * <p>Events are delivered in global-sequence order, at least once. Apply and checkpoint
 * commit together in one {@link io.eventsource.spi.UnitOfWork}; a crash between them
 * replays the event, so projections must be idempotent.
 *
 * <h2>Failures</h2>
 * <p>An apply failure is retried on later polls with {@link io.eventsource.projection.RetryPolicy}
 * backoff. When the attempt budget runs out the event is poison: the runner stalls at it,
 * the stall is persisted and reported, and nothing after it is applied until
 * {@link io.eventsource.projection.PoisonEventManager} releases or skips it.
 */
package io.eventsource.projection;
