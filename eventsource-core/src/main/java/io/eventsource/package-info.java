/**
 * Root API of the event-sourcing core: an append-only event store with optimistic
 * concurrency, aggregates rebuilt by replaying their stream, and projections that fold
 * the global event log into read models.
 *
 * <h2>Core Design</h2>
 * <p>Each aggregate owns one stream. A save appends the aggregate's buffered events with
 * the version it was loaded at as the expected version; if another writer got there
 * first the append fails with {@link io.eventsource.ConcurrencyConflictException} and
 * the caller reloads and retries. Every committed event also gets a global sequence
 * number in commit order, which projections consume through
 * {@link io.eventsource.spi.EventStore#readAll(long, int)}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventsource-core</b> - primitives, aggregates, SPI, projection engine,
 *       in-memory stores (no external deps apart from ulid-creator)</li>
 *   <li><b>eventsource-jdbc</b> - JDBC event store hierarchy (H2, MySQL, PostgreSQL),
 *       checkpoint store and transactions</li>
 *   <li><b>eventsource-campaign</b> - the campaign aggregate and its read model</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var eventStore   = JdbcEventStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var txContext    = new ThreadLocalTxContext();
 * var txManager    = new JdbcTransactionManager(connProvider, txContext);
 * var checkpoints  = new JdbcCheckpointStore(connProvider, txContext);
 *
 * try (EventSourcing es = EventSourcing.builder()
 *     .eventStore(eventStore)
 *     .checkpointStore(checkpoints)
 *     .unitOfWork(new JdbcUnitOfWork(txManager))
 *     .projection(new CampaignProjection(readModelStore))
 *     .build()) {
 *   es.start();
 *   var campaigns = es.repository(new JacksonCampaignEventCodec(), (CampaignId id) -> new Campaign(id, clock));
 *   campaigns.update(id, campaign -> { campaign.rename("Spring Sale"); return null; }, 3);
 * }
 * }</pre>
 *
 * @see io.eventsource.EventSourcing
 * @see io.eventsource.aggregate.AggregateRepository
 * @see io.eventsource.projection.ProjectionManager
 */
package io.eventsource;
