package io.eventsource.spring.boot;

import io.eventsource.EventSourcing;
import io.eventsource.jdbc.DataSourceConnectionProvider;
import io.eventsource.jdbc.checkpoint.JdbcCheckpointStore;
import io.eventsource.jdbc.store.AbstractJdbcEventStore;
import io.eventsource.jdbc.store.JdbcEventStores;
import io.eventsource.jdbc.tx.JdbcTransactionManager;
import io.eventsource.jdbc.tx.JdbcUnitOfWork;
import io.eventsource.jdbc.tx.ThreadLocalTxContext;
import io.eventsource.projection.ExponentialBackoffRetryPolicy;
import io.eventsource.projection.PoisonEventManager;
import io.eventsource.projection.Projection;
import io.eventsource.projection.ProjectionManager;
import io.eventsource.spi.CheckpointStore;
import io.eventsource.spi.ConnectionProvider;
import io.eventsource.spi.EventStore;
import io.eventsource.spi.MetricsExporter;
import io.eventsource.spi.UnitOfWork;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the event store and projection engine.
 *
 * <p>Detects the database dialect from the {@link DataSource}, wires the JDBC event and
 * checkpoint stores, and runs every {@link Projection} bean in an {@link EventSourcing}
 * instance that is started with the context and closed with it.
 *
 * @see EventSourcingProperties
 * @see EventSourcingMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventSourcing.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventSourcingProperties.class)
public class EventSourcingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    public AbstractJdbcEventStore eventStore(DataSource dataSource, EventSourcingProperties props) {
        return JdbcEventStores.detect(dataSource, props.getTableName(), props.getSequenceTableName(),
                props.getQueryTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public ThreadLocalTxContext txContext() {
        return new ThreadLocalTxContext();
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcTransactionManager eventSourcingTransactionManager(ConnectionProvider connectionProvider,
                                                                  ThreadLocalTxContext txContext) {
        return new JdbcTransactionManager(connectionProvider, txContext);
    }

    @Bean
    @ConditionalOnMissingBean(UnitOfWork.class)
    public JdbcUnitOfWork unitOfWork(JdbcTransactionManager eventSourcingTransactionManager) {
        return new JdbcUnitOfWork(eventSourcingTransactionManager);
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    public JdbcCheckpointStore checkpointStore(ConnectionProvider connectionProvider,
                                               ThreadLocalTxContext txContext,
                                               EventSourcingProperties props) {
        return new JdbcCheckpointStore(connectionProvider, txContext, props.getCheckpointTableName(),
                props.getQueryTimeout());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventSourcing eventSourcing(EventSourcingProperties props,
                                       EventStore eventStore,
                                       CheckpointStore checkpointStore,
                                       UnitOfWork unitOfWork,
                                       ObjectProvider<MetricsExporter> metricsProvider,
                                       ObjectProvider<Projection> projectionProvider,
                                       ObjectProvider<EventSourcingInitializer> initializerProvider) {
        EventSourcingProperties.Projection projection = props.getProjection();
        EventSourcing.Builder builder = EventSourcing.builder()
                .eventStore(eventStore)
                .checkpointStore(checkpointStore)
                .unitOfWork(unitOfWork)
                .retryPolicy(new ExponentialBackoffRetryPolicy(
                        projection.getRetry().getBaseDelayMs(), projection.getRetry().getMaxDelayMs()))
                .maxAttempts(projection.getMaxAttempts())
                .batchSize(projection.getBatchSize())
                .intervalMs(projection.getPollIntervalMs())
                .initializeSchema(props.isInitializeSchema())
                .startProjections(projection.isAutoStart())
                .projections(projectionProvider.orderedStream().toList());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        initializerProvider.orderedStream().forEach(initializer -> builder.initializer(initializer::initialize));
        EventSourcing eventSourcing = builder.build();
        eventSourcing.start();
        return eventSourcing;
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectionManager projectionManager(EventSourcing eventSourcing) {
        return eventSourcing.projectionManager();
    }

    @Bean
    @ConditionalOnMissingBean
    public PoisonEventManager poisonEventManager(EventSourcing eventSourcing) {
        return eventSourcing.poisonEvents();
    }
}
