package io.eventsource.spring.boot;

import io.eventsource.campaign.CampaignCommands;
import io.eventsource.campaign.readmodel.CampaignProjection;
import io.eventsource.campaign.readmodel.CampaignReadModelStore;
import io.eventsource.campaign.readmodel.JdbcCampaignReadModelStore;
import io.eventsource.jdbc.tx.ThreadLocalTxContext;
import io.eventsource.spi.ConnectionProvider;
import io.eventsource.spi.EventStore;
import io.eventsource.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Campaign command handling and read model, registered when the campaign module is on the
 * classpath.
 */
@AutoConfiguration(after = EventSourcingAutoConfiguration.class)
@ConditionalOnClass(CampaignProjection.class)
@ConditionalOnBean(EventStore.class)
public class CampaignAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(CampaignReadModelStore.class)
    public JdbcCampaignReadModelStore campaignReadModelStore(ConnectionProvider connectionProvider,
                                                             ThreadLocalTxContext txContext,
                                                             EventSourcingProperties props) {
        return new JdbcCampaignReadModelStore(connectionProvider, txContext,
                JdbcCampaignReadModelStore.DEFAULT_TABLE, props.getQueryTimeout());
    }

    @Bean
    public EventSourcingInitializer campaignReadModelInitializer(CampaignReadModelStore campaignReadModelStore) {
        return campaignReadModelStore::initialize;
    }

    @Bean
    @ConditionalOnMissingBean
    public CampaignProjection campaignProjection(CampaignReadModelStore campaignReadModelStore) {
        return new CampaignProjection(campaignReadModelStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public CampaignCommands campaignCommands(EventStore eventStore,
                                             ObjectProvider<MetricsExporter> metricsProvider) {
        return new CampaignCommands(eventStore, metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP),
                Clock.systemUTC(), 3);
    }
}
