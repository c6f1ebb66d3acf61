package io.eventsource.spring.boot;

import io.eventsource.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the event store and projections.
 *
 * @see EventSourcingAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventsource")
public class EventSourcingProperties {

    /**
     * Database table name for events.
     */
    private String tableName = TableNames.DEFAULT_EVENT_TABLE;

    /**
     * Database table name for the global sequence counter.
     */
    private String sequenceTableName = TableNames.DEFAULT_SEQUENCE_TABLE;

    /**
     * Database table name for projection checkpoints.
     */
    private String checkpointTableName = TableNames.DEFAULT_CHECKPOINT_TABLE;

    /**
     * Per-statement timeout; zero disables it.
     */
    private Duration queryTimeout = Duration.ZERO;

    /**
     * Whether missing tables are created on startup.
     */
    private boolean initializeSchema = true;

    private final Projection projection = new Projection();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getSequenceTableName() {
        return sequenceTableName;
    }

    public void setSequenceTableName(String sequenceTableName) {
        this.sequenceTableName = sequenceTableName;
    }

    public String getCheckpointTableName() {
        return checkpointTableName;
    }

    public void setCheckpointTableName(String checkpointTableName) {
        this.checkpointTableName = checkpointTableName;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Projection getProjection() {
        return projection;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Projection {
        private long pollIntervalMs = 1000;
        private int batchSize = 100;
        private int maxAttempts = 5;
        private boolean autoStart = true;
        private final Retry retry = new Retry();

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Retry {
        private long baseDelayMs = 200;
        private long maxDelayMs = 60000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventsource";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
