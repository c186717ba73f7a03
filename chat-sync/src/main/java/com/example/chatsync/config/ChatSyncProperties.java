package com.example.chatsync.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatSyncProperties {

    @NestedConfigurationProperty
    private final Publish publish = new Publish();

    @NestedConfigurationProperty
    private final Transport transport = new Transport();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Messages messages = new Messages();

    @NestedConfigurationProperty
    private final Mutation mutation = new Mutation();

    public Publish getPublish() {
        return publish;
    }

    public Transport getTransport() {
        return transport;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Messages getMessages() {
        return messages;
    }

    public Mutation getMutation() {
        return mutation;
    }

    @Validated
    public static class Publish {

        /**
         * Upper bound for a single channel publish, so a slow broker cannot stall the write path.
         */
        private Duration timeout = Duration.ofSeconds(2);

        @NestedConfigurationProperty
        private final Retry retry = new Retry();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    @Validated
    public static class Retry {

        /**
         * Maximum number of failed publishes held for retry. Further failures are dropped.
         */
        private int capacity = 1000;

        /**
         * Total publish attempts per payload, including the first one.
         */
        private int maxAttempts = 3;

        /**
         * Delay between two drains of the retry queue.
         */
        private Duration interval = Duration.ofSeconds(5);

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    @Validated
    public static class Transport {

        /**
         * Interval between two broker health checks.
         */
        private Duration healthCheckInterval = Duration.ofSeconds(10);

        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Keep-alive ping on idle broker connections.
         */
        private Duration pingInterval = Duration.ofSeconds(30);

        private int subscriptionConnections = 50;

        private int subscriptionsPerConnection = 5;

        public Duration getHealthCheckInterval() {
            return healthCheckInterval;
        }

        public void setHealthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }

        public int getSubscriptionConnections() {
            return subscriptionConnections;
        }

        public void setSubscriptionConnections(int subscriptionConnections) {
            this.subscriptionConnections = subscriptionConnections;
        }

        public int getSubscriptionsPerConnection() {
            return subscriptionsPerConnection;
        }

        public void setSubscriptionsPerConnection(int subscriptionsPerConnection) {
            this.subscriptionsPerConnection = subscriptionsPerConnection;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Mirrors every dispatched domain event to {@link #eventTopic} when enabled.
         */
        private boolean mirrorEnabled = false;

        /**
         * Kafka topic receiving mirrored domain events, keyed by chat id.
         */
        private String eventTopic = "chat.events";

        private int partitions = 12;

        private int replicas = 1;

        public boolean isMirrorEnabled() {
            return mirrorEnabled;
        }

        public void setMirrorEnabled(boolean mirrorEnabled) {
            this.mirrorEnabled = mirrorEnabled;
        }

        public String getEventTopic() {
            return eventTopic;
        }

        public void setEventTopic(String eventTopic) {
            this.eventTopic = eventTopic;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public int getReplicas() {
            return replicas;
        }

        public void setReplicas(int replicas) {
            this.replicas = replicas;
        }
    }

    @Validated
    public static class Messages {

        /**
         * Default page size when listing messages of a chat.
         */
        private int pageSize = 100;

        /**
         * Largest page a caller may request.
         */
        private int maxPageSize = 500;

        /**
         * Upper bound on message content length.
         */
        private int maxContentLength = 4000;

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getMaxContentLength() {
            return maxContentLength;
        }

        public void setMaxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
        }
    }

    @Validated
    public static class Mutation {

        /**
         * Upper bound for committing one change set.
         */
        private Duration transactionTimeout = Duration.ofSeconds(10);

        public Duration getTransactionTimeout() {
            return transactionTimeout;
        }

        public void setTransactionTimeout(Duration transactionTimeout) {
            this.transactionTimeout = transactionTimeout;
        }
    }
}
