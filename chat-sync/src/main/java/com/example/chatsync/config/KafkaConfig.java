package com.example.chatsync.config;

import com.example.chatsync.publish.EventEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

/**
 * Producer side of the event mirror. Envelopes are written with the application's ObjectMapper so
 * the topic carries the same JSON as the chat channels.
 */
@Configuration
@ConditionalOnProperty(prefix = "chat.kafka", name = "mirror-enabled", havingValue = "true")
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, EventEnvelope> eventEnvelopeProducerFactory(
            KafkaProperties properties, ObjectProvider<SslBundles> sslBundles, ObjectMapper objectMapper) {
        Map<String, Object> config = properties.buildProducerProperties(sslBundles.getIfAvailable());
        config.putIfAbsent(ProducerConfig.CLIENT_ID_CONFIG, "chat-sync-event-mirror");
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        config.put(ProducerConfig.ACKS_CONFIG, "all");

        JsonSerializer<EventEnvelope> valueSerializer = new JsonSerializer<>(objectMapper);
        valueSerializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(config, new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, EventEnvelope> eventEnvelopeKafkaTemplate(
            ProducerFactory<String, EventEnvelope> eventEnvelopeProducerFactory) {
        return new KafkaTemplate<>(eventEnvelopeProducerFactory);
    }

    @Bean
    public NewTopic eventTopic(ChatSyncProperties chatSyncProperties) {
        ChatSyncProperties.Kafka kafka = chatSyncProperties.getKafka();
        return TopicBuilder.name(kafka.getEventTopic())
                .partitions(kafka.getPartitions())
                .replicas(kafka.getReplicas())
                .build();
    }
}
