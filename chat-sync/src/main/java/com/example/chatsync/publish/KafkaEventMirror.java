package com.example.chatsync.publish;

import com.example.chatsync.config.ChatSyncProperties;
import com.example.chatsync.event.DomainEvent;
import com.example.chatsync.event.DomainEventDispatcher;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Copies every dispatched domain event to a Kafka topic keyed by chat id, for consumers outside the
 * real-time path. Best effort.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "chat.kafka", name = "mirror-enabled", havingValue = "true")
public class KafkaEventMirror {

    private final DomainEventDispatcher dispatcher;
    private final KafkaTemplate<String, EventEnvelope> eventEnvelopeKafkaTemplate;
    private final EventWireCodec codec;
    private final ChatSyncProperties properties;

    @PostConstruct
    public void register() {
        dispatcher.registerForAll(this::mirror);
    }

    public void mirror(DomainEvent event) {
        String topic = properties.getKafka().getEventTopic();
        eventEnvelopeKafkaTemplate
                .send(topic, String.valueOf(event.chatId()), codec.toEnvelope(event))
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Unable to mirror {} for chat {} to {}", event.kind(), event.chatId(), topic, ex);
                    }
                });
    }
}
