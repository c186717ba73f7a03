package com.example.chatsync.publish;

import com.example.chatsync.event.DomainEvent;
import com.example.chatsync.event.DomainEventKind;
import com.example.chatsync.event.MessageCreated;
import com.example.chatsync.event.MessageDeleted;
import com.example.chatsync.event.MessageStatusUpdated;
import com.example.chatsync.event.MessageUpdated;
import com.example.chatsync.event.UnreadCountUpdated;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts domain events to and from their JSON wire form.
 */
@Slf4j
@Component
public class EventWireCodec {

    private final ObjectMapper objectMapper;

    public EventWireCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Codec with the same JSON settings as the service, for consumers running outside Spring.
     */
    public static EventWireCodec standalone() {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return new EventWireCodec(mapper);
    }

    public byte[] encode(DomainEvent event) {
        try {
            return objectMapper.writeValueAsBytes(toEnvelope(event));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to encode " + event.kind() + " event", ex);
        }
    }

    /**
     * Decodes a payload received on a channel. Malformed payloads and unknown kinds yield an empty
     * result.
     */
    public Optional<DomainEvent> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        EventEnvelope envelope;
        try {
            envelope = objectMapper.readValue(payload, EventEnvelope.class);
        } catch (IOException ex) {
            log.warn("Discarding malformed channel payload ({} bytes)", payload.length, ex);
            return Optional.empty();
        }
        return toEvent(envelope);
    }

    public EventEnvelope toEnvelope(DomainEvent event) {
        EventEnvelope.EventEnvelopeBuilder builder = EventEnvelope.builder()
                .kind(event.kind().wireName())
                .chatId(event.chatId())
                .userId(event.userId());
        if (event instanceof MessageCreated created) {
            builder.messageId(created.messageId())
                    .content(created.content())
                    .createdAt(created.createdAt())
                    .deleted(created.deleted());
        } else if (event instanceof MessageUpdated updated) {
            builder.messageId(updated.messageId())
                    .content(updated.content())
                    .createdAt(updated.createdAt())
                    .updatedAt(updated.updatedAt())
                    .deleted(updated.deleted());
        } else if (event instanceof MessageDeleted deleted) {
            builder.messageId(deleted.messageId())
                    .content(deleted.content())
                    .createdAt(deleted.createdAt())
                    .updatedAt(deleted.updatedAt())
                    .deleted(true);
        } else if (event instanceof MessageStatusUpdated status) {
            builder.messageId(status.messageId())
                    .createdAt(status.occurredAt())
                    .read(status.read())
                    .readAt(status.readAt());
        } else if (event instanceof UnreadCountUpdated unread) {
            builder.createdAt(unread.occurredAt())
                    .unreadCount(unread.unreadCount());
        }
        return builder.build();
    }

    public Optional<DomainEvent> toEvent(EventEnvelope envelope) {
        Optional<DomainEventKind> kind = DomainEventKind.fromWireName(envelope.getKind());
        if (kind.isEmpty()) {
            log.debug("Ignoring event of unknown kind {}", envelope.getKind());
            return Optional.empty();
        }
        try {
            return Optional.of(build(kind.get(), envelope));
        } catch (RuntimeException ex) {
            log.warn("Discarding incomplete {} payload for chat {}", envelope.getKind(), envelope.getChatId(), ex);
            return Optional.empty();
        }
    }

    private DomainEvent build(DomainEventKind kind, EventEnvelope envelope) {
        boolean deleted = Boolean.TRUE.equals(envelope.getDeleted());
        return switch (kind) {
            case MESSAGE_CREATED -> new MessageCreated(
                    envelope.getMessageId(),
                    envelope.getChatId(),
                    envelope.getUserId(),
                    envelope.getContent(),
                    envelope.getCreatedAt(),
                    deleted);
            case MESSAGE_UPDATED -> new MessageUpdated(
                    envelope.getMessageId(),
                    envelope.getChatId(),
                    envelope.getUserId(),
                    envelope.getContent(),
                    envelope.getCreatedAt(),
                    envelope.getUpdatedAt(),
                    deleted);
            case MESSAGE_DELETED -> new MessageDeleted(
                    envelope.getMessageId(),
                    envelope.getChatId(),
                    envelope.getUserId(),
                    envelope.getContent(),
                    envelope.getCreatedAt(),
                    envelope.getUpdatedAt());
            case MESSAGE_STATUS_UPDATED -> new MessageStatusUpdated(
                    envelope.getMessageId(),
                    envelope.getChatId(),
                    envelope.getUserId(),
                    Boolean.TRUE.equals(envelope.getRead()),
                    envelope.getReadAt(),
                    envelope.getCreatedAt());
            case UNREAD_COUNT_UPDATED -> new UnreadCountUpdated(
                    envelope.getChatId(),
                    envelope.getUserId(),
                    envelope.getUnreadCount() != null ? envelope.getUnreadCount() : 0,
                    envelope.getCreatedAt());
        };
    }
}
