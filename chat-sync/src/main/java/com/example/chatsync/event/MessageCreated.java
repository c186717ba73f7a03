package com.example.chatsync.event;

import com.example.chatsync.domain.Message;
import java.time.Instant;
import java.util.Objects;

public record MessageCreated(
        Long messageId, Long chatId, Long userId, String content, Instant createdAt, boolean deleted)
        implements DomainEvent {

    public MessageCreated {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static MessageCreated of(Message message) {
        return new MessageCreated(
                message.getId(),
                message.getChatId(),
                message.getUserId(),
                message.getContent(),
                message.getCreatedAt(),
                message.isDeleted());
    }

    @Override
    public DomainEventKind kind() {
        return DomainEventKind.MESSAGE_CREATED;
    }

    @Override
    public Instant occurredAt() {
        return createdAt;
    }
}
