package com.example.chatsync.event;

import com.example.chatsync.domain.Message;
import java.time.Instant;
import java.util.Objects;

public record MessageUpdated(
        Long messageId,
        Long chatId,
        Long userId,
        String content,
        Instant createdAt,
        Instant updatedAt,
        boolean deleted)
        implements DomainEvent {

    public MessageUpdated {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static MessageUpdated of(Message message) {
        return new MessageUpdated(
                message.getId(),
                message.getChatId(),
                message.getUserId(),
                message.getContent(),
                message.getCreatedAt(),
                message.getUpdatedAt(),
                message.isDeleted());
    }

    @Override
    public DomainEventKind kind() {
        return DomainEventKind.MESSAGE_UPDATED;
    }

    @Override
    public Instant occurredAt() {
        return updatedAt;
    }
}
