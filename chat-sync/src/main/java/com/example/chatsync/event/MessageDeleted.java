package com.example.chatsync.event;

import com.example.chatsync.domain.Message;
import java.time.Instant;
import java.util.Objects;

/**
 * A soft delete: consumers keep the entry and flag it, they never drop it from their cache.
 */
public record MessageDeleted(
        Long messageId, Long chatId, Long userId, String content, Instant createdAt, Instant updatedAt)
        implements DomainEvent {

    public MessageDeleted {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(createdAt, "createdAt");
        content = content != null ? content : Message.DELETED_PLACEHOLDER;
    }

    public static MessageDeleted of(Message message) {
        return new MessageDeleted(
                message.getId(),
                message.getChatId(),
                message.getUserId(),
                message.getContent(),
                message.getCreatedAt(),
                message.getUpdatedAt());
    }

    public boolean deleted() {
        return true;
    }

    @Override
    public DomainEventKind kind() {
        return DomainEventKind.MESSAGE_DELETED;
    }

    @Override
    public Instant occurredAt() {
        return updatedAt != null ? updatedAt : createdAt;
    }
}
