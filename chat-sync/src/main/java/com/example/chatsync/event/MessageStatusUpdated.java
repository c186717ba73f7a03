package com.example.chatsync.event;

import com.example.chatsync.domain.MessageStatus;
import java.time.Instant;
import java.util.Objects;

public record MessageStatusUpdated(
        Long messageId, Long chatId, Long userId, boolean read, Instant readAt, Instant occurredAt)
        implements DomainEvent {

    public MessageStatusUpdated {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public static MessageStatusUpdated of(MessageStatus status, Instant occurredAt) {
        return new MessageStatusUpdated(
                status.resolveMessageId(),
                status.getChatId(),
                status.getUserId(),
                status.isRead(),
                status.getReadAt(),
                occurredAt);
    }

    @Override
    public DomainEventKind kind() {
        return DomainEventKind.MESSAGE_STATUS_UPDATED;
    }
}
