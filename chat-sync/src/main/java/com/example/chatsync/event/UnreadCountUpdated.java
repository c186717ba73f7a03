package com.example.chatsync.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Authoritative unread count of one member in one chat. Consumers replace their value with it.
 */
public record UnreadCountUpdated(Long chatId, Long userId, int unreadCount, Instant occurredAt)
        implements DomainEvent {

    public UnreadCountUpdated {
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(occurredAt, "occurredAt");
        if (unreadCount < 0) {
            throw new IllegalArgumentException("unreadCount must not be negative");
        }
    }

    @Override
    public DomainEventKind kind() {
        return DomainEventKind.UNREAD_COUNT_UPDATED;
    }
}
