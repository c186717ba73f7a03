package com.example.chatsync.event;

import java.time.Instant;

/**
 * Immutable record of a committed state change. Never persisted; consumed once by
 * {@link DomainEventDispatcher}.
 */
public interface DomainEvent {

    DomainEventKind kind();

    Long chatId();

    Long userId();

    Instant occurredAt();
}
