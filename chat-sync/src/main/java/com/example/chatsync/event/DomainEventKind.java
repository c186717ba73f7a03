package com.example.chatsync.event;

import java.util.Arrays;
import java.util.Optional;

public enum DomainEventKind {
    MESSAGE_CREATED("MessageCreated", MessageCreated.class),
    MESSAGE_UPDATED("MessageUpdated", MessageUpdated.class),
    MESSAGE_DELETED("MessageDeleted", MessageDeleted.class),
    MESSAGE_STATUS_UPDATED("MessageStatusUpdated", MessageStatusUpdated.class),
    UNREAD_COUNT_UPDATED("UnreadCountUpdated", UnreadCountUpdated.class);

    private final String wireName;
    private final Class<? extends DomainEvent> eventType;

    DomainEventKind(String wireName, Class<? extends DomainEvent> eventType) {
        this.wireName = wireName;
        this.eventType = eventType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends DomainEvent> eventType() {
        return eventType;
    }

    public boolean affectsMessageContent() {
        return this == MESSAGE_CREATED || this == MESSAGE_UPDATED || this == MESSAGE_DELETED;
    }

    public static Optional<DomainEventKind> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(wireName))
                .findFirst();
    }

    public static DomainEventKind of(Class<? extends DomainEvent> eventType) {
        return Arrays.stream(values())
                .filter(kind -> kind.eventType.equals(eventType))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown domain event type: " + eventType.getName()));
    }
}
