package com.example.chatsync.client;

/**
 * One store change as seen by observers. {@code previous} and {@code current} are copies; their type
 * depends on {@link #type()}.
 */
public record StoreEvent(StoreEventType type, Long chatId, Object previous, Object current) {

    public static StoreEvent of(StoreEventType type, Long chatId, Object current) {
        return new StoreEvent(type, chatId, null, current);
    }

    public <T> T current(Class<T> expectedType) {
        return expectedType.cast(current);
    }

    public <T> T previous(Class<T> expectedType) {
        return expectedType.cast(previous);
    }
}
