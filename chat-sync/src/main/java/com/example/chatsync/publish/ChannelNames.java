package com.example.chatsync.publish;

import com.example.chatsync.event.DomainEvent;

/**
 * Channel naming shared by producers and consumers. Every name is a pure function of the event
 * kind and the ids it carries.
 */
public final class ChannelNames {

    private static final String PREFIX = "chat:";

    private ChannelNames() {
    }

    /**
     * Message created, updated and deleted events of one chat.
     */
    public static String chat(Long chatId) {
        return PREFIX + requireId(chatId, "chatId");
    }

    /**
     * Read receipts of one chat.
     */
    public static String status(Long chatId) {
        return chat(chatId) + ":status";
    }

    /**
     * Unread count of one member in one chat.
     */
    public static String unreadCount(Long chatId, Long userId) {
        return chat(chatId) + ":unreadCount:" + requireId(userId, "userId");
    }

    public static String forEvent(DomainEvent event) {
        return switch (event.kind()) {
            case MESSAGE_CREATED, MESSAGE_UPDATED, MESSAGE_DELETED -> chat(event.chatId());
            case MESSAGE_STATUS_UPDATED -> status(event.chatId());
            case UNREAD_COUNT_UPDATED -> unreadCount(event.chatId(), event.userId());
        };
    }

    private static Long requireId(Long id, String name) {
        if (id == null) {
            throw new IllegalArgumentException(name + " is required to build a channel name");
        }
        return id;
    }
}
