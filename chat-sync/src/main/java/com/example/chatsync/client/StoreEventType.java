package com.example.chatsync.client;

public enum StoreEventType {
    USER_LOGGED_IN,
    USER_LOGGED_OUT,
    CHATS_LOADED,
    CHAT_ADDED,
    CHAT_UPDATED,
    CHAT_REMOVED,
    UNREAD_COUNT_UPDATED,
    MESSAGE_RECEIVED,
    MESSAGE_UPDATED,
    MESSAGES_MERGED,
    MESSAGE_STATUS_UPDATED,
    CURRENT_CHAT_CHANGED,
    CONNECTION_STATUS_CHANGED,
    STATE_CLEARED
}
