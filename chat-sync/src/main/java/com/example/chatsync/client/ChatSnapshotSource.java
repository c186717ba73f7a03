package com.example.chatsync.client;

import java.util.List;

/**
 * Pull side of the client: full state fetched on demand, used for the initial load and to catch up
 * after a reconnect. Calls are made on behalf of one user.
 */
public interface ChatSnapshotSource {

    List<CachedChat> fetchChats();

    /**
     * Newest {@code limit} messages of a chat, oldest first.
     */
    List<CachedMessage> fetchMessages(Long chatId, int limit);

    int fetchUnreadCount(Long chatId);

    /**
     * @return number of messages that were marked read
     */
    int markChatRead(Long chatId);

    CachedMessage sendMessage(Long chatId, String content);
}
