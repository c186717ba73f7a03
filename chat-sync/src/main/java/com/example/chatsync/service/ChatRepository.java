package com.example.chatsync.service;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.domain.Message;
import com.example.chatsync.domain.MessageStatus;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the chat store. Writes go through the change tracker.
 */
public interface ChatRepository {

    Optional<Chat> findChat(Long chatId);

    List<Chat> findChatsForMember(Long userId);

    /**
     * Chats of a member, oldest first, optionally filtered by a case-insensitive name fragment.
     */
    List<Chat> findChatsForMember(Long userId, String nameFilter, int offset, int limit);

    Optional<Message> findMessage(Long messageId);

    /**
     * Newest {@code limit} messages of a chat, returned oldest first.
     */
    List<Message> findRecentMessages(Long chatId, int limit);

    List<Message> searchMessages(Long chatId, String content, int limit);

    Optional<MessageStatus> findStatus(Long messageId, Long userId);

    List<MessageStatus> findUnreadStatuses(Long chatId, Long userId);

    int countUnread(Long chatId, Long userId);
}
