package com.example.chatsync.persistence;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.domain.Message;
import com.example.chatsync.domain.MessageStatus;
import com.example.chatsync.service.ChatRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaChatRepository implements ChatRepository {

    private final ChatJpaRepository chatJpaRepository;
    private final MessageJpaRepository messageJpaRepository;
    private final MessageStatusJpaRepository statusJpaRepository;
    private final DomainEntityConverter converter;

    @Override
    public Optional<Chat> findChat(Long chatId) {
        if (chatId == null) {
            return Optional.empty();
        }
        return chatJpaRepository.findById(chatId).map(converter::toDomain);
    }

    @Override
    public List<Chat> findChatsForMember(Long userId) {
        if (userId == null) {
            return Collections.emptyList();
        }
        return chatJpaRepository.findByMember(userId).stream().map(converter::toDomain).toList();
    }

    @Override
    public List<Chat> findChatsForMember(Long userId, String nameFilter, int offset, int limit) {
        if (userId == null || limit <= 0) {
            return Collections.emptyList();
        }
        List<ChatEntity> entities = StringUtils.hasText(nameFilter)
                ? chatJpaRepository.findByMemberAndName(userId, nameFilter.trim())
                : chatJpaRepository.findByMember(userId);
        return entities.stream()
                .skip(Math.max(offset, 0))
                .limit(limit)
                .map(converter::toDomain)
                .toList();
    }

    @Override
    public Optional<Message> findMessage(Long messageId) {
        if (messageId == null) {
            return Optional.empty();
        }
        return messageJpaRepository.findById(messageId).map(converter::toDomain);
    }

    @Override
    public List<Message> findRecentMessages(Long chatId, int limit) {
        if (chatId == null || limit <= 0) {
            return Collections.emptyList();
        }
        List<Message> newestFirst = messageJpaRepository
                .findByChatIdOrderByCreatedAtDescIdDesc(chatId, PageRequest.of(0, limit))
                .stream()
                .map(converter::toDomain)
                .toList();
        List<Message> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }

    @Override
    public List<Message> searchMessages(Long chatId, String content, int limit) {
        if (chatId == null || !StringUtils.hasText(content) || limit <= 0) {
            return Collections.emptyList();
        }
        return messageJpaRepository.searchInChat(chatId, content.trim(), PageRequest.of(0, limit)).stream()
                .map(converter::toDomain)
                .toList();
    }

    @Override
    public Optional<MessageStatus> findStatus(Long messageId, Long userId) {
        if (messageId == null || userId == null) {
            return Optional.empty();
        }
        return statusJpaRepository.findByMessageIdAndUserId(messageId, userId).map(converter::toDomain);
    }

    @Override
    public List<MessageStatus> findUnreadStatuses(Long chatId, Long userId) {
        if (chatId == null || userId == null) {
            return Collections.emptyList();
        }
        return statusJpaRepository.findByChatIdAndUserIdAndReadFalse(chatId, userId).stream()
                .map(converter::toDomain)
                .toList();
    }

    @Override
    public int countUnread(Long chatId, Long userId) {
        if (chatId == null || userId == null) {
            return 0;
        }
        return Math.toIntExact(statusJpaRepository.countUnread(chatId, userId));
    }
}
