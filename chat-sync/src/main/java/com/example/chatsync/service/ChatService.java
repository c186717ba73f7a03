package com.example.chatsync.service;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.service.exception.AuthorizationException;
import com.example.chatsync.service.exception.NotFoundException;
import com.example.chatsync.service.exception.ValidationException;
import com.example.chatsync.tracking.MutationExecutor;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    static final int DEFAULT_LIST_LIMIT = 100;
    static final int MAX_LIST_LIMIT = 500;
    static final int MAX_NAME_LENGTH = 200;

    private final ChatRepository chatRepository;
    private final MutationExecutor mutationExecutor;

    public Chat createChat(Long creatorId, String name, Collection<Long> memberIds) {
        requireUser(creatorId);
        if (!StringUtils.hasText(name)) {
            throw new ValidationException("Chat name is required");
        }
        Set<Long> members = new LinkedHashSet<>();
        members.add(creatorId);
        if (memberIds != null) {
            for (Long memberId : memberIds) {
                requireUser(memberId);
                members.add(memberId);
            }
        }
        Chat chat = Chat.builder()
                .name(name.trim())
                .createdAt(Instant.now())
                .memberIds(members)
                .build();
        Chat created = mutationExecutor.execute("createChat", scope -> scope.registerNew(chat));
        log.info("Chat {} created by user {} with {} members", created.getId(), creatorId, members.size());
        return created;
    }

    public List<Chat> listChats(Long userId) {
        requireUser(userId);
        return chatRepository.findChatsForMember(userId);
    }

    /**
     * One page of the user's chats, oldest first. {@code limit} defaults to 100 and is capped at 500.
     * Without any filter or paging argument every chat is returned, which is what a client reload
     * relies on.
     */
    public List<Chat> listChats(Long userId, String nameFilter, Integer skip, Integer limit) {
        if (nameFilter == null && skip == null && limit == null) {
            return listChats(userId);
        }
        requireUser(userId);
        if (skip != null && skip < 0) {
            throw new ValidationException("skip must not be negative");
        }
        int pageSize = limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : Math.min(limit, MAX_LIST_LIMIT);
        return chatRepository.findChatsForMember(userId, nameFilter, skip == null ? 0 : skip, pageSize);
    }

    /**
     * Returns the two-member chat of {@code userId} and {@code otherUserId}, creating it if they have
     * none yet.
     */
    public Chat startDirectChat(Long userId, Long otherUserId) {
        requireUser(userId);
        requireUser(otherUserId);
        if (userId.equals(otherUserId)) {
            throw new ValidationException("Cannot start a chat with yourself");
        }
        Set<Long> pair = new LinkedHashSet<>(List.of(userId, otherUserId));
        Optional<Chat> existing = chatRepository.findChatsForMember(userId).stream()
                .filter(chat -> pair.equals(chat.getMemberIds()))
                .findFirst();
        if (existing.isPresent()) {
            return existing.get();
        }
        Chat chat = Chat.builder()
                .name("Direct chat between users " + userId + " and " + otherUserId)
                .createdAt(Instant.now())
                .memberIds(pair)
                .build();
        Chat created = mutationExecutor.execute("startDirectChat", scope -> scope.registerNew(chat));
        log.info("Direct chat {} started by user {} with user {}", created.getId(), userId, otherUserId);
        return created;
    }

    public Chat renameChat(Long chatId, String name, Long actingUserId) {
        if (!StringUtils.hasText(name)) {
            throw new ValidationException("Chat name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Chat name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        Chat chat = requireMember(chatId, actingUserId);
        if (trimmed.equals(chat.getName())) {
            return chat;
        }
        return mutationExecutor.execute("renameChat", scope -> scope.update(chat, c -> c.setName(trimmed)));
    }

    /**
     * Deletes the chat with its messages and read statuses. Any member may delete it.
     */
    public void deleteChat(Long chatId, Long actingUserId) {
        Chat chat = requireMember(chatId, actingUserId);
        mutationExecutor.execute("deleteChat", scope -> scope.registerDeleted(chat));
        log.info("Chat {} deleted by user {}", chatId, actingUserId);
    }

    public Chat getChat(Long chatId, Long userId) {
        return requireMember(chatId, userId);
    }

    public Chat addMember(Long chatId, Long newMemberId, Long actingUserId) {
        requireUser(newMemberId);
        Chat chat = requireMember(chatId, actingUserId);
        if (chat.hasMember(newMemberId)) {
            return chat;
        }
        return mutationExecutor.execute("addMember", scope -> scope.update(chat, c -> c.addMember(newMemberId)));
    }

    public Chat removeMember(Long chatId, Long memberId, Long actingUserId) {
        requireUser(memberId);
        Chat chat = requireMember(chatId, actingUserId);
        if (!chat.hasMember(memberId)) {
            throw new NotFoundException("User " + memberId + " is not a member of chat " + chatId);
        }
        return mutationExecutor.execute("removeMember", scope -> scope.update(chat, c -> c.removeMember(memberId)));
    }

    public int unreadCount(Long chatId, Long userId) {
        requireMember(chatId, userId);
        return chatRepository.countUnread(chatId, userId);
    }

    /**
     * Unread count of every member of the chat, keyed by user id in membership order.
     */
    public Map<Long, Integer> unreadCountsByMember(Long chatId, Long actingUserId) {
        Chat chat = requireMember(chatId, actingUserId);
        Map<Long, Integer> counts = new LinkedHashMap<>();
        for (Long memberId : chat.getMemberIds()) {
            counts.put(memberId, chatRepository.countUnread(chatId, memberId));
        }
        return counts;
    }

    /**
     * Loads a chat on behalf of one of its members.
     *
     * @throws NotFoundException if the chat does not exist
     * @throws AuthorizationException if the user is not a member
     */
    public Chat requireMember(Long chatId, Long userId) {
        requireUser(userId);
        if (chatId == null) {
            throw new ValidationException("Chat id is required");
        }
        Chat chat = chatRepository.findChat(chatId)
                .orElseThrow(() -> new NotFoundException("Chat " + chatId + " not found"));
        if (!chat.hasMember(userId)) {
            throw new AuthorizationException("User " + userId + " is not a member of chat " + chatId);
        }
        return chat;
    }

    static void requireUser(Long userId) {
        if (userId == null || userId <= 0) {
            throw new ValidationException("A valid user id is required");
        }
    }
}
