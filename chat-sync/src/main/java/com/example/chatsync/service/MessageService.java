package com.example.chatsync.service;

import com.example.chatsync.config.ChatSyncProperties;
import com.example.chatsync.domain.Chat;
import com.example.chatsync.domain.Message;
import com.example.chatsync.domain.MessageStatus;
import com.example.chatsync.event.MessageCreated;
import com.example.chatsync.event.MessageDeleted;
import com.example.chatsync.event.MessageStatusUpdated;
import com.example.chatsync.event.MessageUpdated;
import com.example.chatsync.event.UnreadCountUpdated;
import com.example.chatsync.service.exception.AuthorizationException;
import com.example.chatsync.service.exception.NotFoundException;
import com.example.chatsync.service.exception.ValidationException;
import com.example.chatsync.tracking.MutationExecutor;
import com.example.chatsync.tracking.MutationScope;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Message writes. Each one runs as a single tracked mutation; the events it raises reach the
 * channels only once the mutation committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    private final ChatService chatService;
    private final ChatRepository chatRepository;
    private final MutationExecutor mutationExecutor;
    private final ChatSyncProperties properties;

    /**
     * Stores a message together with one read status per chat member. The author's status starts
     * read, everybody else's unread.
     */
    public Message createMessage(Long userId, Long chatId, String content) {
        String text = requireContent(content);
        Chat chat = chatService.requireMember(chatId, userId);
        Instant now = Instant.now();
        Message message = Message.builder()
                .chatId(chat.getId())
                .userId(userId)
                .content(text)
                .createdAt(now)
                .build();

        return mutationExecutor.execute("createMessage", scope -> {
            scope.registerNew(message);
            for (Long memberId : chat.getMemberIds()) {
                scope.registerNew(MessageStatus.forNewMessage(message, memberId, now));
            }
            scope.raise(() -> MessageCreated.of(message));
            raiseUnreadCounts(scope, chat, userId);
            return message;
        });
    }

    public Message getMessage(Long userId, Long messageId) {
        Message message = requireMessage(messageId);
        chatService.requireMember(message.getChatId(), userId);
        return message;
    }

    /**
     * Newest messages of a chat, oldest first. With {@code content} only messages containing it are
     * returned, newest first.
     */
    public List<Message> listMessages(Long userId, Long chatId, Integer limit, String content) {
        chatService.requireMember(chatId, userId);
        int pageSize = resolvePageSize(limit);
        if (StringUtils.hasText(content)) {
            return chatRepository.searchMessages(chatId, content, pageSize);
        }
        return chatRepository.findRecentMessages(chatId, pageSize);
    }

    public Message editMessage(Long userId, Long messageId, String content) {
        String text = requireContent(content);
        Message message = requireMessage(messageId);
        chatService.requireMember(message.getChatId(), userId);
        requireAuthor(message, userId);
        if (message.isDeleted()) {
            throw new ValidationException("Deleted messages cannot be edited");
        }
        Instant now = Instant.now();
        return mutationExecutor.execute("editMessage", scope -> {
            scope.update(message, m -> m.edit(text, now));
            scope.raise(() -> MessageUpdated.of(message));
            return message;
        });
    }

    /**
     * Soft deletes a message. Deleting an already deleted message changes nothing and raises no
     * event.
     */
    public Message deleteMessage(Long userId, Long messageId) {
        Message message = requireMessage(messageId);
        Chat chat = chatService.requireMember(message.getChatId(), userId);
        requireAuthor(message, userId);
        if (message.isDeleted()) {
            return message;
        }
        Instant now = Instant.now();
        return mutationExecutor.execute("deleteMessage", scope -> {
            scope.update(message, m -> m.markDeleted(now));
            scope.raise(() -> MessageDeleted.of(message));
            raiseUnreadCounts(scope, chat, userId);
            return message;
        });
    }

    public MessageStatus updateStatus(Long userId, Long messageId, boolean read) {
        Message message = requireMessage(messageId);
        chatService.requireMember(message.getChatId(), userId);
        MessageStatus status = chatRepository.findStatus(messageId, userId)
                .orElseThrow(() -> new NotFoundException(
                        "No read status for message " + messageId + " and user " + userId));
        if (status.isRead() == read) {
            return status;
        }
        Instant now = Instant.now();
        return mutationExecutor.execute("updateMessageStatus", scope -> {
            scope.update(status, s -> s.applyRead(read, now));
            scope.raise(() -> MessageStatusUpdated.of(status, now));
            scope.raise(() -> unreadCountOf(status.getChatId(), userId));
            return status;
        });
    }

    /**
     * Marks every unread message of a chat read for one member.
     *
     * @return number of statuses that changed
     */
    public int markChatRead(Long userId, Long chatId) {
        chatService.requireMember(chatId, userId);
        List<MessageStatus> unread = chatRepository.findUnreadStatuses(chatId, userId);
        if (unread.isEmpty()) {
            return 0;
        }
        Instant now = Instant.now();
        return mutationExecutor.execute("markChatRead", scope -> {
            for (MessageStatus status : unread) {
                scope.update(status, s -> s.applyRead(true, now));
                scope.raise(() -> MessageStatusUpdated.of(status, now));
            }
            scope.raise(() -> unreadCountOf(chatId, userId));
            return unread.size();
        });
    }

    private void raiseUnreadCounts(MutationScope scope, Chat chat, Long authorId) {
        for (Long memberId : chat.getMemberIds()) {
            if (!memberId.equals(authorId)) {
                scope.raise(() -> unreadCountOf(chat.getId(), memberId));
            }
        }
    }

    private UnreadCountUpdated unreadCountOf(Long chatId, Long userId) {
        return new UnreadCountUpdated(chatId, userId, chatRepository.countUnread(chatId, userId), Instant.now());
    }

    private void requireAuthor(Message message, Long userId) {
        if (!message.isAuthoredBy(userId)) {
            throw new AuthorizationException("Only the author may change message " + message.getId());
        }
    }

    private Message requireMessage(Long messageId) {
        if (messageId == null) {
            throw new ValidationException("Message id is required");
        }
        return chatRepository.findMessage(messageId)
                .orElseThrow(() -> new NotFoundException("Message " + messageId + " not found"));
    }

    private String requireContent(String content) {
        if (!StringUtils.hasText(content)) {
            throw new ValidationException("Message content is required");
        }
        int maxLength = properties.getMessages().getMaxContentLength();
        if (content.length() > maxLength) {
            throw new ValidationException("Message content exceeds " + maxLength + " characters");
        }
        return content;
    }

    private int resolvePageSize(Integer limit) {
        if (limit == null) {
            return properties.getMessages().getPageSize();
        }
        if (limit < 1) {
            throw new ValidationException("Limit must be positive");
        }
        return Math.min(limit, properties.getMessages().getMaxPageSize());
    }
}
