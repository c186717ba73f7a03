package com.example.chatsync.persistence;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.domain.Message;
import com.example.chatsync.domain.MessageStatus;
import java.time.Instant;
import java.util.LinkedHashSet;
import org.springframework.stereotype.Component;

@Component
public class DomainEntityConverter {

    public ChatEntity toEntity(Chat chat, ChatEntity target) {
        target.setName(chat.getName());
        target.setCreatedAt(defaultInstant(chat.getCreatedAt()));
        target.getMemberIds().clear();
        if (chat.getMemberIds() != null) {
            target.getMemberIds().addAll(chat.getMemberIds());
        }
        return target;
    }

    public Chat toDomain(ChatEntity entity) {
        if (entity == null) {
            return null;
        }
        return Chat.builder()
                .id(entity.getId())
                .name(entity.getName())
                .createdAt(entity.getCreatedAt())
                .memberIds(new LinkedHashSet<>(entity.getMemberIds()))
                .build();
    }

    public MessageEntity toEntity(Message message, MessageEntity target) {
        target.setChatId(message.getChatId());
        target.setUserId(message.getUserId());
        target.setContent(message.getContent());
        target.setCreatedAt(defaultInstant(message.getCreatedAt()));
        target.setUpdatedAt(message.getUpdatedAt());
        target.setDeleted(message.isDeleted());
        return target;
    }

    public Message toDomain(MessageEntity entity) {
        if (entity == null) {
            return null;
        }
        return Message.builder()
                .id(entity.getId())
                .chatId(entity.getChatId())
                .userId(entity.getUserId())
                .content(entity.getContent())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .deleted(entity.isDeleted())
                .build();
    }

    public MessageStatusEntity toEntity(MessageStatus status, MessageStatusEntity target) {
        Long messageId = status.resolveMessageId();
        if (messageId == null) {
            throw new IllegalStateException("Message status has no message id; insert its message first");
        }
        target.setMessageId(messageId);
        target.setChatId(status.getChatId());
        target.setUserId(status.getUserId());
        target.setRead(status.isRead());
        target.setReadAt(status.getReadAt());
        return target;
    }

    public MessageStatus toDomain(MessageStatusEntity entity) {
        if (entity == null) {
            return null;
        }
        return MessageStatus.builder()
                .id(entity.getId())
                .messageId(entity.getMessageId())
                .chatId(entity.getChatId())
                .userId(entity.getUserId())
                .read(entity.isRead())
                .readAt(entity.getReadAt())
                .build();
    }

    private Instant defaultInstant(Instant instant) {
        return instant != null ? instant : Instant.now();
    }
}
