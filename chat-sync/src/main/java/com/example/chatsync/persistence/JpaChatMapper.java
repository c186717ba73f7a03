package com.example.chatsync.persistence;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.tracking.EntityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JpaChatMapper implements EntityMapper<Chat> {

    private final ChatJpaRepository chatJpaRepository;
    private final MessageJpaRepository messageJpaRepository;
    private final MessageStatusJpaRepository statusJpaRepository;
    private final DomainEntityConverter converter;

    @Override
    public Class<Chat> entityType() {
        return Chat.class;
    }

    @Override
    public void insert(Chat chat) {
        ChatEntity saved = chatJpaRepository.saveAndFlush(converter.toEntity(chat, new ChatEntity()));
        chat.setId(saved.getId());
        chat.setCreatedAt(saved.getCreatedAt());
    }

    @Override
    public void update(Chat chat) {
        ChatEntity entity = chatJpaRepository.findById(requireId(chat))
                .orElseThrow(() -> new IllegalStateException("Chat " + chat.getId() + " no longer exists"));
        chatJpaRepository.save(converter.toEntity(chat, entity));
    }

    /**
     * Removes the chat together with its messages and read statuses.
     */
    @Override
    public void delete(Chat chat) {
        Long chatId = requireId(chat);
        statusJpaRepository.deleteByChatId(chatId);
        messageJpaRepository.deleteByChatId(chatId);
        chatJpaRepository.deleteById(chatId);
    }

    private Long requireId(Chat chat) {
        if (chat.getId() == null) {
            throw new IllegalStateException("Chat has no id; it was never inserted");
        }
        return chat.getId();
    }
}
