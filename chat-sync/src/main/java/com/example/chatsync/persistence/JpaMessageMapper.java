package com.example.chatsync.persistence;

import com.example.chatsync.domain.Message;
import com.example.chatsync.tracking.EntityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JpaMessageMapper implements EntityMapper<Message> {

    private final MessageJpaRepository messageJpaRepository;
    private final DomainEntityConverter converter;

    @Override
    public Class<Message> entityType() {
        return Message.class;
    }

    @Override
    public void insert(Message message) {
        MessageEntity saved = messageJpaRepository.saveAndFlush(converter.toEntity(message, new MessageEntity()));
        message.setId(saved.getId());
        message.setCreatedAt(saved.getCreatedAt());
    }

    @Override
    public void update(Message message) {
        MessageEntity entity = messageJpaRepository.findById(requireId(message))
                .orElseThrow(() -> new IllegalStateException("Message " + message.getId() + " no longer exists"));
        messageJpaRepository.save(converter.toEntity(message, entity));
    }

    @Override
    public void delete(Message message) {
        messageJpaRepository.deleteById(requireId(message));
    }

    private Long requireId(Message message) {
        if (message.getId() == null) {
            throw new IllegalStateException("Message has no id; it was never inserted");
        }
        return message.getId();
    }
}
