package com.example.chatsync.persistence;

import com.example.chatsync.domain.MessageStatus;
import com.example.chatsync.tracking.EntityMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JpaMessageStatusMapper implements EntityMapper<MessageStatus> {

    private final MessageStatusJpaRepository statusJpaRepository;
    private final DomainEntityConverter converter;

    @Override
    public Class<MessageStatus> entityType() {
        return MessageStatus.class;
    }

    @Override
    public void insert(MessageStatus status) {
        MessageStatusEntity saved =
                statusJpaRepository.saveAndFlush(converter.toEntity(status, new MessageStatusEntity()));
        status.setId(saved.getId());
    }

    @Override
    public void update(MessageStatus status) {
        MessageStatusEntity entity = statusJpaRepository.findById(requireId(status))
                .orElseThrow(() -> new IllegalStateException("Message status " + status.getId() + " no longer exists"));
        statusJpaRepository.save(converter.toEntity(status, entity));
    }

    @Override
    public void delete(MessageStatus status) {
        statusJpaRepository.deleteById(requireId(status));
    }

    private Long requireId(MessageStatus status) {
        if (status.getId() == null) {
            throw new IllegalStateException("Message status has no id; it was never inserted");
        }
        return status.getId();
    }
}
