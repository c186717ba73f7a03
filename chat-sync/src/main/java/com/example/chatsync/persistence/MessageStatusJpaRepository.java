package com.example.chatsync.persistence;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageStatusJpaRepository extends JpaRepository<MessageStatusEntity, Long> {

    Optional<MessageStatusEntity> findByMessageIdAndUserId(Long messageId, Long userId);

    List<MessageStatusEntity> findByChatIdAndUserIdAndReadFalse(Long chatId, Long userId);

    @Query("select count(s) from MessageStatusEntity s, MessageEntity m "
            + "where m.id = s.messageId and s.chatId = :chatId and s.userId = :userId "
            + "and s.read = false and m.deleted = false")
    long countUnread(@Param("chatId") Long chatId, @Param("userId") Long userId);

    void deleteByChatId(Long chatId);
}
