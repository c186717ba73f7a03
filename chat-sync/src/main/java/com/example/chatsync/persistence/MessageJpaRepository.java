package com.example.chatsync.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, Long> {

    List<MessageEntity> findByChatIdOrderByCreatedAtDescIdDesc(Long chatId, Pageable pageable);

    @Query("select m from MessageEntity m where m.chatId = :chatId "
            + "and lower(m.content) like lower(concat('%', :content, '%')) "
            + "order by m.createdAt desc, m.id desc")
    List<MessageEntity> searchInChat(
            @Param("chatId") Long chatId, @Param("content") String content, Pageable pageable);

    void deleteByChatId(Long chatId);
}
