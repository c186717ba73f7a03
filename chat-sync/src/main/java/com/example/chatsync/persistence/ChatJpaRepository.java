package com.example.chatsync.persistence;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatJpaRepository extends JpaRepository<ChatEntity, Long> {

    @Query("select distinct c from ChatEntity c join c.memberIds m where m = :userId order by c.createdAt asc, c.id asc")
    List<ChatEntity> findByMember(@Param("userId") Long userId);

    @Query("select distinct c from ChatEntity c join c.memberIds m where m = :userId "
            + "and lower(c.name) like lower(concat('%', :name, '%')) order by c.createdAt asc, c.id asc")
    List<ChatEntity> findByMemberAndName(@Param("userId") Long userId, @Param("name") String name);
}
