package com.example.chatsync.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {

    public static final String DELETED_PLACEHOLDER = "<This message has been deleted>";

    private Long id;
    private Long chatId;
    private Long userId;
    private String content;
    private Instant createdAt;
    private Instant updatedAt;
    private boolean deleted;

    public boolean isAuthoredBy(Long candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    public void edit(String newContent, Instant at) {
        this.content = newContent;
        this.updatedAt = at;
    }

    /**
     * Soft delete: the row stays, its content is replaced by {@link #DELETED_PLACEHOLDER}.
     */
    public void markDeleted(Instant at) {
        this.deleted = true;
        this.content = DELETED_PLACEHOLDER;
        this.updatedAt = at;
    }
}
