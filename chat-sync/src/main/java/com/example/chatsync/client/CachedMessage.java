package com.example.chatsync.client;

import com.example.chatsync.domain.Message;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CachedMessage {

    public static final Comparator<CachedMessage> CHRONOLOGICAL = Comparator
            .comparing(CachedMessage::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CachedMessage::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private Long id;
    private Long chatId;
    private Long userId;
    private String content;
    private Instant createdAt;
    private Instant updatedAt;
    private boolean deleted;

    /**
     * Read receipts seen for this message, by member id.
     */
    @JsonIgnore
    @Builder.Default
    private Map<Long, Instant> readReceipts = new LinkedHashMap<>();

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> localState = new LinkedHashMap<>();

    /**
     * Field level upsert. A deleted message stays deleted and always shows the placeholder.
     */
    public void upsertFrom(CachedMessage incoming) {
        if (incoming.getContent() != null) {
            content = incoming.getContent();
        }
        if (incoming.getCreatedAt() != null) {
            createdAt = incoming.getCreatedAt();
        }
        if (incoming.getUpdatedAt() != null) {
            updatedAt = incoming.getUpdatedAt();
        }
        if (incoming.isDeleted()) {
            deleted = true;
        }
        if (deleted) {
            content = Message.DELETED_PLACEHOLDER;
        }
    }

    public CachedMessage copy() {
        return CachedMessage.builder()
                .id(id)
                .chatId(chatId)
                .userId(userId)
                .content(content)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .deleted(deleted)
                .readReceipts(readReceipts != null ? new LinkedHashMap<>(readReceipts) : new LinkedHashMap<>())
                .localState(localState != null ? new LinkedHashMap<>(localState) : new LinkedHashMap<>())
                .build();
    }
}
