package com.example.chatsync.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client side copy of a chat. {@link #localState} holds UI decorations that never come from the
 * server and survive every upsert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CachedChat {

    private Long id;
    private String name;
    private Instant createdAt;

    @Builder.Default
    private Set<Long> memberIds = new LinkedHashSet<>();

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> localState = new LinkedHashMap<>();

    /**
     * Copies server owned fields from {@code incoming}. Null fields of {@code incoming} leave the
     * current value alone.
     */
    public void upsertFrom(CachedChat incoming) {
        if (incoming.getName() != null) {
            name = incoming.getName();
        }
        if (incoming.getCreatedAt() != null) {
            createdAt = incoming.getCreatedAt();
        }
        if (incoming.getMemberIds() != null && !incoming.getMemberIds().isEmpty()) {
            memberIds = new LinkedHashSet<>(incoming.getMemberIds());
        }
    }

    public CachedChat copy() {
        return CachedChat.builder()
                .id(id)
                .name(name)
                .createdAt(createdAt)
                .memberIds(memberIds != null ? new LinkedHashSet<>(memberIds) : new LinkedHashSet<>())
                .localState(localState != null ? new LinkedHashMap<>(localState) : new LinkedHashMap<>())
                .build();
    }
}
