package com.example.chatsync.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chat implements Serializable {

    private Long id;
    private String name;
    private Instant createdAt;

    @Builder.Default
    private Set<Long> memberIds = new LinkedHashSet<>();

    public boolean hasMember(Long userId) {
        return userId != null && memberIds != null && memberIds.contains(userId);
    }

    public boolean addMember(Long userId) {
        if (memberIds == null) {
            memberIds = new LinkedHashSet<>();
        }
        return memberIds.add(userId);
    }

    public boolean removeMember(Long userId) {
        return memberIds != null && memberIds.remove(userId);
    }
}
