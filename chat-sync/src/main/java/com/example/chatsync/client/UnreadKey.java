package com.example.chatsync.client;

import java.util.Objects;

public record UnreadKey(Long chatId, Long userId) {

    public UnreadKey {
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(userId, "userId");
    }
}
