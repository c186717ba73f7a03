package com.example.chatsync.client;

import java.util.Objects;

public record ChatUser(Long id, String username) {

    public ChatUser {
        Objects.requireNonNull(id, "id");
    }
}
