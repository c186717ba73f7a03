package com.example.chatsync.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UnreadCountResponse {
    Long chatId;
    Long userId;
    int unreadCount;
}
