package com.example.chatsync.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarkChatReadResponse {
    Long chatId;
    int markedRead;
}
