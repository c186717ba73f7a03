package com.example.chatsync.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SendMessageRequest {

    @NotNull
    @JsonAlias("chat_id")
    private Long chatId;

    @NotBlank
    private String content;
}
