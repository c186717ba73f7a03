package com.example.chatsync.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class StartChatRequest {

    @NotNull
    @Positive
    @JsonAlias("other_user_id")
    private Long otherUserId;
}
