package com.example.chatsync.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class AddMemberRequest {

    @NotNull
    @Positive
    @JsonAlias("user_id")
    private Long userId;
}
