package com.example.chatsync.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class UpdateChatRequest {

    @NotBlank
    @Size(max = 200)
    private String name;
}
