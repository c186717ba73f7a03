package com.example.chatsync.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MessageStatusRequest {

    @NotNull
    @JsonProperty("isRead")
    @JsonAlias({"is_read", "read"})
    private Boolean read;
}
