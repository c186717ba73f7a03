package com.example.chatsync.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class CreateChatRequest {

    @NotBlank
    @Size(max = 200)
    private String name;

    @JsonAlias("member_ids")
    private List<Long> memberIds = new ArrayList<>();
}
