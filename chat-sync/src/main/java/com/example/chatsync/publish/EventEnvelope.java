package com.example.chatsync.publish;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire form of a domain event. Absent fields are omitted and unknown ones ignored, so producers and
 * consumers may evolve independently.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventEnvelope {

    private String kind;
    private Long messageId;
    private Long chatId;
    private Long userId;
    private String content;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonProperty("isDeleted")
    private Boolean deleted;

    @JsonProperty("isRead")
    private Boolean read;

    private Instant readAt;
    private Integer unreadCount;
}
