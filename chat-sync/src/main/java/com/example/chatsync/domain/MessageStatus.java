package com.example.chatsync.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Read state of one message for one chat member.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageStatus implements Serializable {

    private Long id;
    private Long messageId;
    private Long chatId;
    private Long userId;
    private boolean read;
    private Instant readAt;

    /**
     * Set when the status is created together with its message in the same change set, before the
     * message id is known.
     */
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private transient Message message;

    public static MessageStatus forNewMessage(Message message, Long memberId, Instant now) {
        boolean author = message.isAuthoredBy(memberId);
        return MessageStatus.builder()
                .message(message)
                .chatId(message.getChatId())
                .userId(memberId)
                .read(author)
                .readAt(author ? now : null)
                .build();
    }

    public Long resolveMessageId() {
        if (messageId == null && message != null) {
            messageId = message.getId();
        }
        return messageId;
    }

    public void applyRead(boolean isRead, Instant at) {
        this.read = isRead;
        this.readAt = isRead ? at : null;
    }
}
