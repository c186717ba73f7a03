package com.example.chatsync.client;

import com.example.chatsync.service.exception.TransportException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link ChatSnapshotSource} backed by the service's REST API.
 */
public class RestChatSnapshotSource implements ChatSnapshotSource {

    private static final String USER_HEADER = "X-User-Id";

    private final RestClient restClient;

    public RestChatSnapshotSource(RestClient.Builder builder, String baseUrl, Long userId) {
        this.restClient = builder
                .baseUrl(baseUrl)
                .defaultHeader(USER_HEADER, String.valueOf(userId))
                .build();
    }

    @Override
    public List<CachedChat> fetchChats() {
        CachedChat[] chats = call("load chats", () -> restClient.get()
                .uri("/api/chats")
                .retrieve()
                .body(CachedChat[].class));
        return chats == null ? List.of() : Arrays.asList(chats);
    }

    @Override
    public List<CachedMessage> fetchMessages(Long chatId, int limit) {
        CachedMessage[] messages = call("load messages of chat " + chatId, () -> restClient.get()
                .uri("/api/chats/{chatId}/messages?limit={limit}", chatId, limit)
                .retrieve()
                .body(CachedMessage[].class));
        return messages == null ? List.of() : Arrays.asList(messages);
    }

    @Override
    public int fetchUnreadCount(Long chatId) {
        UnreadCountView view = call("load unread count of chat " + chatId, () -> restClient.get()
                .uri("/api/chats/{chatId}/unread-count", chatId)
                .retrieve()
                .body(UnreadCountView.class));
        return view == null ? 0 : view.unreadCount();
    }

    @Override
    public int markChatRead(Long chatId) {
        MarkReadView view = call("mark chat " + chatId + " read", () -> restClient.post()
                .uri("/api/chats/{chatId}/read", chatId)
                .retrieve()
                .body(MarkReadView.class));
        return view == null ? 0 : view.markedRead();
    }

    @Override
    public CachedMessage sendMessage(Long chatId, String content) {
        return call("send message to chat " + chatId, () -> restClient.post()
                .uri("/api/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("chatId", chatId, "content", content))
                .retrieve()
                .body(CachedMessage.class));
    }

    private <T> T call(String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientException ex) {
            throw new TransportException("Unable to " + action, ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UnreadCountView(Long chatId, Long userId, int unreadCount) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MarkReadView(Long chatId, int markedRead) {
    }
}
