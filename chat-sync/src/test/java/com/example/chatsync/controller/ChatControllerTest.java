package com.example.chatsync.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.service.ChatService;
import com.example.chatsync.service.MessageService;
import com.example.chatsync.service.exception.AuthorizationException;
import com.example.chatsync.service.exception.NotFoundException;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ChatControllerTest {

    private ChatService chatService;
    private MessageService messageService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        chatService = mock(ChatService.class);
        messageService = mock(MessageService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(chatService, messageService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void createReturnsLocationOfNewChat() throws Exception {
        Chat chat = Chat.builder().id(42L).name("team").memberIds(new LinkedHashSet<>(List.of(1L, 2L))).build();
        when(chatService.createChat(eq(1L), eq("team"), any())).thenReturn(chat);

        mockMvc.perform(post("/api/chats")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"team\",\"member_ids\":[2]}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/chats/42"))
                .andExpect(jsonPath("$.memberIds.length()").value(2));
    }

    @Test
    void blankNameIsRejected() throws Exception {
        mockMvc.perform(post("/api/chats")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void missingUserHeaderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/chats"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void serviceErrorsMapToTheirStatus() throws Exception {
        when(chatService.getChat(99L, 1L)).thenThrow(new NotFoundException("Chat 99 not found"));
        when(chatService.getChat(42L, 7L)).thenThrow(new AuthorizationException("User 7 is not a member of chat 42"));

        mockMvc.perform(get("/api/chats/99").header("X-User-Id", "1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"))
                .andExpect(jsonPath("$.error").value("Chat 99 not found"));
        mockMvc.perform(get("/api/chats/42").header("X-User-Id", "7"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("forbidden"));
    }

    @Test
    void unreadCountIsReportedForCaller() throws Exception {
        when(chatService.unreadCount(42L, 2L)).thenReturn(3);

        mockMvc.perform(get("/api/chats/42/unread-count").header("X-User-Id", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chatId").value(42))
                .andExpect(jsonPath("$.unreadCount").value(3));
    }

    @Test
    void markReadReturnsNumberMarked() throws Exception {
        when(messageService.markChatRead(2L, 42L)).thenReturn(4);

        mockMvc.perform(post("/api/chats/42/read").header("X-User-Id", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.markedRead").value(4));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(chatService.listChats(1L, null, null, null)).thenThrow(new IllegalStateException("db down"));

        mockMvc.perform(get("/api/chats").header("X-User-Id", "1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("internal_error"));
    }

    @Test
    void listPassesFilterAndPaging() throws Exception {
        when(chatService.listChats(1L, "team", 10, 5)).thenReturn(List.of(
                Chat.builder().id(42L).name("team").memberIds(new LinkedHashSet<>(List.of(1L))).build()));

        mockMvc.perform(get("/api/chats")
                        .header("X-User-Id", "1")
                        .param("name", "team")
                        .param("skip", "10")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(42));
    }

    @Test
    void startChatAcceptsSnakeCaseBody() throws Exception {
        Chat direct = Chat.builder().id(50L).name("direct").memberIds(new LinkedHashSet<>(List.of(1L, 3L))).build();
        when(chatService.startDirectChat(1L, 3L)).thenReturn(direct);

        mockMvc.perform(post("/api/chats/start")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"other_user_id\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(50));
        mockMvc.perform(post("/api/chats/start")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void renameAndDelete() throws Exception {
        when(chatService.renameChat(42L, "renamed", 1L)).thenReturn(
                Chat.builder().id(42L).name("renamed").memberIds(new LinkedHashSet<>(List.of(1L))).build());

        mockMvc.perform(put("/api/chats/42")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"renamed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("renamed"));
        mockMvc.perform(delete("/api/chats/42").header("X-User-Id", "1"))
                .andExpect(status().isNoContent());

        verify(chatService).deleteChat(42L, 1L);
    }

    @Test
    void unreadCountsAreKeyedByMember() throws Exception {
        Map<Long, Integer> counts = new LinkedHashMap<>();
        counts.put(1L, 0);
        counts.put(2L, 4);
        when(chatService.unreadCountsByMember(42L, 1L)).thenReturn(counts);

        mockMvc.perform(get("/api/chats/42/unread-counts").header("X-User-Id", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['2']").value(4));
    }
}
