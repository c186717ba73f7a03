package com.example.chatsync.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.chatsync.domain.Message;
import com.example.chatsync.domain.MessageStatus;
import com.example.chatsync.service.MessageService;
import com.example.chatsync.service.exception.ValidationException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class MessageControllerTest {

    private MessageService messageService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        messageService = mock(MessageService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new MessageController(messageService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void sendReturnsCreatedMessage() throws Exception {
        when(messageService.createMessage(1L, 42L, "hi")).thenReturn(Message.builder()
                .id(5L).chatId(42L).userId(1L).content("hi").createdAt(Instant.parse("2024-05-01T10:00:00Z")).build());

        mockMvc.perform(post("/api/messages")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chat_id\":42,\"content\":\"hi\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/messages/5"))
                .andExpect(jsonPath("$.content").value("hi"));
    }

    @Test
    void blankContentIsRejectedBeforeTheService() throws Exception {
        mockMvc.perform(post("/api/messages")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":42,\"content\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value(startsWith("content")));
    }

    @Test
    void statusAcceptsIsReadField() throws Exception {
        when(messageService.updateStatus(2L, 5L, true)).thenReturn(MessageStatus.builder()
                .id(11L).messageId(5L).chatId(42L).userId(2L).read(true).build());

        mockMvc.perform(put("/api/messages/5/status")
                        .header("X-User-Id", "2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isRead\":true}"))
                .andExpect(status().isOk());

        verify(messageService).updateStatus(2L, 5L, true);
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/messages/5/status")
                        .header("X-User-Id", "2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{isRead"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void editingDeletedMessageIsBadRequest() throws Exception {
        when(messageService.editMessage(1L, 5L, "again")).thenThrow(new ValidationException("Deleted messages cannot be edited"));

        mockMvc.perform(put("/api/messages/5")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"again\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void deleteReturnsPlaceholder() throws Exception {
        Message deleted = Message.builder().id(5L).chatId(42L).userId(1L).createdAt(Instant.now()).build();
        deleted.markDeleted(Instant.now());
        when(messageService.deleteMessage(1L, 5L)).thenReturn(deleted);

        mockMvc.perform(delete("/api/messages/5").header("X-User-Id", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true))
                .andExpect(jsonPath("$.content").value(Message.DELETED_PLACEHOLDER));
    }
}
