package com.example.chatsync.controller;

import com.example.chatsync.domain.Message;
import com.example.chatsync.domain.MessageStatus;
import com.example.chatsync.dto.EditMessageRequest;
import com.example.chatsync.dto.MessageStatusRequest;
import com.example.chatsync.dto.SendMessageRequest;
import com.example.chatsync.service.MessageService;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    @PostMapping
    public ResponseEntity<Message> sendMessage(
            @RequestHeader(ChatController.USER_HEADER) Long userId, @Valid @RequestBody SendMessageRequest request) {
        Message message = messageService.createMessage(userId, request.getChatId(), request.getContent());
        return ResponseEntity.created(URI.create("/api/messages/" + message.getId())).body(message);
    }

    @GetMapping("/{messageId}")
    public ResponseEntity<Message> getMessage(
            @PathVariable Long messageId, @RequestHeader(ChatController.USER_HEADER) Long userId) {
        return ResponseEntity.ok(messageService.getMessage(userId, messageId));
    }

    @PutMapping("/{messageId}")
    public ResponseEntity<Message> editMessage(
            @PathVariable Long messageId,
            @RequestHeader(ChatController.USER_HEADER) Long userId,
            @Valid @RequestBody EditMessageRequest request) {
        return ResponseEntity.ok(messageService.editMessage(userId, messageId, request.getContent()));
    }

    @DeleteMapping("/{messageId}")
    public ResponseEntity<Message> deleteMessage(
            @PathVariable Long messageId, @RequestHeader(ChatController.USER_HEADER) Long userId) {
        return ResponseEntity.ok(messageService.deleteMessage(userId, messageId));
    }

    @PutMapping("/{messageId}/status")
    public ResponseEntity<MessageStatus> updateStatus(
            @PathVariable Long messageId,
            @RequestHeader(ChatController.USER_HEADER) Long userId,
            @Valid @RequestBody MessageStatusRequest request) {
        return ResponseEntity.ok(messageService.updateStatus(userId, messageId, request.getRead()));
    }
}
