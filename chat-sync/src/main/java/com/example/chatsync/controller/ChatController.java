package com.example.chatsync.controller;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.domain.Message;
import com.example.chatsync.dto.AddMemberRequest;
import com.example.chatsync.dto.CreateChatRequest;
import com.example.chatsync.dto.MarkChatReadResponse;
import com.example.chatsync.dto.StartChatRequest;
import com.example.chatsync.dto.UnreadCountResponse;
import com.example.chatsync.dto.UpdateChatRequest;
import com.example.chatsync.service.ChatService;
import com.example.chatsync.service.MessageService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/chats")
public class ChatController {

    static final String USER_HEADER = "X-User-Id";

    private final ChatService chatService;
    private final MessageService messageService;

    public ChatController(ChatService chatService, MessageService messageService) {
        this.chatService = chatService;
        this.messageService = messageService;
    }

    @PostMapping
    public ResponseEntity<Chat> createChat(
            @RequestHeader(USER_HEADER) Long userId, @Valid @RequestBody CreateChatRequest request) {
        Chat chat = chatService.createChat(userId, request.getName(), request.getMemberIds());
        return ResponseEntity.created(URI.create("/api/chats/" + chat.getId())).body(chat);
    }

    @GetMapping
    public ResponseEntity<List<Chat>> listChats(
            @RequestHeader(USER_HEADER) Long userId,
            @RequestParam(name = "name", required = false) String name,
            @RequestParam(name = "skip", required = false) Integer skip,
            @RequestParam(name = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(chatService.listChats(userId, name, skip, limit));
    }

    @PostMapping("/start")
    public ResponseEntity<Chat> startChat(
            @RequestHeader(USER_HEADER) Long userId, @Valid @RequestBody StartChatRequest request) {
        return ResponseEntity.ok(chatService.startDirectChat(userId, request.getOtherUserId()));
    }

    @GetMapping("/{chatId}")
    public ResponseEntity<Chat> getChat(@PathVariable Long chatId, @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(chatService.getChat(chatId, userId));
    }

    @PutMapping("/{chatId}")
    public ResponseEntity<Chat> renameChat(
            @PathVariable Long chatId,
            @RequestHeader(USER_HEADER) Long userId,
            @Valid @RequestBody UpdateChatRequest request) {
        return ResponseEntity.ok(chatService.renameChat(chatId, request.getName(), userId));
    }

    @DeleteMapping("/{chatId}")
    public ResponseEntity<Void> deleteChat(@PathVariable Long chatId, @RequestHeader(USER_HEADER) Long userId) {
        chatService.deleteChat(chatId, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{chatId}/members")
    public ResponseEntity<Chat> addMember(
            @PathVariable Long chatId,
            @RequestHeader(USER_HEADER) Long userId,
            @Valid @RequestBody AddMemberRequest request) {
        return ResponseEntity.ok(chatService.addMember(chatId, request.getUserId(), userId));
    }

    @DeleteMapping("/{chatId}/members/{memberId}")
    public ResponseEntity<Chat> removeMember(
            @PathVariable Long chatId, @PathVariable Long memberId, @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(chatService.removeMember(chatId, memberId, userId));
    }

    @GetMapping("/{chatId}/messages")
    public ResponseEntity<List<Message>> listMessages(
            @PathVariable Long chatId,
            @RequestHeader(USER_HEADER) Long userId,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "content", required = false) String content) {
        return ResponseEntity.ok(messageService.listMessages(userId, chatId, limit, content));
    }

    @GetMapping("/{chatId}/unread-count")
    public ResponseEntity<UnreadCountResponse> unreadCount(
            @PathVariable Long chatId, @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(UnreadCountResponse.builder()
                .chatId(chatId)
                .userId(userId)
                .unreadCount(chatService.unreadCount(chatId, userId))
                .build());
    }

    @GetMapping("/{chatId}/unread-counts")
    public ResponseEntity<Map<Long, Integer>> unreadCountsByMember(
            @PathVariable Long chatId, @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(chatService.unreadCountsByMember(chatId, userId));
    }

    @PostMapping("/{chatId}/read")
    public ResponseEntity<MarkChatReadResponse> markRead(
            @PathVariable Long chatId, @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(MarkChatReadResponse.builder()
                .chatId(chatId)
                .markedRead(messageService.markChatRead(userId, chatId))
                .build());
    }
}
