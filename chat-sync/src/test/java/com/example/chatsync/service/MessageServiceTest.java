package com.example.chatsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.chatsync.domain.Message;
import com.example.chatsync.domain.MessageStatus;
import com.example.chatsync.event.MessageCreated;
import com.example.chatsync.event.MessageDeleted;
import com.example.chatsync.event.MessageStatusUpdated;
import com.example.chatsync.event.MessageUpdated;
import com.example.chatsync.event.UnreadCountUpdated;
import com.example.chatsync.service.exception.AuthorizationException;
import com.example.chatsync.service.exception.NotFoundException;
import com.example.chatsync.service.exception.ValidationException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageServiceTest {

    private final ServiceFixture fixture = new ServiceFixture();
    private final MessageService service = fixture.messageService;

    @BeforeEach
    void setUp() {
        when(fixture.repository.findChat(42L)).thenReturn(Optional.of(ServiceFixture.chat(42L, 1L, 2L, 3L)));
    }

    @Test
    void createStoresMessageWithOneStatusPerMember() {
        when(fixture.repository.countUnread(42L, 2L)).thenReturn(1);
        when(fixture.repository.countUnread(42L, 3L)).thenReturn(5);

        Message message = service.createMessage(1L, 42L, "hi");

        assertEquals(1L, message.getId());
        assertEquals("insert:Message:1", fixture.journal.get(0));
        assertEquals(3, fixture.statuses.rows().size());
        MessageStatus authorStatus = fixture.statuses.rows().stream()
                .filter(status -> status.getUserId().equals(1L))
                .findFirst()
                .orElseThrow();
        assertTrue(authorStatus.isRead());
        assertEquals(1L, authorStatus.getMessageId());
    }

    @Test
    void createRaisesMessageThenUnreadCountsOfOtherMembers() {
        when(fixture.repository.countUnread(42L, 2L)).thenReturn(1);
        when(fixture.repository.countUnread(42L, 3L)).thenReturn(5);

        service.createMessage(1L, 42L, "hi");

        assertEquals(MessageCreated.class, fixture.events.get(0).getClass());
        List<UnreadCountUpdated> unread = fixture.eventsOf(UnreadCountUpdated.class);
        assertEquals(List.of(2L, 3L), unread.stream().map(UnreadCountUpdated::userId).toList());
        assertEquals(List.of(1, 5), unread.stream().map(UnreadCountUpdated::unreadCount).toList());
    }

    @Test
    void createValidatesContentAndMembership() {
        fixture.properties.getMessages().setMaxContentLength(5);

        assertThrows(ValidationException.class, () -> service.createMessage(1L, 42L, "   "));
        assertThrows(ValidationException.class, () -> service.createMessage(1L, 42L, "too long"));
        assertThrows(AuthorizationException.class, () -> service.createMessage(9L, 42L, "hi"));
        assertTrue(fixture.events.isEmpty());
    }

    @Test
    void failedCommitRaisesNothing() {
        fixture.statuses.failOn("insert");

        assertThrows(RuntimeException.class, () -> service.createMessage(1L, 42L, "hi"));

        assertTrue(fixture.events.isEmpty());
    }

    @Test
    void onlyTheAuthorMayEdit() {
        Message message = stored(7L, 1L);
        when(fixture.repository.findMessage(7L)).thenReturn(Optional.of(message));

        assertThrows(AuthorizationException.class, () -> service.editMessage(2L, 7L, "hijacked"));

        service.editMessage(1L, 7L, "fixed typo");
        assertEquals("fixed typo", message.getContent());
        MessageUpdated updated = fixture.eventsOf(MessageUpdated.class).get(0);
        assertEquals("fixed typo", updated.content());
    }

    @Test
    void deleteIsSoftAndIdempotent() {
        Message message = stored(7L, 1L);
        when(fixture.repository.findMessage(7L)).thenReturn(Optional.of(message));

        service.deleteMessage(1L, 7L);
        service.deleteMessage(1L, 7L);

        assertTrue(message.isDeleted());
        assertEquals(Message.DELETED_PLACEHOLDER, message.getContent());
        assertEquals(1, fixture.eventsOf(MessageDeleted.class).size());
        assertEquals(2, fixture.eventsOf(UnreadCountUpdated.class).size());
        assertThrows(ValidationException.class, () -> service.editMessage(1L, 7L, "revive"));
    }

    @Test
    void readingAMessageRaisesStatusAndUnreadCount() {
        when(fixture.repository.findMessage(7L)).thenReturn(Optional.of(stored(7L, 1L)));
        MessageStatus status = unreadStatus(11L, 7L, 2L);
        when(fixture.repository.findStatus(7L, 2L)).thenReturn(Optional.of(status));
        when(fixture.repository.countUnread(42L, 2L)).thenReturn(0);

        service.updateStatus(2L, 7L, true);

        assertTrue(status.isRead());
        MessageStatusUpdated statusEvent = fixture.eventsOf(MessageStatusUpdated.class).get(0);
        assertEquals(2L, statusEvent.userId());
        assertEquals(0, fixture.eventsOf(UnreadCountUpdated.class).get(0).unreadCount());
    }

    @Test
    void unchangedReadStateRaisesNothing() {
        when(fixture.repository.findMessage(7L)).thenReturn(Optional.of(stored(7L, 1L)));
        when(fixture.repository.findStatus(7L, 2L)).thenReturn(Optional.of(unreadStatus(11L, 7L, 2L)));

        service.updateStatus(2L, 7L, false);

        assertTrue(fixture.events.isEmpty());
        verify(fixture.repository, never()).countUnread(42L, 2L);
    }

    @Test
    void missingStatusIsNotFound() {
        when(fixture.repository.findMessage(7L)).thenReturn(Optional.of(stored(7L, 1L)));
        when(fixture.repository.findStatus(7L, 2L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.updateStatus(2L, 7L, true));
    }

    @Test
    void markChatReadUpdatesEveryUnreadStatus() {
        when(fixture.repository.findUnreadStatuses(42L, 2L))
                .thenReturn(List.of(unreadStatus(11L, 7L, 2L), unreadStatus(12L, 8L, 2L)));

        int marked = service.markChatRead(2L, 42L);

        assertEquals(2, marked);
        assertEquals(List.of("update:MessageStatus:11", "update:MessageStatus:12"), fixture.journal);
        assertEquals(2, fixture.eventsOf(MessageStatusUpdated.class).size());
        assertEquals(1, fixture.eventsOf(UnreadCountUpdated.class).size());
    }

    @Test
    void listingClampsLimitAndSearchesByContent() {
        fixture.properties.getMessages().setMaxPageSize(50);

        service.listMessages(2L, 42L, 500, null);
        service.listMessages(2L, 42L, null, "lunch");

        verify(fixture.repository).findRecentMessages(42L, 50);
        verify(fixture.repository).searchMessages(42L, "lunch", 100);
        assertThrows(ValidationException.class, () -> service.listMessages(2L, 42L, 0, null));
    }

    private static Message stored(Long id, Long authorId) {
        return Message.builder()
                .id(id)
                .chatId(42L)
                .userId(authorId)
                .content("original")
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    private static MessageStatus unreadStatus(Long id, Long messageId, Long userId) {
        return MessageStatus.builder().id(id).messageId(messageId).chatId(42L).userId(userId).build();
    }
}
