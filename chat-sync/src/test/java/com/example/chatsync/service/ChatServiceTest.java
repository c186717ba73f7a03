package com.example.chatsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.service.exception.AuthorizationException;
import com.example.chatsync.service.exception.NotFoundException;
import com.example.chatsync.service.exception.ValidationException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ChatServiceTest {

    private final ServiceFixture fixture = new ServiceFixture();
    private final ChatService service = fixture.chatService;

    @Test
    void creatorAlwaysBecomesMember() {
        Chat chat = service.createChat(1L, "  team  ", List.of(2L, 3L, 2L));

        assertEquals(1L, chat.getId());
        assertEquals("team", chat.getName());
        assertEquals(Set.of(1L, 2L, 3L), chat.getMemberIds());
        assertEquals(List.of("insert:Chat:1"), fixture.journal);
    }

    @Test
    void createRejectsBlankNameAndInvalidMembers() {
        assertThrows(ValidationException.class, () -> service.createChat(1L, " ", List.of()));
        assertThrows(ValidationException.class, () -> service.createChat(1L, "team", List.of(0L)));
        assertThrows(ValidationException.class, () -> service.createChat(null, "team", List.of()));
        assertTrue(fixture.journal.isEmpty());
    }

    @Test
    void missingChatAndNonMemberAreDistinguished() {
        when(fixture.repository.findChat(42L)).thenReturn(Optional.of(ServiceFixture.chat(42L, 1L, 2L)));
        when(fixture.repository.findChat(99L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.getChat(99L, 1L));
        assertThrows(AuthorizationException.class, () -> service.getChat(42L, 7L));
        assertEquals(42L, service.getChat(42L, 2L).getId());
    }

    @Test
    void addingExistingMemberChangesNothing() {
        Chat chat = ServiceFixture.chat(42L, 1L, 2L);
        when(fixture.repository.findChat(42L)).thenReturn(Optional.of(chat));

        assertSame(chat, service.addMember(42L, 2L, 1L));
        assertTrue(fixture.journal.isEmpty());

        service.addMember(42L, 3L, 1L);
        assertTrue(chat.hasMember(3L));
        assertEquals(List.of("update:Chat:42"), fixture.journal);
    }

    @Test
    void removingUnknownMemberIsNotFound() {
        Chat chat = ServiceFixture.chat(42L, 1L, 2L);
        when(fixture.repository.findChat(42L)).thenReturn(Optional.of(chat));

        assertThrows(NotFoundException.class, () -> service.removeMember(42L, 5L, 1L));

        service.removeMember(42L, 2L, 1L);
        assertFalse(chat.hasMember(2L));
    }

    @Test
    void unreadCountRequiresMembership() {
        when(fixture.repository.findChat(42L)).thenReturn(Optional.of(ServiceFixture.chat(42L, 1L, 2L)));
        when(fixture.repository.countUnread(42L, 2L)).thenReturn(4);

        assertEquals(4, service.unreadCount(42L, 2L));
        assertThrows(AuthorizationException.class, () -> service.unreadCount(42L, 3L));
    }

    @Test
    void listClampsPagingAndFallsBackToFullList() {
        service.listChats(1L, "team", 5, 10_000);
        verify(fixture.repository).findChatsForMember(1L, "team", 5, ChatService.MAX_LIST_LIMIT);

        service.listChats(1L, null, null, 0);
        verify(fixture.repository).findChatsForMember(1L, null, 0, ChatService.DEFAULT_LIST_LIMIT);

        service.listChats(1L, null, null, null);
        verify(fixture.repository).findChatsForMember(1L);

        assertThrows(ValidationException.class, () -> service.listChats(1L, null, -1, 10));
    }

    @Test
    void startDirectChatReusesExistingPair() {
        Chat existing = ServiceFixture.chat(42L, 3L, 1L);
        when(fixture.repository.findChatsForMember(1L)).thenReturn(List.of(ServiceFixture.chat(41L, 1L, 2L, 3L), existing));

        assertSame(existing, service.startDirectChat(1L, 3L));
        assertTrue(fixture.journal.isEmpty());

        Chat created = service.startDirectChat(1L, 2L);
        assertEquals(Set.of(1L, 2L), created.getMemberIds());
        assertEquals(List.of("insert:Chat:1"), fixture.journal);
        assertThrows(ValidationException.class, () -> service.startDirectChat(1L, 1L));
    }

    @Test
    void renameIsTrackedOnlyWhenNameChanges() {
        Chat chat = ServiceFixture.chat(42L, 1L, 2L);
        when(fixture.repository.findChat(42L)).thenReturn(Optional.of(chat));

        assertSame(chat, service.renameChat(42L, " chat 42 ", 1L));
        assertTrue(fixture.journal.isEmpty());

        assertEquals("planning", service.renameChat(42L, "planning", 2L).getName());
        assertEquals(List.of("update:Chat:42"), fixture.journal);
        assertThrows(ValidationException.class, () -> service.renameChat(42L, " ", 1L));
        assertThrows(AuthorizationException.class, () -> service.renameChat(42L, "x", 9L));
    }

    @Test
    void deleteRegistersChatDeleted() {
        when(fixture.repository.findChat(42L)).thenReturn(Optional.of(ServiceFixture.chat(42L, 1L, 2L)));

        assertThrows(AuthorizationException.class, () -> service.deleteChat(42L, 5L));
        service.deleteChat(42L, 2L);

        assertEquals(List.of("delete:Chat:42"), fixture.journal);
    }

    @Test
    void unreadCountsCoverEveryMember() {
        when(fixture.repository.findChat(42L)).thenReturn(Optional.of(ServiceFixture.chat(42L, 1L, 2L, 3L)));
        when(fixture.repository.countUnread(42L, 2L)).thenReturn(4);
        when(fixture.repository.countUnread(42L, 3L)).thenReturn(1);

        Map<Long, Integer> counts = service.unreadCountsByMember(42L, 1L);

        assertEquals(List.of(1L, 2L, 3L), List.copyOf(counts.keySet()));
        assertEquals(4, counts.get(2L));
        assertEquals(0, counts.get(1L));
    }
}
