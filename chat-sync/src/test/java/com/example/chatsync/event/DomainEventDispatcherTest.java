package com.example.chatsync.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DomainEventDispatcherTest {

    private final DomainEventDispatcher dispatcher = new DomainEventDispatcher();

    @Test
    void handlersRunInRegistrationOrderEvenWhenOneFails() {
        List<String> calls = new ArrayList<>();
        dispatcher.register(MessageCreated.class, event -> {
            calls.add("h1");
            throw new IllegalStateException("boom");
        });
        dispatcher.register(MessageCreated.class, event -> calls.add("h2"));

        int failures = dispatcher.dispatch(created());

        assertEquals(List.of("h1", "h2"), calls);
        assertEquals(1, failures);
    }

    @Test
    void handlersOnlySeeTheirOwnKind() {
        List<DomainEvent> statusEvents = new ArrayList<>();
        dispatcher.register(MessageStatusUpdated.class, statusEvents::add);

        dispatcher.dispatch(created());
        dispatcher.dispatch(new MessageStatusUpdated(1L, 42L, 7L, true, Instant.now(), Instant.now()));

        assertEquals(1, statusEvents.size());
        assertEquals(DomainEventKind.MESSAGE_STATUS_UPDATED, statusEvents.get(0).kind());
    }

    @Test
    void sameHandlerRegisteredTwiceRunsTwice() {
        List<DomainEvent> seen = new ArrayList<>();
        DomainEventHandler<UnreadCountUpdated> handler = seen::add;
        dispatcher.register(UnreadCountUpdated.class, handler);
        dispatcher.register(UnreadCountUpdated.class, handler);

        dispatcher.dispatch(new UnreadCountUpdated(42L, 7L, 3, Instant.now()));

        assertEquals(2, seen.size());
    }

    @Test
    void registerForAllCoversEveryKind() {
        dispatcher.registerForAll(event -> { });

        for (DomainEventKind kind : DomainEventKind.values()) {
            assertEquals(1, dispatcher.handlerCount(kind));
        }
    }

    @Test
    void dispatchWithoutHandlersIsHarmless() {
        assertEquals(0, dispatcher.dispatch(created()));
    }

    @Test
    void eventsRejectMissingRequiredFields() {
        assertThrows(NullPointerException.class, () -> new MessageCreated(null, 42L, 7L, "hi", Instant.now(), false));
        assertThrows(NullPointerException.class, () -> new MessageUpdated(1L, 42L, 7L, "hi", Instant.now(), null, false));
        assertThrows(NullPointerException.class, () -> new UnreadCountUpdated(42L, null, 0, Instant.now()));
        assertThrows(IllegalArgumentException.class, () -> new UnreadCountUpdated(42L, 7L, -1, Instant.now()));
    }

    @Test
    void deletedEventFallsBackToPlaceholderContent() {
        MessageDeleted deleted = new MessageDeleted(1L, 42L, 7L, null, Instant.now(), null);

        assertEquals("<This message has been deleted>", deleted.content());
        assertTrue(deleted.deleted());
    }

    private static MessageCreated created() {
        return new MessageCreated(1L, 42L, 7L, "hi", Instant.now(), false);
    }
}
