package com.example.chatsync.event;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Typed handler registry per event kind. Handlers of one kind run sequentially in registration
 * order, so events reach a channel in commit order.
 */
@Slf4j
@Component
public class DomainEventDispatcher {

    private final Map<DomainEventKind, List<DomainEventHandler<DomainEvent>>> handlers =
            new EnumMap<>(DomainEventKind.class);

    public DomainEventDispatcher() {
        for (DomainEventKind kind : DomainEventKind.values()) {
            handlers.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Registers {@code handler} for events of {@code eventType}. The same handler registered twice
     * is invoked twice.
     */
    @SuppressWarnings("unchecked")
    public <E extends DomainEvent> void register(Class<E> eventType, DomainEventHandler<? super E> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler is required");
        }
        handlers.get(DomainEventKind.of(eventType)).add((DomainEventHandler<DomainEvent>) handler);
    }

    public void registerForAll(DomainEventHandler<DomainEvent> handler) {
        for (DomainEventKind kind : DomainEventKind.values()) {
            register(kind.eventType(), handler);
        }
    }

    /**
     * Invokes every handler registered for the event's kind. A failing handler is logged and
     * skipped; the remaining handlers still run.
     *
     * @return number of handlers that failed
     */
    public int dispatch(DomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event is required");
        }
        int failures = 0;
        for (DomainEventHandler<DomainEvent> handler : handlers.get(event.kind())) {
            try {
                handler.handle(event);
            } catch (RuntimeException ex) {
                failures++;
                log.error("Handler {} failed for {} in chat {}", handler, event.kind(), event.chatId(), ex);
            }
        }
        return failures;
    }

    public int handlerCount(DomainEventKind kind) {
        return handlers.get(kind).size();
    }
}
