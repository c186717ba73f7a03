package com.example.chatsync.event;

@FunctionalInterface
public interface DomainEventHandler<E extends DomainEvent> {

    void handle(E event);
}
