package com.example.chatsync.publish;

import com.example.chatsync.event.DomainEventDispatcher;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes every dispatched domain event to its channel.
 */
@Component
@RequiredArgsConstructor
public class ChannelPublishingRegistrar {

    private final DomainEventDispatcher dispatcher;
    private final ChannelPublisher publisher;

    @PostConstruct
    public void register() {
        dispatcher.registerForAll(publisher::publish);
    }
}
