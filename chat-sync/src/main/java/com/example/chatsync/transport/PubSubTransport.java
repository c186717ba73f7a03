package com.example.chatsync.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Topic based broker connection shared by every producer and consumer of one process.
 *
 * <p>Delivery is at most once while connected and ordered within a channel only.
 */
public interface PubSubTransport {

    /**
     * Publishes raw bytes to {@code channel}. The future completes when the broker accepted the
     * payload and fails with the broker error otherwise. Callers bound the wait themselves.
     */
    CompletableFuture<Void> publish(String channel, byte[] payload);

    /**
     * Registers {@code listener} as the only listener of {@code channel}, replacing a previous one.
     */
    void subscribe(String channel, ChannelListener listener);

    void unsubscribe(String channel);

    boolean isConnected();

    void addConnectionListener(ConnectionStateListener listener);

    void removeConnectionListener(ConnectionStateListener listener);
}
