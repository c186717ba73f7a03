package com.example.chatsync.transport;

import com.example.chatsync.service.exception.TransportException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.client.codec.ByteArrayCodec;
import org.springframework.stereotype.Component;

/**
 * Redis pub/sub through Redisson topics. Payloads travel as raw bytes; encoding is the caller's
 * concern.
 */
@Slf4j
@Component
public class RedissonPubSubTransport extends AbstractPubSubTransport {

    private final RedissonClient redissonClient;
    private final Map<String, Integer> listenerIds = new ConcurrentHashMap<>();

    public RedissonPubSubTransport(RedissonClient redissonClient) {
        super(true);
        this.redissonClient = redissonClient;
    }

    @Override
    public CompletableFuture<Void> publish(String channel, byte[] payload) {
        try {
            return topic(channel).publishAsync(payload)
                    .toCompletableFuture()
                    .thenAccept(receivers -> log.trace("Published to {} ({} receivers)", channel, receivers));
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(new TransportException("Unable to publish to " + channel, ex));
        }
    }

    @Override
    public void subscribe(String channel, ChannelListener listener) {
        RTopic topic = topic(channel);
        Integer previous = listenerIds.remove(channel);
        if (previous != null) {
            topic.removeListener(previous);
        }
        try {
            int id = topic.addListener(byte[].class, (source, payload) -> listener.onMessage(channel, payload));
            listenerIds.put(channel, id);
        } catch (RuntimeException ex) {
            throw new TransportException("Unable to subscribe to " + channel, ex);
        }
    }

    @Override
    public void unsubscribe(String channel) {
        Integer id = listenerIds.remove(channel);
        if (id == null) {
            return;
        }
        try {
            topic(channel).removeListener(id);
        } catch (RuntimeException ex) {
            log.warn("Unable to remove listener from {}", channel, ex);
        }
    }

    /**
     * Pings the broker and records the outcome.
     *
     * @return true if every node answered
     */
    public boolean checkReachable() {
        boolean reachable;
        try {
            reachable = redissonClient.getRedisNodes(RedisNodes.SINGLE).pingAll();
        } catch (RuntimeException ex) {
            log.debug("Broker ping failed", ex);
            reachable = false;
        }
        updateConnectionState(reachable);
        return reachable;
    }

    int activeListenerCount() {
        return listenerIds.size();
    }

    private RTopic topic(String channel) {
        return redissonClient.getTopic(channel, ByteArrayCodec.INSTANCE);
    }
}
