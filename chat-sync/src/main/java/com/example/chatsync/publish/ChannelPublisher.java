package com.example.chatsync.publish;

import com.example.chatsync.config.ChatSyncProperties;
import com.example.chatsync.event.DomainEvent;
import com.example.chatsync.transport.PubSubTransport;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Publishes committed domain events to their channels. Never throws: a failed publish is queued for
 * retry or dropped, and the committed write it describes stays committed.
 *
 * <p>Delivery order per channel is the publish order. While a channel has queued entries, new
 * payloads for it are queued behind them instead of being sent ahead.
 */
@Slf4j
@Component
public class ChannelPublisher {

    private final PubSubTransport transport;
    private final EventWireCodec codec;
    private final PublishRetryQueue retryQueue;
    private final Duration timeout;
    private final int maxAttempts;
    private final Lock[] channelLocks = new Lock[64];

    public ChannelPublisher(
            PubSubTransport transport,
            EventWireCodec codec,
            PublishRetryQueue retryQueue,
            ChatSyncProperties properties) {
        this.transport = transport;
        this.codec = codec;
        this.retryQueue = retryQueue;
        this.timeout = properties.getPublish().getTimeout();
        this.maxAttempts = properties.getPublish().getRetry().getMaxAttempts();
        for (int i = 0; i < channelLocks.length; i++) {
            channelLocks[i] = new ReentrantLock();
        }
    }

    public PublishResult publish(DomainEvent event) {
        String channel;
        byte[] payload;
        try {
            channel = ChannelNames.forEvent(event);
            payload = codec.encode(event);
        } catch (RuntimeException ex) {
            log.error("Dropping {} for chat {}: cannot encode", event.kind(), event.chatId(), ex);
            return PublishResult.DROPPED;
        }
        return publish(channel, payload);
    }

    public PublishResult publish(String channel, byte[] payload) {
        Lock lock = lockFor(channel);
        lock.lock();
        try {
            if (retryQueue.hasPending(channel)) {
                return enqueueRetry(new PendingPublish(channel, payload, 0));
            }
            if (attempt(channel, payload)) {
                return PublishResult.PUBLISHED;
            }
            return enqueueRetry(new PendingPublish(channel, payload, 1));
        } finally {
            lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${chat.publish.retry.interval:PT5S}').toMillis()}")
    public void retryPending() {
        int delivered = 0;
        for (String channel : retryQueue.channels()) {
            Lock lock = lockFor(channel);
            lock.lock();
            try {
                delivered += retryChannel(channel);
            } finally {
                lock.unlock();
            }
        }
        if (delivered > 0) {
            log.debug("Delivered {} queued publishes, {} still pending", delivered, retryQueue.size());
        }
    }

    /**
     * Sends queued entries of one channel head first and stops at the first one that fails again.
     */
    private int retryChannel(String channel) {
        int delivered = 0;
        Optional<PendingPublish> head = retryQueue.peek(channel);
        while (head.isPresent()) {
            PendingPublish pending = head.get();
            if (attempt(channel, pending.payload())) {
                retryQueue.removeHead(channel);
                delivered++;
            } else {
                PendingPublish next = pending.nextAttempt();
                if (next.attempts() < maxAttempts) {
                    retryQueue.replaceHead(channel, next);
                    return delivered;
                }
                log.warn("Dropping publish to {} after {} attempts", channel, next.attempts());
                retryQueue.removeHead(channel);
            }
            head = retryQueue.peek(channel);
        }
        return delivered;
    }

    private PublishResult enqueueRetry(PendingPublish pending) {
        if (pending.attempts() >= maxAttempts) {
            log.warn("Dropping publish to {} after {} attempts", pending.channel(), pending.attempts());
            return PublishResult.DROPPED;
        }
        if (!retryQueue.offer(pending)) {
            log.warn("Retry queue full, dropping publish to {}", pending.channel());
            return PublishResult.DROPPED;
        }
        return PublishResult.RETRY_QUEUED;
    }

    private Lock lockFor(String channel) {
        return channelLocks[Math.floorMod(channel.hashCode(), channelLocks.length)];
    }

    private boolean attempt(String channel, byte[] payload) {
        try {
            transport.publish(channel, payload).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException ex) {
            log.warn("Publish to {} timed out after {}", channel, timeout);
        } catch (ExecutionException ex) {
            log.warn("Publish to {} failed", channel, ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing to {}", channel);
        } catch (RuntimeException ex) {
            log.warn("Publish to {} failed", channel, ex);
        }
        return false;
    }
}
