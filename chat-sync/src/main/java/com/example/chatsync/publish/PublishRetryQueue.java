package com.example.chatsync.publish;

import com.example.chatsync.config.ChatSyncProperties;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Bounded holding area for publishes that could not go out yet, kept in FIFO order per channel.
 * The capacity counts entries across all channels; when full, new entries are rejected.
 */
@Component
public class PublishRetryQueue {

    private final int capacity;
    private final Map<String, Deque<PendingPublish>> byChannel = new LinkedHashMap<>();
    private int size;

    public PublishRetryQueue(ChatSyncProperties properties) {
        this(properties.getPublish().getRetry().getCapacity());
    }

    PublishRetryQueue(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized boolean offer(PendingPublish publish) {
        if (size >= capacity) {
            return false;
        }
        byChannel.computeIfAbsent(publish.channel(), ignored -> new ArrayDeque<>()).addLast(publish);
        size++;
        return true;
    }

    public synchronized boolean hasPending(String channel) {
        return byChannel.containsKey(channel);
    }

    public synchronized List<String> channels() {
        return new ArrayList<>(byChannel.keySet());
    }

    public synchronized Optional<PendingPublish> peek(String channel) {
        Deque<PendingPublish> queue = byChannel.get(channel);
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.peekFirst());
    }

    public synchronized void removeHead(String channel) {
        Deque<PendingPublish> queue = byChannel.get(channel);
        if (queue == null || queue.pollFirst() == null) {
            return;
        }
        size--;
        if (queue.isEmpty()) {
            byChannel.remove(channel);
        }
    }

    public synchronized void replaceHead(String channel, PendingPublish head) {
        Deque<PendingPublish> queue = byChannel.get(channel);
        if (queue != null && !queue.isEmpty()) {
            queue.pollFirst();
            queue.addFirst(head);
        }
    }

    public synchronized int size() {
        return size;
    }

    public synchronized int size(String channel) {
        Deque<PendingPublish> queue = byChannel.get(channel);
        return queue == null ? 0 : queue.size();
    }
}
