package com.example.chatsync.publish;

/**
 * A payload waiting for delivery, with the number of attempts made so far. Zero attempts means it
 * was queued behind earlier failures on the same channel without being tried.
 */
public record PendingPublish(String channel, byte[] payload, int attempts) {

    public PendingPublish nextAttempt() {
        return new PendingPublish(channel, payload, attempts + 1);
    }
}
