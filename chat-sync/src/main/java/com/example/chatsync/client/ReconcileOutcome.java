package com.example.chatsync.client;

public enum ReconcileOutcome {
    INSERTED,
    UPDATED,
    /**
     * Own message not yet in the cache: it was added optimistically when sent.
     */
    SKIPPED_OWN,
    IGNORED
}
