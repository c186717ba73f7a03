package com.example.chatsync.publish;

public enum PublishResult {
    PUBLISHED,
    RETRY_QUEUED,
    DROPPED
}
