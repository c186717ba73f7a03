package com.example.chatsync.client;

public enum SubscriptionState {
    UNSUBSCRIBED,
    SUBSCRIBED
}
