package com.example.chatsync.client;

@FunctionalInterface
public interface StoreObserver {

    void onStoreEvent(StoreEvent event);
}
