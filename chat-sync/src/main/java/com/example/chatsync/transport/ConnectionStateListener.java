package com.example.chatsync.transport;

@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called on every transition, never twice in a row with the same value.
     */
    void onConnectionStateChanged(boolean connected);
}
