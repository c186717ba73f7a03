package com.example.chatsync.transport;

@FunctionalInterface
public interface ChannelListener {

    void onMessage(String channel, byte[] payload);
}
