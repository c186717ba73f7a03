package com.example.chatsync.transport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Connection state bookkeeping shared by transports: remembers the last known state and notifies
 * listeners on transitions only.
 */
@Slf4j
public abstract class AbstractPubSubTransport implements PubSubTransport {

    private final List<ConnectionStateListener> connectionListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean connected;

    protected AbstractPubSubTransport(boolean initiallyConnected) {
        this.connected = new AtomicBoolean(initiallyConnected);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public void addConnectionListener(ConnectionStateListener listener) {
        if (listener != null) {
            connectionListeners.add(listener);
        }
    }

    @Override
    public void removeConnectionListener(ConnectionStateListener listener) {
        connectionListeners.remove(listener);
    }

    /**
     * Records the observed state and notifies listeners if it differs from the previous one.
     *
     * @return true if the state changed
     */
    public boolean updateConnectionState(boolean nowConnected) {
        if (connected.getAndSet(nowConnected) == nowConnected) {
            return false;
        }
        log.info("Pub/sub transport {}", nowConnected ? "reconnected" : "disconnected");
        for (ConnectionStateListener listener : connectionListeners) {
            try {
                listener.onConnectionStateChanged(nowConnected);
            } catch (RuntimeException ex) {
                log.warn("Connection listener {} failed", listener, ex);
            }
        }
        return true;
    }
}
