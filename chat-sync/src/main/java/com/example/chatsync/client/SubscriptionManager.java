package com.example.chatsync.client;

import com.example.chatsync.transport.ChannelListener;
import com.example.chatsync.transport.ConnectionStateListener;
import com.example.chatsync.transport.PubSubTransport;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the channel subscriptions of one consumer. The active channel set changes only through this
 * class.
 *
 * <p>The manager holds on to the shared transport while at least one channel is active. When the
 * transport reconnects, every active channel is subscribed again and resync listeners run so the
 * owner can pull whatever was missed while disconnected.
 */
@Slf4j
public class SubscriptionManager {

    private final PubSubTransport transport;
    private final Map<String, ChannelListener> active = new LinkedHashMap<>();
    private final List<Runnable> resyncListeners = new CopyOnWriteArrayList<>();
    private final List<ConnectionStateListener> connectionListeners = new CopyOnWriteArrayList<>();
    private final ConnectionStateListener transportListener = this::onConnectionStateChanged;

    private boolean retained;

    public SubscriptionManager(PubSubTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Activates {@code channel}. A channel that is already subscribed is left untouched.
     *
     * @return true if the channel was not subscribed before
     */
    public synchronized boolean subscribe(String channel, ChannelListener listener) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(listener, "listener");
        if (active.containsKey(channel)) {
            return false;
        }
        transport.subscribe(channel, listener);
        active.put(channel, listener);
        retainTransport();
        log.debug("Subscribed to {}", channel);
        return true;
    }

    /**
     * Deactivates {@code channel}. Messages already in flight may still arrive.
     *
     * @return true if the channel was subscribed
     */
    public synchronized boolean unsubscribe(String channel) {
        if (active.remove(channel) == null) {
            return false;
        }
        transport.unsubscribe(channel);
        if (active.isEmpty()) {
            releaseTransport();
        }
        log.debug("Unsubscribed from {}", channel);
        return true;
    }

    public synchronized void unsubscribeAll() {
        for (String channel : List.copyOf(active.keySet())) {
            unsubscribe(channel);
        }
    }

    public synchronized SubscriptionState state(String channel) {
        return active.containsKey(channel) ? SubscriptionState.SUBSCRIBED : SubscriptionState.UNSUBSCRIBED;
    }

    public synchronized Set<String> activeChannels() {
        return Set.copyOf(active.keySet());
    }

    public synchronized boolean isRetainingTransport() {
        return retained;
    }

    public void addResyncListener(Runnable listener) {
        if (listener != null) {
            resyncListeners.add(listener);
        }
    }

    public void removeResyncListener(Runnable listener) {
        resyncListeners.remove(listener);
    }

    /**
     * Listeners told about connectivity transitions after the manager handled them.
     */
    public void addConnectionListener(ConnectionStateListener listener) {
        if (listener != null) {
            connectionListeners.add(listener);
        }
    }

    void onConnectionStateChanged(boolean connected) {
        if (connected) {
            int resubscribed = resubscribeAll();
            log.info("Transport reconnected, resubscribed {} channels", resubscribed);
        } else {
            log.warn("Transport disconnected, live updates paused");
        }
        for (ConnectionStateListener listener : connectionListeners) {
            try {
                listener.onConnectionStateChanged(connected);
            } catch (RuntimeException ex) {
                log.warn("Connection listener {} failed", listener, ex);
            }
        }
        if (connected) {
            for (Runnable listener : resyncListeners) {
                try {
                    listener.run();
                } catch (RuntimeException ex) {
                    log.error("Resync after reconnect failed", ex);
                }
            }
        }
    }

    private synchronized int resubscribeAll() {
        int count = 0;
        for (Map.Entry<String, ChannelListener> entry : active.entrySet()) {
            try {
                transport.subscribe(entry.getKey(), entry.getValue());
                count++;
            } catch (RuntimeException ex) {
                log.warn("Unable to resubscribe to {}", entry.getKey(), ex);
            }
        }
        return count;
    }

    private void retainTransport() {
        if (!retained) {
            transport.addConnectionListener(transportListener);
            retained = true;
        }
    }

    private void releaseTransport() {
        if (retained) {
            transport.removeConnectionListener(transportListener);
            retained = false;
        }
    }
}
