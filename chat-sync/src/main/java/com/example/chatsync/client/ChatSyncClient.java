package com.example.chatsync.client;

import com.example.chatsync.event.DomainEvent;
import com.example.chatsync.event.MessageStatusUpdated;
import com.example.chatsync.event.UnreadCountUpdated;
import com.example.chatsync.publish.ChannelNames;
import com.example.chatsync.publish.EventWireCodec;
import com.example.chatsync.transport.PubSubTransport;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

/**
 * Keeps one user's {@link ClientStateStore} in sync with the server.
 *
 * <p>On login it loads chats and unread counts and listens to the unread channel of every chat.
 * The open chat additionally gets its message and read receipt channels. After a reconnect
 * everything is pulled again, since pushes sent while disconnected are lost.
 */
@Slf4j
public class ChatSyncClient implements AutoCloseable {

    private static final int DEFAULT_PAGE_SIZE = 100;

    private final ClientStateStore store;
    private final SubscriptionManager subscriptions;
    private final ChatSnapshotSource snapshotSource;
    private final ReadMarkingQueue readMarking;
    private final EventWireCodec codec;
    private final int pageSize;

    public ChatSyncClient(
            ClientStateStore store,
            SubscriptionManager subscriptions,
            ChatSnapshotSource snapshotSource,
            ReadMarkingQueue readMarking,
            EventWireCodec codec,
            int pageSize) {
        this.store = store;
        this.subscriptions = subscriptions;
        this.snapshotSource = snapshotSource;
        this.readMarking = readMarking;
        this.codec = codec;
        this.pageSize = pageSize > 0 ? pageSize : DEFAULT_PAGE_SIZE;
        subscriptions.addConnectionListener(store::setConnectionStatus);
        subscriptions.addResyncListener(this::resync);
    }

    /**
     * Wires a client against the REST API at {@code baseUrl} and the given transport.
     */
    public static ChatSyncClient create(
            PubSubTransport transport, RestClient.Builder restClientBuilder, String baseUrl, Long userId, Executor uiExecutor) {
        ChatSnapshotSource source = new RestChatSnapshotSource(restClientBuilder, baseUrl, userId);
        return new ChatSyncClient(
                new ClientStateStore(uiExecutor),
                new SubscriptionManager(transport),
                source,
                new ReadMarkingQueue(source),
                EventWireCodec.standalone(),
                DEFAULT_PAGE_SIZE);
    }

    public ClientStateStore store() {
        return store;
    }

    public SubscriptionManager subscriptions() {
        return subscriptions;
    }

    public void login(ChatUser user) {
        store.setCurrentUser(user);
        loadChats();
    }

    public void logout() {
        subscriptions.unsubscribeAll();
        store.clearAll();
    }

    /**
     * Makes {@code chatId} the open chat: its message and receipt channels become active and its
     * recent messages are pulled. The previously open chat loses those channels.
     */
    public void openChat(Long chatId) {
        Optional<Long> previous = store.currentChatId();
        if (previous.isPresent() && previous.get().equals(chatId)) {
            return;
        }
        previous.ifPresent(this::deactivateChatChannels);
        subscriptions.subscribe(ChannelNames.chat(chatId), this::onChannelMessage);
        subscriptions.subscribe(ChannelNames.status(chatId), this::onChannelMessage);
        store.setCurrentChat(chatId);
        pullMessages(chatId);
    }

    public void closeChat() {
        store.currentChatId().ifPresent(this::deactivateChatChannels);
        store.setCurrentChat(null);
    }

    public void addChat(CachedChat chat) {
        store.addChat(chat);
        currentUserId().ifPresent(userId -> subscribeUnread(chat.getId(), userId));
    }

    public void removeChat(Long chatId) {
        currentUserId().ifPresent(userId -> subscriptions.unsubscribe(ChannelNames.unreadCount(chatId, userId)));
        deactivateChatChannels(chatId);
        store.removeChat(chatId);
    }

    /**
     * Sends a message and caches it right away; the echo on the chat channel then merges into it.
     */
    public CachedMessage sendMessage(Long chatId, String content) {
        CachedMessage sent = snapshotSource.sendMessage(chatId, content);
        if (!store.addLocalMessage(sent)) {
            log.debug("Sent message {} belongs to uncached chat {}", sent.getId(), chatId);
        }
        return sent;
    }

    /**
     * Zeroes the local count at once and tells the server in the background. The server's own
     * unread update settles the final value.
     */
    public CompletableFuture<Integer> markChatRead(Long chatId) {
        store.markChatRead(chatId);
        return readMarking.submit(chatId)
                .whenComplete((marked, ex) -> {
                    if (ex != null) {
                        log.warn("Unable to mark chat {} read on the server", chatId, ex);
                    }
                });
    }

    /**
     * Pulls chats, unread counts and the open chat's messages again.
     */
    public void resync() {
        if (store.currentUser().isEmpty()) {
            return;
        }
        log.info("Resynchronizing client state");
        loadChats();
        store.currentChatId().ifPresent(this::pullMessages);
    }

    /**
     * Entry point for every payload received on a subscribed channel.
     */
    public void onChannelMessage(String channel, byte[] payload) {
        Optional<DomainEvent> decoded = codec.decode(payload);
        if (decoded.isEmpty()) {
            return;
        }
        DomainEvent event = decoded.get();
        if (event.kind().affectsMessageContent()) {
            store.reconcileMessage(event);
        } else if (event instanceof MessageStatusUpdated status) {
            store.reconcileStatus(status);
        } else if (event instanceof UnreadCountUpdated unread) {
            applyUnread(unread);
        }
    }

    @Override
    public void close() {
        logout();
        readMarking.close();
    }

    private void applyUnread(UnreadCountUpdated unread) {
        Optional<Long> userId = currentUserId();
        if (userId.isPresent() && userId.get().equals(unread.userId())) {
            store.updateUnreadCount(unread.chatId(), unread.userId(), unread.unreadCount());
        }
    }

    private void loadChats() {
        Optional<Long> userId = currentUserId();
        if (userId.isEmpty()) {
            return;
        }
        List<CachedChat> chats;
        try {
            chats = snapshotSource.fetchChats();
        } catch (RuntimeException ex) {
            log.error("Unable to load chats", ex);
            return;
        }
        Set<Long> previousIds = new LinkedHashSet<>();
        store.chats().forEach(chat -> previousIds.add(chat.getId()));
        store.currentChatId().ifPresent(previousIds::add);

        store.setChats(chats);
        chats.forEach(chat -> previousIds.remove(chat.getId()));
        for (Long dropped : previousIds) {
            subscriptions.unsubscribe(ChannelNames.unreadCount(dropped, userId.get()));
            deactivateChatChannels(dropped);
        }
        for (CachedChat chat : chats) {
            subscribeUnread(chat.getId(), userId.get());
            try {
                store.updateUnreadCount(chat.getId(), userId.get(), snapshotSource.fetchUnreadCount(chat.getId()));
            } catch (RuntimeException ex) {
                log.warn("Unable to load unread count of chat {}", chat.getId(), ex);
            }
        }
    }

    private void pullMessages(Long chatId) {
        try {
            store.mergeMessages(chatId, snapshotSource.fetchMessages(chatId, pageSize));
        } catch (RuntimeException ex) {
            log.error("Unable to load messages of chat {}", chatId, ex);
        }
    }

    private void subscribeUnread(Long chatId, Long userId) {
        subscriptions.subscribe(ChannelNames.unreadCount(chatId, userId), this::onChannelMessage);
    }

    private void deactivateChatChannels(Long chatId) {
        subscriptions.unsubscribe(ChannelNames.chat(chatId));
        subscriptions.unsubscribe(ChannelNames.status(chatId));
    }

    private Optional<Long> currentUserId() {
        return store.currentUser().map(ChatUser::id);
    }
}
