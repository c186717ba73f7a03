package com.example.chatsync.client;

import com.example.chatsync.domain.Message;
import com.example.chatsync.event.DomainEvent;
import com.example.chatsync.event.MessageCreated;
import com.example.chatsync.event.MessageDeleted;
import com.example.chatsync.event.MessageStatusUpdated;
import com.example.chatsync.event.MessageUpdated;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * The consumer side cache: current user, chats, messages per chat, unread counts and connection
 * state.
 *
 * <p>Every mutation runs under one lock and is followed by observer notification on the UI
 * executor. Readers always get copies. Entries are merged field by field and never replaced, so
 * {@code localState} decorations survive server updates.
 */
@Slf4j
public class ClientStateStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Executor uiExecutor;
    private final Map<StoreEventType, List<StoreObserver>> observers = new EnumMap<>(StoreEventType.class);

    private ChatUser currentUser;
    private final Map<Long, CachedChat> chats = new LinkedHashMap<>();
    private final Map<Long, Map<Long, CachedMessage>> messagesByChat = new HashMap<>();
    private final Map<UnreadKey, Integer> unreadCounts = new HashMap<>();
    private boolean connected = true;
    private Long currentChatId;

    public ClientStateStore() {
        this(Runnable::run);
    }

    public ClientStateStore(Executor uiExecutor) {
        this.uiExecutor = Objects.requireNonNull(uiExecutor, "uiExecutor");
        for (StoreEventType type : StoreEventType.values()) {
            observers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public void subscribe(StoreEventType type, StoreObserver observer) {
        List<StoreObserver> list = observers.get(type);
        if (observer != null && !list.contains(observer)) {
            list.add(observer);
        }
    }

    public void unsubscribe(StoreEventType type, StoreObserver observer) {
        observers.get(type).remove(observer);
    }

    public void setCurrentUser(ChatUser user) {
        lock.lock();
        try {
            currentUser = user;
        } finally {
            lock.unlock();
        }
        notifyObservers(StoreEvent.of(user != null ? StoreEventType.USER_LOGGED_IN : StoreEventType.USER_LOGGED_OUT, null, user));
    }

    public Optional<ChatUser> currentUser() {
        lock.lock();
        try {
            return Optional.ofNullable(currentUser);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the chat list. Chats already cached are merged so their local state survives; chats
     * no longer listed are dropped with their messages and counts. A dropped current chat is
     * cleared.
     */
    public void setChats(Collection<CachedChat> incoming) {
        List<CachedChat> snapshot;
        Long droppedCurrent = null;
        lock.lock();
        try {
            Map<Long, CachedChat> merged = new LinkedHashMap<>();
            for (CachedChat chat : incoming) {
                if (chat == null || chat.getId() == null) {
                    continue;
                }
                CachedChat existing = chats.get(chat.getId());
                if (existing != null) {
                    existing.upsertFrom(chat);
                    merged.put(existing.getId(), existing);
                } else {
                    merged.put(chat.getId(), chat.copy());
                }
            }
            chats.keySet().stream()
                    .filter(id -> !merged.containsKey(id))
                    .toList()
                    .forEach(this::dropChatData);
            chats.clear();
            chats.putAll(merged);
            if (currentChatId != null && !merged.containsKey(currentChatId)) {
                droppedCurrent = currentChatId;
                currentChatId = null;
            }
            snapshot = copyChats();
        } finally {
            lock.unlock();
        }
        log.debug("Loaded {} chats", snapshot.size());
        notifyObservers(StoreEvent.of(StoreEventType.CHATS_LOADED, null, snapshot));
        if (droppedCurrent != null) {
            notifyObservers(new StoreEvent(StoreEventType.CURRENT_CHAT_CHANGED, null, droppedCurrent, null));
        }
    }

    /**
     * Adds a chat, or merges it into the cached one with the same id.
     */
    public void addChat(CachedChat chat) {
        requireId(chat.getId(), "chat id");
        CachedChat copy;
        StoreEventType type;
        lock.lock();
        try {
            CachedChat existing = chats.get(chat.getId());
            if (existing != null) {
                existing.upsertFrom(chat);
                copy = existing.copy();
                type = StoreEventType.CHAT_UPDATED;
            } else {
                CachedChat added = chat.copy();
                chats.put(added.getId(), added);
                copy = added.copy();
                type = StoreEventType.CHAT_ADDED;
            }
        } finally {
            lock.unlock();
        }
        notifyObservers(StoreEvent.of(type, copy.getId(), copy));
    }

    /**
     * Merges server fields of {@code update} into the cached chat. Unknown chats are ignored.
     *
     * @return true if a cached chat was updated
     */
    public boolean updateChat(CachedChat update) {
        requireId(update.getId(), "chat id");
        CachedChat previous;
        CachedChat current;
        lock.lock();
        try {
            CachedChat existing = chats.get(update.getId());
            if (existing == null) {
                return false;
            }
            previous = existing.copy();
            existing.upsertFrom(update);
            current = existing.copy();
        } finally {
            lock.unlock();
        }
        notifyObservers(new StoreEvent(StoreEventType.CHAT_UPDATED, current.getId(), previous, current));
        return true;
    }

    /**
     * Sets a UI decoration on a cached chat. Does not notify.
     */
    public void putChatLocalState(Long chatId, String key, Object value) {
        lock.lock();
        try {
            CachedChat chat = chats.get(chatId);
            if (chat != null) {
                chat.getLocalState().put(key, value);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean removeChat(Long chatId) {
        CachedChat removed;
        boolean wasCurrent;
        lock.lock();
        try {
            removed = chats.remove(chatId);
            if (removed == null) {
                return false;
            }
            dropChatData(chatId);
            wasCurrent = chatId.equals(currentChatId);
            if (wasCurrent) {
                currentChatId = null;
            }
        } finally {
            lock.unlock();
        }
        notifyObservers(new StoreEvent(StoreEventType.CHAT_REMOVED, chatId, removed.copy(), null));
        if (wasCurrent) {
            notifyObservers(new StoreEvent(StoreEventType.CURRENT_CHAT_CHANGED, null, chatId, null));
        }
        return true;
    }

    public List<CachedChat> chats() {
        lock.lock();
        try {
            return copyChats();
        } finally {
            lock.unlock();
        }
    }

    public Optional<CachedChat> chat(Long chatId) {
        lock.lock();
        try {
            return Optional.ofNullable(chats.get(chatId)).map(CachedChat::copy);
        } finally {
            lock.unlock();
        }
    }

    public void setCurrentChat(Long chatId) {
        Long previous;
        lock.lock();
        try {
            previous = currentChatId;
            currentChatId = chatId;
        } finally {
            lock.unlock();
        }
        if (!Objects.equals(previous, chatId)) {
            notifyObservers(new StoreEvent(StoreEventType.CURRENT_CHAT_CHANGED, chatId, previous, chatId));
        }
    }

    public Optional<Long> currentChatId() {
        lock.lock();
        try {
            return Optional.ofNullable(currentChatId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the stored count. The last value received wins; counts are never incremented locally.
     */
    public void updateUnreadCount(Long chatId, Long userId, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Unread count must not be negative");
        }
        UnreadKey key = new UnreadKey(chatId, userId);
        Integer previous;
        lock.lock();
        try {
            previous = unreadCounts.put(key, count);
        } finally {
            lock.unlock();
        }
        if (previous == null || previous != count) {
            notifyObservers(new StoreEvent(StoreEventType.UNREAD_COUNT_UPDATED, chatId, previous != null ? previous : 0, count));
        }
    }

    /**
     * Optimistically zeroes the current user's count for a chat.
     */
    public void markChatRead(Long chatId) {
        Long userId = currentUser().map(ChatUser::id)
                .orElseThrow(() -> new IllegalStateException("No user logged in"));
        updateUnreadCount(chatId, userId, 0);
    }

    public int unreadCount(Long chatId, Long userId) {
        lock.lock();
        try {
            return unreadCounts.getOrDefault(new UnreadKey(chatId, userId), 0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Count of the current user, 0 when logged out.
     */
    public int unreadCount(Long chatId) {
        return currentUser().map(user -> unreadCount(chatId, user.id())).orElse(0);
    }

    public void setConnectionStatus(boolean nowConnected) {
        boolean previous;
        lock.lock();
        try {
            previous = connected;
            connected = nowConnected;
        } finally {
            lock.unlock();
        }
        if (previous != nowConnected) {
            notifyObservers(new StoreEvent(StoreEventType.CONNECTION_STATUS_CHANGED, null, previous, nowConnected));
        }
    }

    public boolean isConnected() {
        lock.lock();
        try {
            return connected;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a created, updated or deleted message event to the cache. A cached message is merged
     * field by field; an unknown message is inserted unless the current user wrote it. Events for
     * chats that are not cached are ignored.
     */
    public ReconcileOutcome reconcileMessage(DomainEvent event) {
        CachedMessage incoming = toCachedMessage(event);
        if (incoming == null) {
            return ReconcileOutcome.IGNORED;
        }
        ReconcileOutcome outcome;
        CachedMessage previous = null;
        CachedMessage current;
        lock.lock();
        try {
            if (!chats.containsKey(incoming.getChatId())) {
                log.debug("Ignoring {} for uncached chat {}", event.kind(), incoming.getChatId());
                return ReconcileOutcome.IGNORED;
            }
            Map<Long, CachedMessage> cache = messagesByChat.computeIfAbsent(incoming.getChatId(), id -> new LinkedHashMap<>());
            CachedMessage existing = cache.get(incoming.getId());
            if (existing != null) {
                previous = existing.copy();
                existing.upsertFrom(incoming);
                current = existing.copy();
                outcome = ReconcileOutcome.UPDATED;
            } else if (currentUser != null && currentUser.id().equals(incoming.getUserId())) {
                return ReconcileOutcome.SKIPPED_OWN;
            } else {
                cache.put(incoming.getId(), incoming);
                current = incoming.copy();
                outcome = ReconcileOutcome.INSERTED;
            }
        } finally {
            lock.unlock();
        }
        StoreEventType type = outcome == ReconcileOutcome.INSERTED
                ? StoreEventType.MESSAGE_RECEIVED
                : StoreEventType.MESSAGE_UPDATED;
        notifyObservers(new StoreEvent(type, current.getChatId(), previous, current));
        return outcome;
    }

    /**
     * Inserts a message the current user just sent. Later events for it merge into this entry.
     *
     * @return false if the chat is not cached and the message was not kept
     */
    public boolean addLocalMessage(CachedMessage message) {
        requireId(message.getId(), "message id");
        requireId(message.getChatId(), "chat id");
        CachedMessage copy;
        lock.lock();
        try {
            if (!chats.containsKey(message.getChatId())) {
                return false;
            }
            Map<Long, CachedMessage> cache = messagesByChat.computeIfAbsent(message.getChatId(), id -> new LinkedHashMap<>());
            CachedMessage existing = cache.get(message.getId());
            if (existing != null) {
                existing.upsertFrom(message);
                copy = existing.copy();
            } else {
                CachedMessage added = message.copy();
                cache.put(added.getId(), added);
                copy = added.copy();
            }
        } finally {
            lock.unlock();
        }
        notifyObservers(StoreEvent.of(StoreEventType.MESSAGE_RECEIVED, copy.getChatId(), copy));
        return true;
    }

    /**
     * Records a read receipt on a cached message. Receipts for messages not in the cache are ignored.
     */
    public ReconcileOutcome reconcileStatus(MessageStatusUpdated status) {
        CachedMessage current;
        lock.lock();
        try {
            Map<Long, CachedMessage> cache = messagesByChat.get(status.chatId());
            CachedMessage existing = cache != null ? cache.get(status.messageId()) : null;
            if (existing == null) {
                return ReconcileOutcome.IGNORED;
            }
            if (status.read()) {
                existing.getReadReceipts().put(status.userId(), status.readAt() != null ? status.readAt() : status.occurredAt());
            } else {
                existing.getReadReceipts().remove(status.userId());
            }
            current = existing.copy();
        } finally {
            lock.unlock();
        }
        notifyObservers(StoreEvent.of(StoreEventType.MESSAGE_STATUS_UPDATED, status.chatId(), current));
        return ReconcileOutcome.UPDATED;
    }

    /**
     * Upserts a pulled page of messages, as done after opening a chat or reconnecting. Nothing is
     * removed.
     *
     * @return number of messages that were not cached before; 0 if the chat itself is not cached
     */
    public int mergeMessages(Long chatId, Collection<CachedMessage> pulled) {
        requireId(chatId, "chat id");
        int inserted = 0;
        List<CachedMessage> snapshot;
        lock.lock();
        try {
            if (!chats.containsKey(chatId)) {
                return 0;
            }
            Map<Long, CachedMessage> cache = messagesByChat.computeIfAbsent(chatId, id -> new LinkedHashMap<>());
            for (CachedMessage message : pulled) {
                if (message == null || message.getId() == null) {
                    continue;
                }
                CachedMessage existing = cache.get(message.getId());
                if (existing != null) {
                    existing.upsertFrom(message);
                } else {
                    CachedMessage added = message.copy();
                    added.setChatId(chatId);
                    cache.put(added.getId(), added);
                    inserted++;
                }
            }
            snapshot = sortedCopies(cache.values());
        } finally {
            lock.unlock();
        }
        notifyObservers(StoreEvent.of(StoreEventType.MESSAGES_MERGED, chatId, snapshot));
        return inserted;
    }

    /**
     * Cached messages of a chat, oldest first.
     */
    public List<CachedMessage> messages(Long chatId) {
        lock.lock();
        try {
            Map<Long, CachedMessage> cache = messagesByChat.get(chatId);
            return cache == null ? List.of() : sortedCopies(cache.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<CachedMessage> message(Long chatId, Long messageId) {
        lock.lock();
        try {
            Map<Long, CachedMessage> cache = messagesByChat.get(chatId);
            return Optional.ofNullable(cache != null ? cache.get(messageId) : null).map(CachedMessage::copy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets everything, as on logout.
     */
    public void clearAll() {
        lock.lock();
        try {
            currentUser = null;
            chats.clear();
            messagesByChat.clear();
            unreadCounts.clear();
            currentChatId = null;
            connected = true;
        } finally {
            lock.unlock();
        }
        log.debug("Client state cleared");
        notifyObservers(StoreEvent.of(StoreEventType.STATE_CLEARED, null, null));
    }

    private void notifyObservers(StoreEvent event) {
        List<StoreObserver> snapshot = List.copyOf(observers.get(event.type()));
        if (snapshot.isEmpty()) {
            return;
        }
        uiExecutor.execute(() -> {
            for (StoreObserver observer : snapshot) {
                try {
                    observer.onStoreEvent(event);
                } catch (RuntimeException ex) {
                    log.error("Observer {} failed on {}", observer, event.type(), ex);
                }
            }
        });
    }

    private void dropChatData(Long chatId) {
        messagesByChat.remove(chatId);
        unreadCounts.keySet().removeIf(key -> key.chatId().equals(chatId));
    }

    private List<CachedChat> copyChats() {
        List<CachedChat> copies = new ArrayList<>(chats.size());
        chats.values().forEach(chat -> copies.add(chat.copy()));
        return copies;
    }

    private static List<CachedMessage> sortedCopies(Collection<CachedMessage> messages) {
        return messages.stream()
                .map(CachedMessage::copy)
                .sorted(CachedMessage.CHRONOLOGICAL)
                .toList();
    }

    private static CachedMessage toCachedMessage(DomainEvent event) {
        if (event instanceof MessageCreated created) {
            return CachedMessage.builder()
                    .id(created.messageId())
                    .chatId(created.chatId())
                    .userId(created.userId())
                    .content(created.content())
                    .createdAt(created.createdAt())
                    .deleted(created.deleted())
                    .build();
        }
        if (event instanceof MessageUpdated updated) {
            return CachedMessage.builder()
                    .id(updated.messageId())
                    .chatId(updated.chatId())
                    .userId(updated.userId())
                    .content(updated.content())
                    .createdAt(updated.createdAt())
                    .updatedAt(updated.updatedAt())
                    .deleted(updated.deleted())
                    .build();
        }
        if (event instanceof MessageDeleted deleted) {
            return CachedMessage.builder()
                    .id(deleted.messageId())
                    .chatId(deleted.chatId())
                    .userId(deleted.userId())
                    .content(Message.DELETED_PLACEHOLDER)
                    .createdAt(deleted.createdAt())
                    .updatedAt(deleted.updatedAt())
                    .deleted(true)
                    .build();
        }
        return null;
    }

    private static void requireId(Long id, String name) {
        if (id == null) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
