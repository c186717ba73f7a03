package com.example.chatsync.tracking;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.domain.Message;
import com.example.chatsync.domain.MessageStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Mapper keeping rows in memory and writing every call to a journal shared between mappers, such
 * as {@code "insert:Message:1"}.
 */
public class InMemoryEntityMapper<T> implements EntityMapper<T> {

    private final Class<T> type;
    private final Function<T, Long> idGetter;
    private final BiConsumer<T, Long> idSetter;
    private final List<String> journal;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, T> rows = new LinkedHashMap<>();
    private String failingOperation;

    public InMemoryEntityMapper(
            Class<T> type, Function<T, Long> idGetter, BiConsumer<T, Long> idSetter, List<String> journal) {
        this.type = type;
        this.idGetter = idGetter;
        this.idSetter = idSetter;
        this.journal = journal;
    }

    public static InMemoryEntityMapper<Chat> chats(List<String> journal) {
        return new InMemoryEntityMapper<>(Chat.class, Chat::getId, Chat::setId, journal);
    }

    public static InMemoryEntityMapper<Message> messages(List<String> journal) {
        return new InMemoryEntityMapper<>(Message.class, Message::getId, Message::setId, journal);
    }

    public static InMemoryEntityMapper<MessageStatus> statuses(List<String> journal) {
        return new InMemoryEntityMapper<>(MessageStatus.class, MessageStatus::getId, MessageStatus::setId, journal) {
            @Override
            public void insert(MessageStatus status) {
                if (status.resolveMessageId() == null) {
                    throw new IllegalStateException("status inserted before its message");
                }
                super.insert(status);
            }
        };
    }

    public static List<String> newJournal() {
        return new ArrayList<>();
    }

    /**
     * Makes the given operation ({@code insert}, {@code update} or {@code delete}) throw.
     */
    public InMemoryEntityMapper<T> failOn(String operation) {
        this.failingOperation = operation;
        return this;
    }

    @Override
    public Class<T> entityType() {
        return type;
    }

    @Override
    public void insert(T entity) {
        failIfRequested("insert");
        Long id = sequence.incrementAndGet();
        idSetter.accept(entity, id);
        rows.put(id, entity);
        journal.add("insert:" + type.getSimpleName() + ":" + id);
    }

    @Override
    public void update(T entity) {
        failIfRequested("update");
        rows.put(idGetter.apply(entity), entity);
        journal.add("update:" + type.getSimpleName() + ":" + idGetter.apply(entity));
    }

    @Override
    public void delete(T entity) {
        failIfRequested("delete");
        rows.remove(idGetter.apply(entity));
        journal.add("delete:" + type.getSimpleName() + ":" + idGetter.apply(entity));
    }

    public List<T> rows() {
        return List.copyOf(rows.values());
    }

    private void failIfRequested(String operation) {
        if (operation.equals(failingOperation)) {
            throw new IllegalStateException(operation + " failed for " + type.getSimpleName());
        }
    }
}
