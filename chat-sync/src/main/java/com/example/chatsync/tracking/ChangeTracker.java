package com.example.chatsync.tracking;

import com.example.chatsync.service.exception.PersistenceFailureException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Batches new, dirty and deleted entities of one logical operation and flushes them atomically.
 *
 * <p>Entities are tracked by identity, not {@code equals}. Within each collection registration
 * order is kept, so a parent registered before its children is inserted first.
 *
 * <p>Not thread-safe. One instance per operation; once committed or rolled back it rejects further
 * use.
 */
@Slf4j
public class ChangeTracker {

    private enum State {
        OPEN,
        COMMITTED,
        ROLLED_BACK
    }

    private final MapperRegistry mappers;
    private final TransactionOperations transactions;

    private final Map<Identity, Object> newEntities = new LinkedHashMap<>();
    private final Map<Identity, Object> dirtyEntities = new LinkedHashMap<>();
    private final Map<Identity, Object> deletedEntities = new LinkedHashMap<>();

    private State state = State.OPEN;

    public ChangeTracker(MapperRegistry mappers, TransactionOperations transactions) {
        this.mappers = mappers;
        this.transactions = transactions;
    }

    public <T> T registerNew(T entity) {
        ensureOpen();
        Identity identity = Identity.of(entity);
        dirtyEntities.remove(identity);
        deletedEntities.remove(identity);
        newEntities.put(identity, entity);
        return entity;
    }

    /**
     * No-op for an entity registered as new: it will be inserted with its latest state.
     */
    public <T> T registerDirty(T entity) {
        ensureOpen();
        Identity identity = Identity.of(entity);
        if (!newEntities.containsKey(identity) && !deletedEntities.containsKey(identity)) {
            dirtyEntities.put(identity, entity);
        }
        return entity;
    }

    /**
     * Deleting an entity that is still new cancels its insert instead of scheduling a delete.
     */
    public <T> T registerDeleted(T entity) {
        ensureOpen();
        Identity identity = Identity.of(entity);
        if (newEntities.remove(identity) != null) {
            return entity;
        }
        dirtyEntities.remove(identity);
        deletedEntities.put(identity, entity);
        return entity;
    }

    /**
     * Inserts every new entity, updates every dirty one and deletes every deleted one inside a single
     * transaction. Any mapper failure rolls back the whole batch.
     *
     * @throws PersistenceFailureException if a mapper fails or no mapper exists for an entity type
     */
    public void commit() {
        ensureOpen();
        List<Object> inserts = new ArrayList<>(newEntities.values());
        List<Object> updates = new ArrayList<>(dirtyEntities.values());
        List<Object> deletes = new ArrayList<>(deletedEntities.values());
        try {
            transactions.executeWithoutResult(status -> {
                inserts.forEach(entity -> mappers.mapperFor(entity).insert(entity));
                updates.forEach(entity -> mappers.mapperFor(entity).update(entity));
                deletes.forEach(entity -> mappers.mapperFor(entity).delete(entity));
            });
        } catch (RuntimeException ex) {
            throw new PersistenceFailureException("Unable to commit change set", ex);
        }
        log.debug("Committed change set: {} inserted, {} updated, {} deleted",
                inserts.size(), updates.size(), deletes.size());
        clear();
        state = State.COMMITTED;
    }

    public void rollback() {
        if (state == State.COMMITTED) {
            throw new IllegalStateException("Change set already committed");
        }
        clear();
        state = State.ROLLED_BACK;
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public boolean hasChanges() {
        return !newEntities.isEmpty() || !dirtyEntities.isEmpty() || !deletedEntities.isEmpty();
    }

    public boolean isNew(Object entity) {
        return newEntities.containsKey(Identity.of(entity));
    }

    public boolean isDirty(Object entity) {
        return dirtyEntities.containsKey(Identity.of(entity));
    }

    public boolean isDeleted(Object entity) {
        return deletedEntities.containsKey(Identity.of(entity));
    }

    private void clear() {
        newEntities.clear();
        dirtyEntities.clear();
        deletedEntities.clear();
    }

    private void ensureOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Change tracker is " + state.name().toLowerCase() + " and cannot be reused");
        }
    }

    private record Identity(Object entity) {

        static Identity of(Object entity) {
            if (entity == null) {
                throw new IllegalArgumentException("Entity is required");
            }
            return new Identity(entity);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Identity identity && identity.entity == entity;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(entity);
        }
    }
}
