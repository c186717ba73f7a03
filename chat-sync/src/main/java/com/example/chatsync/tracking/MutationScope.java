package com.example.chatsync.tracking;

import com.example.chatsync.event.DomainEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * What a mutation sees while it runs: the change tracker of the operation, plus a list of events to
 * raise once the tracker has committed.
 */
public class MutationScope {

    private final ChangeTracker tracker;
    private final List<Supplier<? extends DomainEvent>> pendingEvents = new ArrayList<>();

    MutationScope(ChangeTracker tracker) {
        this.tracker = tracker;
    }

    public <T> T registerNew(T entity) {
        return tracker.registerNew(entity);
    }

    public <T> T registerDeleted(T entity) {
        return tracker.registerDeleted(entity);
    }

    /**
     * Applies {@code mutation} to {@code entity} and registers it dirty. Assigning a field never marks
     * an entity dirty by itself; this is the only way to do it.
     */
    public <T> T update(T entity, Consumer<? super T> mutation) {
        mutation.accept(entity);
        return tracker.registerDirty(entity);
    }

    /**
     * Schedules an event for dispatch after commit. The factory runs after the flush, so it sees
     * generated ids and may query committed state.
     */
    public void raise(Supplier<? extends DomainEvent> eventFactory) {
        pendingEvents.add(eventFactory);
    }

    List<Supplier<? extends DomainEvent>> pendingEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }
}
