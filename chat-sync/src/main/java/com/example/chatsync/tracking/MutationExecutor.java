package com.example.chatsync.tracking;

import com.example.chatsync.event.DomainEvent;
import com.example.chatsync.event.DomainEventDispatcher;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Runs one mutation against a fresh {@link ChangeTracker} and dispatches the events it raised only
 * once the commit succeeded. A failed mutation or commit is rolled back and dispatches nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MutationExecutor {

    private final MapperRegistry mapperRegistry;
    private final TransactionOperations transactionOperations;
    private final DomainEventDispatcher eventDispatcher;

    public <T> T execute(String operation, Function<MutationScope, T> work) {
        ChangeTracker tracker = new ChangeTracker(mapperRegistry, transactionOperations);
        MutationScope scope = new MutationScope(tracker);
        T result;
        try {
            result = work.apply(scope);
            tracker.commit();
        } catch (RuntimeException ex) {
            tracker.rollback();
            log.debug("Rolled back {}", operation, ex);
            throw ex;
        }

        for (Supplier<? extends DomainEvent> factory : scope.pendingEvents()) {
            DomainEvent event;
            try {
                event = factory.get();
            } catch (RuntimeException ex) {
                log.error("Unable to build event after committing {}", operation, ex);
                continue;
            }
            eventDispatcher.dispatch(event);
        }
        return result;
    }
}
