package com.example.chatsync.tracking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.chatsync.domain.Chat;
import com.example.chatsync.domain.Message;
import com.example.chatsync.service.exception.PersistenceFailureException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

class ChangeTrackerTest {

    private List<String> journal;
    private InMemoryEntityMapper<Message> messages;
    private CountingTransactions transactions;

    @BeforeEach
    void setUp() {
        journal = InMemoryEntityMapper.newJournal();
        messages = InMemoryEntityMapper.messages(journal);
        transactions = new CountingTransactions();
    }

    @Test
    void commitInsertsThenUpdatesThenDeletesInOneTransaction() {
        ChangeTracker tracker = tracker(messages, InMemoryEntityMapper.chats(journal));
        Message existing = Message.builder().id(10L).chatId(1L).content("old").build();
        Message gone = Message.builder().id(11L).chatId(1L).build();

        tracker.registerDeleted(gone);
        tracker.registerDirty(existing);
        tracker.registerNew(Chat.builder().name("parent").build());
        tracker.registerNew(Message.builder().chatId(1L).build());
        tracker.commit();

        assertEquals(
                List.of("insert:Chat:1", "insert:Message:1", "update:Message:10", "delete:Message:11"),
                journal);
        assertEquals(1, transactions.count);
        assertFalse(tracker.hasChanges());
    }

    @Test
    void entityRegisteredNewThenDeletedIsNeverWritten() {
        ChangeTracker tracker = tracker(messages);
        Message draft = Message.builder().chatId(1L).build();

        tracker.registerNew(draft);
        tracker.registerDeleted(draft);
        tracker.commit();

        assertTrue(journal.isEmpty());
    }

    @Test
    void dirtyMarkOnNewEntityIsIgnored() {
        ChangeTracker tracker = tracker(messages);
        Message draft = Message.builder().chatId(1L).content("a").build();

        tracker.registerNew(draft);
        draft.setContent("b");
        tracker.registerDirty(draft);

        assertTrue(tracker.isNew(draft));
        assertFalse(tracker.isDirty(draft));
        tracker.commit();
        assertEquals(List.of("insert:Message:1"), journal);
        assertEquals("b", messages.rows().get(0).getContent());
    }

    @Test
    void deletingDirtyEntityDropsTheUpdate() {
        ChangeTracker tracker = tracker(messages);
        Message message = Message.builder().id(5L).chatId(1L).build();

        tracker.registerDirty(message);
        tracker.registerDeleted(message);

        assertFalse(tracker.isDirty(message));
        assertTrue(tracker.isDeleted(message));
        tracker.commit();
        assertEquals(List.of("delete:Message:5"), journal);
    }

    @Test
    void entitiesAreTrackedByIdentityNotEquality() {
        ChangeTracker tracker = tracker(messages);
        Message first = Message.builder().chatId(1L).content("same").build();
        Message second = Message.builder().chatId(1L).content("same").build();

        tracker.registerNew(first);
        tracker.registerNew(second);
        tracker.registerNew(first);
        tracker.commit();

        assertEquals(List.of("insert:Message:1", "insert:Message:2"), journal);
    }

    @Test
    void mapperFailureSurfacesAsPersistenceFailure() {
        ChangeTracker tracker = tracker(messages.failOn("update"));
        tracker.registerNew(Message.builder().chatId(1L).build());
        tracker.registerDirty(Message.builder().id(3L).chatId(1L).build());

        PersistenceFailureException ex = assertThrows(PersistenceFailureException.class, tracker::commit);

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(tracker.isOpen());
    }

    @Test
    void missingMapperIsReportedThroughCommit() {
        ChangeTracker tracker = tracker(messages);
        tracker.registerNew(Chat.builder().name("orphan").build());

        PersistenceFailureException ex = assertThrows(PersistenceFailureException.class, tracker::commit);

        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void rollbackDiscardsEverythingWithoutTouchingMappers() {
        ChangeTracker tracker = tracker(messages);
        tracker.registerNew(Message.builder().chatId(1L).build());
        tracker.registerDirty(Message.builder().id(2L).build());

        tracker.rollback();

        assertTrue(journal.isEmpty());
        assertEquals(0, transactions.count);
        assertFalse(tracker.isOpen());
    }

    @Test
    void completedTrackerRejectsReuse() {
        ChangeTracker tracker = tracker(messages);
        tracker.commit();

        assertThrows(IllegalStateException.class, () -> tracker.registerNew(new Message()));
        assertThrows(IllegalStateException.class, tracker::commit);
        assertThrows(IllegalStateException.class, tracker::rollback);
    }

    private ChangeTracker tracker(EntityMapper<?>... mappers) {
        return new ChangeTracker(new MapperRegistry(List.of(mappers)), transactions);
    }

    static class CountingTransactions implements TransactionOperations {

        int count;

        @Override
        public <T> T execute(TransactionCallback<T> action) throws TransactionException {
            count++;
            return action.doInTransaction(new SimpleTransactionStatus());
        }
    }
}
