package com.example.chatsync.client;

import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs "mark chat read" calls off the caller's thread with bounded concurrency and a bounded
 * backlog.
 */
@Slf4j
public class ReadMarkingQueue implements AutoCloseable {

    private final ChatSnapshotSource snapshotSource;
    private final ThreadPoolTaskExecutor executor;

    public ReadMarkingQueue(ChatSnapshotSource snapshotSource) {
        this(snapshotSource, 2, 100);
    }

    public ReadMarkingQueue(ChatSnapshotSource snapshotSource, int concurrency, int backlog) {
        this.snapshotSource = snapshotSource;
        this.executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, concurrency));
        executor.setMaxPoolSize(Math.max(1, concurrency));
        executor.setQueueCapacity(Math.max(0, backlog));
        executor.setThreadNamePrefix("read-marking-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
    }

    /**
     * @return future completing with the number of messages the server marked read
     */
    public CompletableFuture<Integer> submit(Long chatId) {
        try {
            return executor.submitCompletable(() -> snapshotSource.markChatRead(chatId));
        } catch (TaskRejectedException ex) {
            log.warn("Read marking backlog full, dropping request for chat {}", chatId);
            return CompletableFuture.failedFuture(ex);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
