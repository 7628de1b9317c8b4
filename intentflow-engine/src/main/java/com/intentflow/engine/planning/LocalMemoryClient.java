package com.intentflow.engine.planning;

import com.intentflow.core.exception.MemoryUnavailableException;
import com.intentflow.core.model.RankedContext;
import com.intentflow.engine.memory.MemoryStore;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queries a memory store living in the same process, still bounded by a timeout.
 */
public class LocalMemoryClient implements MemoryClient {

    private final MemoryStore store;
    private final Duration timeout;
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "memory-query");
        thread.setDaemon(true);
        return thread;
    });

    public LocalMemoryClient(MemoryStore store, Duration timeout) {
        this.store = store;
        this.timeout = timeout;
    }

    @Override
    public List<RankedContext> retrieveContext(UUID taskId, String roleScope, List<String> queryTerms, int limit) {
        Future<List<RankedContext>> future = executor.submit(() -> store.retrieveContext(roleScope, queryTerms, limit));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MemoryUnavailableException("Memory query timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            throw new MemoryUnavailableException("Memory query failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MemoryUnavailableException("Interrupted while querying memory", e);
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
