package com.intentflow.engine.planning;

import com.intentflow.core.exception.MemoryUnavailableException;
import com.intentflow.core.model.RankedContext;

import java.util.List;
import java.util.UUID;

/**
 * How planning reaches the memory store.
 */
public interface MemoryClient {

    /**
     * Ranked context for a role, bounded by the client's timeout.
     *
     * @throws MemoryUnavailableException if the store does not answer in time or failed
     */
    List<RankedContext> retrieveContext(UUID taskId, String roleScope, List<String> queryTerms, int limit);
}
