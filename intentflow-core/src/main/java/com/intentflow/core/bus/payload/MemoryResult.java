package com.intentflow.core.bus.payload;

import com.intentflow.core.model.RankedContext;

import java.util.List;
import java.util.UUID;

/**
 * MEMORY_RESULT payload. {@code available} is false when the store failed to answer.
 */
public record MemoryResult(
    UUID requestId,
    List<RankedContext> entries,
    boolean available
) {
}
