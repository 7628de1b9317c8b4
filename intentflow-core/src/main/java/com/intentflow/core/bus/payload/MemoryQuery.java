package com.intentflow.core.bus.payload;

import java.util.List;
import java.util.UUID;

/**
 * MEMORY_QUERY payload. Replies go to {@code replyTopic}.
 */
public record MemoryQuery(
    UUID requestId,
    String roleScope,
    List<String> queryTerms,
    int limit,
    String replyTopic
) {
}
