package com.intentflow.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of a relevance-ranked context bundle.
 */
public record RankedContext(
    String nodeId,
    String entity,
    NodeType type,
    double relevanceScore,
    double recency,
    double centrality,
    double score,
    String sourceContext,
    Instant updatedAt,
    Map<String, String> properties
) {
}
