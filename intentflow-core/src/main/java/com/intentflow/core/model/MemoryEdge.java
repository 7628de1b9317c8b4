package com.intentflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A relationship between two memory nodes. Edges are never removed;
 * a newer edge names the one it supersedes.
 */
public record MemoryEdge(
    UUID edgeId,
    String fromNodeId,
    String toNodeId,
    RelationType relation,
    double confidence,
    Instant createdAt,
    UUID supersedesEdgeId
) {
    public static MemoryEdge create(String from, String to, RelationType relation,
                                    double confidence, Instant now) {
        return new MemoryEdge(UUID.randomUUID(), from, to, relation, confidence, now, null);
    }

    public MemoryEdge supersede(double newConfidence, Instant now) {
        return new MemoryEdge(UUID.randomUUID(), fromNodeId, toNodeId, relation, newConfidence, now, edgeId);
    }
}
