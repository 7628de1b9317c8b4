package com.intentflow.core.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A version of a node in the memory graph. Updating a node appends a new version;
 * earlier versions stay readable.
 */
public record MemoryNode(
    String nodeId,
    NodeType type,
    String label,
    Map<String, String> properties,
    Set<String> roleScopes,
    double confidence,
    int version,
    Instant createdAt,
    Instant updatedAt
) {
    /** Role scope visible to every role. */
    public static final String ANY_ROLE = "*";

    public MemoryNode {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(type, "type");
        properties = properties != null ? Map.copyOf(properties) : Map.of();
        roleScopes = roleScopes != null ? Set.copyOf(roleScopes) : Set.of();
    }

    public static MemoryNode create(String nodeId, NodeType type, String label,
                                    Map<String, String> properties, Set<String> roleScopes,
                                    double confidence, Instant now) {
        return new MemoryNode(nodeId, type, label, properties, roleScopes, confidence, 1, now, now);
    }

    public boolean visibleTo(String roleScope) {
        return roleScopes.contains(ANY_ROLE) || roleScopes.contains(roleScope);
    }

    /**
     * Next version with merged properties and role scopes.
     */
    public MemoryNode nextVersion(Map<String, String> extraProperties, String roleScope,
                                  double newConfidence, Instant now) {
        Map<String, String> mergedProps = new LinkedHashMap<>(properties);
        if (extraProperties != null) {
            mergedProps.putAll(extraProperties);
        }
        Set<String> mergedRoles = new HashSet<>(roleScopes);
        if (roleScope != null) {
            mergedRoles.add(roleScope);
        }
        return new MemoryNode(nodeId, type, label, mergedProps, mergedRoles, newConfidence,
            version + 1, createdAt, now);
    }
}
