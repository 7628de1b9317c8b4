package com.intentflow.core.repository;

import com.intentflow.core.model.MemoryEdge;
import com.intentflow.core.model.MemoryNode;
import com.intentflow.core.model.RelationType;

import java.util.List;
import java.util.Optional;

/**
 * Append-only relationship graph. Node updates add versions and edge updates
 * add superseding edges; nothing is deleted.
 */
public interface MemoryGraphRepository {

    /**
     * Append a node version. The version must be one above the current one.
     */
    void saveNode(MemoryNode node);

    /**
     * Latest version of a node.
     */
    Optional<MemoryNode> findNode(String nodeId);

    /**
     * All versions of a node, oldest first.
     */
    List<MemoryNode> nodeHistory(String nodeId);

    /**
     * Latest version of every node.
     */
    List<MemoryNode> currentNodes();

    void saveEdge(MemoryEdge edge);

    /**
     * Edges leaving a node that no newer edge supersedes.
     */
    List<MemoryEdge> currentEdgesFrom(String nodeId);

    /**
     * The current edge of a relation between two nodes, if any.
     */
    Optional<MemoryEdge> currentEdge(String fromNodeId, String toNodeId, RelationType relation);

    /**
     * Every edge ever written between two nodes, oldest first.
     */
    List<MemoryEdge> edgeHistory(String fromNodeId, String toNodeId);
}
