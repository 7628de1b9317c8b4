package com.intentflow.engine.persistence;

import com.intentflow.core.model.MemoryEdge;
import com.intentflow.core.model.MemoryNode;
import com.intentflow.core.model.RelationType;
import com.intentflow.core.repository.MemoryGraphRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory relationship graph. Every node version and every edge is kept; the
 * "current" views return the latest node version and the edges nothing supersedes.
 */
@Repository
public class InMemoryMemoryGraphRepository implements MemoryGraphRepository {

    private final Map<String, List<MemoryNode>> nodeVersions = new LinkedHashMap<>();
    private final Map<String, List<MemoryEdge>> edgesByPair = new LinkedHashMap<>();

    @Override
    public synchronized void saveNode(MemoryNode node) {
        List<MemoryNode> versions = nodeVersions.computeIfAbsent(node.nodeId(), id -> new ArrayList<>());
        if (!versions.isEmpty() && versions.get(versions.size() - 1).version() >= node.version()) {
            throw new IllegalArgumentException(String.format(
                "Node %s version %d is not newer than the stored one", node.nodeId(), node.version()));
        }
        versions.add(node);
    }

    @Override
    public synchronized Optional<MemoryNode> findNode(String nodeId) {
        List<MemoryNode> versions = nodeVersions.get(nodeId);
        return versions == null ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    @Override
    public synchronized List<MemoryNode> nodeHistory(String nodeId) {
        return List.copyOf(nodeVersions.getOrDefault(nodeId, List.of()));
    }

    @Override
    public synchronized List<MemoryNode> currentNodes() {
        return nodeVersions.values().stream()
            .map(versions -> versions.get(versions.size() - 1))
            .toList();
    }

    @Override
    public synchronized void saveEdge(MemoryEdge edge) {
        edgesByPair.computeIfAbsent(pairKey(edge.fromNodeId(), edge.toNodeId()), k -> new ArrayList<>()).add(edge);
    }

    @Override
    public synchronized List<MemoryEdge> currentEdgesFrom(String nodeId) {
        List<MemoryEdge> current = new ArrayList<>();
        for (List<MemoryEdge> history : edgesByPair.values()) {
            if (!history.isEmpty() && history.get(0).fromNodeId().equals(nodeId)) {
                current.addAll(latestPerRelation(history).values());
            }
        }
        return current;
    }

    @Override
    public synchronized Optional<MemoryEdge> currentEdge(String fromNodeId, String toNodeId, RelationType relation) {
        List<MemoryEdge> history = edgesByPair.getOrDefault(pairKey(fromNodeId, toNodeId), List.of());
        return Optional.ofNullable(latestPerRelation(history).get(relation));
    }

    @Override
    public synchronized List<MemoryEdge> edgeHistory(String fromNodeId, String toNodeId) {
        return List.copyOf(edgesByPair.getOrDefault(pairKey(fromNodeId, toNodeId), List.of()));
    }

    private static Map<RelationType, MemoryEdge> latestPerRelation(List<MemoryEdge> history) {
        Map<RelationType, MemoryEdge> latest = new LinkedHashMap<>();
        for (MemoryEdge edge : history) {
            latest.put(edge.relation(), edge);
        }
        return latest;
    }

    private static String pairKey(String from, String to) {
        return from + "->" + to;
    }
}
