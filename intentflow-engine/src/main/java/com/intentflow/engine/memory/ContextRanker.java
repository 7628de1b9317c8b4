package com.intentflow.engine.memory;

import com.intentflow.core.model.MemoryEdge;
import com.intentflow.core.model.MemoryNode;
import com.intentflow.core.model.RankedContext;
import com.intentflow.core.model.RelationType;
import com.intentflow.core.repository.MemoryGraphRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders memory nodes for a role and a set of query terms.
 *
 * score = relevance * recency * (1 + centralityBoost * centrality)
 *
 * relevance is the share of query terms found in the node's label or properties
 * (1 when there are no terms), recency halves every {@code halfLife} since the node
 * was last updated, and centrality is how strongly the role has accessed the
 * categories the node belongs to, normalised over the candidates. Equal scores are
 * ordered most recently updated first.
 */
public class ContextRanker {

    private static final double LN2 = Math.log(2);

    private final Duration halfLife;
    private final double centralityBoost;
    private final Clock clock;

    public ContextRanker(Duration halfLife, double centralityBoost, Clock clock) {
        if (halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("halfLife must be positive");
        }
        this.halfLife = halfLife;
        this.centralityBoost = centralityBoost;
        this.clock = clock;
    }

    public List<RankedContext> rank(List<MemoryNode> candidates, String roleScope, List<String> queryTerms,
                                    MemoryGraphRepository graph, int limit) {
        List<String> terms = queryTerms == null ? List.of() : queryTerms.stream()
            .filter(t -> t != null && !t.isBlank())
            .map(t -> t.toLowerCase(Locale.ROOT).trim())
            .distinct()
            .toList();
        Instant now = clock.instant();
        Map<String, Double> accessed = accessedCategories(roleScope, graph);

        Map<String, Double> rawCentrality = new HashMap<>();
        double maxCentrality = 0.0;
        for (MemoryNode node : candidates) {
            double c = 0.0;
            for (MemoryEdge edge : graph.currentEdgesFrom(node.nodeId())) {
                if (edge.relation() == RelationType.IN_CATEGORY) {
                    c += accessed.getOrDefault(edge.toNodeId(), 0.0);
                }
            }
            rawCentrality.put(node.nodeId(), c);
            maxCentrality = Math.max(maxCentrality, c);
        }

        List<RankedContext> ranked = new ArrayList<>();
        for (MemoryNode node : candidates) {
            double relevance = relevance(node, terms);
            if (!terms.isEmpty() && relevance == 0.0) {
                continue;
            }
            double recency = recency(node.updatedAt(), now);
            double centrality = maxCentrality > 0 ? rawCentrality.get(node.nodeId()) / maxCentrality : 0.0;
            double score = relevance * recency * (1 + centralityBoost * centrality);
            ranked.add(new RankedContext(node.nodeId(), node.label(), node.type(), relevance, recency,
                centrality, score, sourceContext(node), node.updatedAt(), node.properties()));
        }

        ranked.sort(Comparator.comparingDouble(RankedContext::score).reversed()
            .thenComparing(RankedContext::updatedAt, Comparator.reverseOrder())
            .thenComparing(RankedContext::nodeId));
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : ranked;
    }

    double recency(Instant updatedAt, Instant now) {
        long ageMillis = Math.max(0, Duration.between(updatedAt, now).toMillis());
        return Math.exp(-LN2 * ageMillis / (double) halfLife.toMillis());
    }

    static double relevance(MemoryNode node, List<String> terms) {
        if (terms.isEmpty()) {
            return 1.0;
        }
        StringBuilder text = new StringBuilder(node.label() == null ? "" : node.label());
        node.properties().values().forEach(v -> text.append(' ').append(v));
        String haystack = text.toString().toLowerCase(Locale.ROOT);
        long matched = terms.stream().filter(haystack::contains).count();
        return matched / (double) terms.size();
    }

    private static Map<String, Double> accessedCategories(String roleScope, MemoryGraphRepository graph) {
        Map<String, Double> accessed = new HashMap<>();
        for (MemoryEdge edge : graph.currentEdgesFrom(MemoryStore.roleNodeId(roleScope))) {
            if (edge.relation() == RelationType.ACCESSED) {
                accessed.merge(edge.toNodeId(), edge.confidence(), Double::sum);
            }
        }
        return accessed;
    }

    private static String sourceContext(MemoryNode node) {
        String lastAction = node.properties().get(MemoryStore.LAST_ACTION);
        return lastAction != null ? lastAction : node.type().name().toLowerCase(Locale.ROOT);
    }
}
