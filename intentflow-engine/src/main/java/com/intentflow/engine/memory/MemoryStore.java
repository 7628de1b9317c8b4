package com.intentflow.engine.memory;

import com.intentflow.core.bus.payload.PlanProposed;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.MemoryEdge;
import com.intentflow.core.model.MemoryNode;
import com.intentflow.core.model.NodeType;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.RankedContext;
import com.intentflow.core.model.RelationType;
import com.intentflow.core.model.Step;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.model.Task;
import com.intentflow.core.repository.MemoryGraphRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Relationship-graph memory of roles, action categories, entities and past activities.
 *
 * Ingestion only appends: nodes get a new version, edges get a superseding edge with the
 * new confidence. Each step result and each plan is ingested once, however often it is
 * delivered.
 */
public class MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryStore.class);

    public static final String LAST_ACTION = "lastAction";
    public static final String SENSITIVITY = "sensitivity";
    public static final String CATEGORY = "category";

    static final double INITIAL_CONFIDENCE = 0.5;
    static final double CONFIDENCE_STEP = 0.1;

    private final MemoryGraphRepository graph;
    private final ContextRanker ranker;
    private final Clock clock;
    private final Set<String> ingested = ConcurrentHashMap.newKeySet();

    public MemoryStore(MemoryGraphRepository graph, ContextRanker ranker, Clock clock) {
        this.graph = graph;
        this.ranker = ranker;
        this.clock = clock;
    }

    /**
     * Entities and activities visible to the role, best match first.
     */
    public List<RankedContext> retrieveContext(String roleScope, List<String> queryTerms, int limit) {
        List<MemoryNode> candidates = graph.currentNodes().stream()
            .filter(n -> n.type() == NodeType.ENTITY || n.type() == NodeType.ACTIVITY)
            .filter(n -> n.visibleTo(roleScope))
            .toList();
        return ranker.rank(candidates, roleScope, queryTerms, graph, limit);
    }

    /**
     * Record the results of a task's plan.
     */
    public void recordExecution(Task task, Plan plan, List<StepResult> results) {
        for (StepResult result : results) {
            Optional<Step> step = plan.step(result.stepId());
            if (step.isEmpty()) {
                continue;
            }
            ActionDescriptor action = result.kind() == StepKind.COMPENSATION
                ? step.get().compensatingAction()
                : step.get().action();
            if (action != null) {
                ingest(result, action, task.roleScope());
            }
        }
    }

    public void recordStepResult(StepResultMessage message) {
        ingest(message.result(), message.action(), message.roleScope());
    }

    /**
     * Make the targets of a proposed plan known, so later queries can resolve them.
     */
    public synchronized void recordPlanProposal(PlanProposed proposal) {
        Plan plan = proposal.plan();
        if (!ingested.add("plan:" + plan.planId())) {
            return;
        }
        Instant now = clock.instant();
        for (Step step : plan.steps()) {
            ActionDescriptor action = step.action();
            if (action.target() == null || action.target().isBlank()) {
                continue;
            }
            String categoryId = upsertCategory(action, now);
            String entityId = upsertEntity(action, proposal.roleScope(), Map.of(), now);
            linkOnce(entityId, categoryId, RelationType.IN_CATEGORY, now);
        }
        log.debug("Ingested plan {} of task {}", plan.planId(), plan.taskId());
    }

    private synchronized void ingest(StepResult result, ActionDescriptor action, String roleScope) {
        if (!ingested.add(result.dedupKey())) {
            log.debug("Result {} already ingested", result.dedupKey());
            return;
        }
        Instant now = clock.instant();
        String roleId = upsert(roleNodeId(roleScope), NodeType.ROLE, roleScope, Map.of(), roleScope, now);
        String categoryId = upsertCategory(action, now);

        String activityId = "activity:" + result.taskId() + ":" + result.stepId() + ":" + result.attempt()
            + (result.kind() == StepKind.COMPENSATION ? ":compensation" : "");
        Map<String, String> activityProps = new LinkedHashMap<>();
        activityProps.put(LAST_ACTION, action.name());
        activityProps.put(CATEGORY, action.category().name());
        activityProps.put("outcome", result.outcome().name());
        activityProps.put("taskId", result.taskId().toString());
        upsert(activityId, NodeType.ACTIVITY, action.name(), activityProps, roleScope, now);
        linkOnce(roleId, activityId, RelationType.PERFORMED, now);
        linkOnce(activityId, categoryId, RelationType.IN_CATEGORY, now);

        if (action.target() != null && !action.target().isBlank()) {
            Map<String, String> entityProps = new LinkedHashMap<>();
            entityProps.put(LAST_ACTION, action.name());
            String entityId = upsertEntity(action, roleScope, entityProps, now);
            linkOnce(activityId, entityId, RelationType.TARGETED, now);
            linkOnce(entityId, categoryId, RelationType.IN_CATEGORY, now);
        }

        if (result.isSuccess() && result.kind() == StepKind.FORWARD) {
            reinforce(roleId, categoryId, now);
        }
    }

    private String upsertCategory(ActionDescriptor action, Instant now) {
        String id = "category:" + action.category().name();
        if (graph.findNode(id).isEmpty()) {
            graph.saveNode(MemoryNode.create(id, NodeType.CATEGORY, action.category().name(), Map.of(),
                Set.of(MemoryNode.ANY_ROLE), 1.0, now));
        }
        return id;
    }

    private String upsertEntity(ActionDescriptor action, String roleScope, Map<String, String> extra, Instant now) {
        Map<String, String> props = new LinkedHashMap<>(extra);
        props.put(SENSITIVITY, action.sensitivity().name());
        props.put(CATEGORY, action.category().name());
        return upsert(entityNodeId(action.target()), NodeType.ENTITY, action.target(), props, roleScope, now);
    }

    private String upsert(String nodeId, NodeType type, String label, Map<String, String> props,
                          String roleScope, Instant now) {
        Optional<MemoryNode> existing = graph.findNode(nodeId);
        if (existing.isPresent()) {
            MemoryNode current = existing.get();
            graph.saveNode(current.nextVersion(props, roleScope, current.confidence(), now));
        } else {
            graph.saveNode(MemoryNode.create(nodeId, type, label, props, Set.of(roleScope), 1.0, now));
        }
        return nodeId;
    }

    private void linkOnce(String from, String to, RelationType relation, Instant now) {
        if (graph.currentEdge(from, to, relation).isEmpty()) {
            graph.saveEdge(MemoryEdge.create(from, to, relation, 1.0, now));
        }
    }

    private void reinforce(String roleId, String categoryId, Instant now) {
        Optional<MemoryEdge> current = graph.currentEdge(roleId, categoryId, RelationType.ACCESSED);
        if (current.isPresent()) {
            double confidence = Math.min(1.0, current.get().confidence() + CONFIDENCE_STEP);
            graph.saveEdge(current.get().supersede(confidence, now));
        } else {
            graph.saveEdge(MemoryEdge.create(roleId, categoryId, RelationType.ACCESSED, INITIAL_CONFIDENCE, now));
        }
    }

    public static String roleNodeId(String roleScope) {
        return "role:" + roleScope;
    }

    public static String entityNodeId(String target) {
        return "entity:" + target.trim().toLowerCase(Locale.ROOT);
    }
}
