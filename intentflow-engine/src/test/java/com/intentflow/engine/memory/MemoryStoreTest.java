package com.intentflow.engine.memory;

import com.intentflow.core.bus.payload.PlanProposed;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.DataSensitivity;
import com.intentflow.core.model.MemoryEdge;
import com.intentflow.core.model.MemoryNode;
import com.intentflow.core.model.NodeType;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.PlanStatus;
import com.intentflow.core.model.RankedContext;
import com.intentflow.core.model.RelationType;
import com.intentflow.core.model.Step;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.test.TimeController;
import com.intentflow.engine.persistence.InMemoryMemoryGraphRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MemoryStoreTest {

    private final TimeController time = TimeController.frozen();
    private final UUID taskId = UUID.randomUUID();
    private final UUID planId = UUID.randomUUID();
    private InMemoryMemoryGraphRepository graph;
    private MemoryStore store;

    @BeforeEach
    void setUp() {
        graph = new InMemoryMemoryGraphRepository();
        store = new MemoryStore(graph, new ContextRanker(Duration.ofDays(7), 1.0, time), time);
    }

    private StepResultMessage opened(String stepId, String target) {
        ActionDescriptor action = ActionDescriptor.of(ActionCategory.OPEN, "open_file", target)
            .withSensitivity(DataSensitivity.CONFIDENTIAL);
        StepResult result = StepResult.success(taskId, planId, stepId, 1, StepKind.FORWARD, null, 20, time.now());
        return new StepResultMessage(result, action, "analyst");
    }

    @Test
    @DisplayName("Executed steps become entities and activities the role can retrieve")
    void shouldIngestStepResult() {
        store.recordStepResult(opened("s1", "Quarterly Report"));

        List<RankedContext> context = store.retrieveContext("analyst", List.of("quarterly"), 10);

        assertThat(context).extracting(RankedContext::nodeId).contains("entity:quarterly report");
        RankedContext entity = context.stream().filter(c -> c.type() == NodeType.ENTITY).findFirst().orElseThrow();
        assertThat(entity.properties()).containsEntry(MemoryStore.SENSITIVITY, "CONFIDENTIAL");
        assertThat(entity.sourceContext()).isEqualTo("open_file");
    }

    @Test
    @DisplayName("Context of one role is not visible to another")
    void shouldScopeContextByRole() {
        store.recordStepResult(opened("s1", "Quarterly Report"));

        assertThat(store.retrieveContext("guest", List.of("quarterly"), 10)).isEmpty();
    }

    @Test
    @DisplayName("A redelivered result is ingested once")
    void shouldIngestOnce() {
        StepResultMessage message = opened("s1", "Quarterly Report");

        store.recordStepResult(message);
        store.recordStepResult(message);

        assertThat(graph.nodeHistory("entity:quarterly report")).hasSize(1);
        assertThat(graph.edgeHistory("role:analyst", "category:OPEN")).hasSize(1);
    }

    @Test
    @DisplayName("Repeated success reinforces the role's category edge by superseding it")
    void shouldReinforceAccessedCategory() {
        store.recordStepResult(opened("s1", "Quarterly Report"));
        time.advanceMinutes(5);
        store.recordStepResult(opened("s2", "Budget"));

        MemoryEdge current = graph.currentEdge("role:analyst", "category:OPEN", RelationType.ACCESSED).orElseThrow();
        assertThat(current.confidence()).isCloseTo(0.6, within(1e-9));
        assertThat(current.supersedesEdgeId()).isNotNull();
        assertThat(graph.edgeHistory("role:analyst", "category:OPEN")).hasSize(2);
    }

    @Test
    @DisplayName("Updating an entity appends a version and keeps the earlier one")
    void shouldVersionNodes() {
        store.recordStepResult(opened("s1", "Quarterly Report"));
        time.advanceMinutes(1);
        store.recordStepResult(opened("s2", "quarterly report"));

        assertThat(graph.nodeHistory("entity:quarterly report")).extracting(MemoryNode::version).containsExactly(1, 2);
        assertThat(graph.findNode("entity:quarterly report").orElseThrow().updatedAt()).isEqualTo(time.now());
    }

    @Test
    @DisplayName("Targets of a proposed plan are known before anything runs")
    void shouldRecordPlanTargets() {
        Step step = Step.builder("s1", ActionDescriptor.of(ActionCategory.COMMUNICATE, "compose_email", "manager"))
            .planId(planId)
            .build();
        Plan plan = new Plan(planId, taskId, 1, List.of(step), Duration.ofSeconds(10), 0.5, PlanStatus.PROPOSED,
            false, null, time.now());

        store.recordPlanProposal(new PlanProposed(plan, "email my manager", "analyst"));
        store.recordPlanProposal(new PlanProposed(plan, "email my manager", "analyst"));

        assertThat(store.retrieveContext("analyst", List.of("manager"), 5))
            .extracting(RankedContext::nodeId).containsExactly("entity:manager");
        assertThat(graph.nodeHistory("entity:manager")).hasSize(1);
    }
}
