package com.intentflow.engine.planning;

import com.intentflow.core.exception.PlanValidationException;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.DataSensitivity;
import com.intentflow.core.model.NodeType;
import com.intentflow.core.model.RankedContext;
import com.intentflow.core.model.RetryPolicy;
import com.intentflow.core.model.Step;
import com.intentflow.core.spi.PlanningHeuristics;
import com.intentflow.engine.memory.MemoryStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentDecomposerTest {

    private final IntentDecomposer decomposer =
        new IntentDecomposer(PlanningHeuristics.none(), RetryPolicy.defaultPolicy());

    @Test
    @DisplayName("Open, summarize and email becomes a three step chain")
    void shouldDecomposeReportSummaryEmail() {
        List<Step> steps = decomposer.decompose(
            "Open the quarterly report, summarize it and email the summary to my manager", List.of());

        assertThat(steps).extracting(s -> s.action().name())
            .containsExactly("open_file", "extract_summary", "compose_email");
        assertThat(steps).extracting(Step::stepId).containsExactly("s1", "s2", "s3");

        Step open = steps.get(0);
        assertThat(open.dependsOn()).isEmpty();
        assertThat(open.action().target()).isEqualTo("quarterly report");
        assertThat(open.action().sensitivity()).isEqualTo(DataSensitivity.CONFIDENTIAL);
        assertThat(open.compensatingAction().name()).isEqualTo("close_file");

        Step summarize = steps.get(1);
        assertThat(summarize.dependsOn()).containsExactly("s1");
        assertThat(summarize.hasCompensation()).isFalse();
        assertThat(summarize.action().target()).isEqualTo("quarterly report");
        assertThat(summarize.parallelSafe()).isTrue();

        Step email = steps.get(2);
        assertThat(email.action().category()).isEqualTo(ActionCategory.COMMUNICATE);
        assertThat(email.dependsOn()).containsExactly("s2");
        assertThat(email.action().parameters()).containsEntry("input", "s2");
        assertThat(email.action().sensitivity()).isEqualTo(DataSensitivity.CONFIDENTIAL);
        assertThat(email.compensatingAction().name()).isEqualTo("discard_draft");
        assertThat(email.parallelSafe()).isFalse();
    }

    @Test
    @DisplayName("Emailing a summary nobody extracted adds the extraction step")
    void shouldInsertSummaryStep() {
        List<Step> steps = decomposer.decompose("Open the report and email the summary to alice", List.of());

        assertThat(steps).extracting(s -> s.action().name())
            .containsExactly("open_file", "extract_summary", "compose_email");
        assertThat(steps.get(1).action().target()).isEqualTo("report");
        assertThat(steps.get(2).dependsOn()).containsExactly("s2");
    }

    @Test
    @DisplayName("\"and\" joining two objects stays inside one clause")
    void shouldKeepConjoinedObjectsTogether() {
        List<Step> steps = decomposer.decompose("Email the summary to Tom and Jerry", List.of());

        assertThat(steps).extracting(s -> s.action().name()).containsExactly("compose_email");
        assertThat(steps.get(0).action().target()).isEqualTo("summary to tom and jerry");
    }

    @Test
    @DisplayName("\"and\" followed by a verb starts a new clause, fillers allowed")
    void shouldSplitOnAndBeforeVerb() {
        List<Step> steps = decomposer.decompose("read the notes and please summarize them", List.of());

        assertThat(steps).extracting(s -> s.action().name()).containsExactly("read_content", "extract_summary");
        assertThat(steps.get(1).action().target()).isEqualTo("notes");
    }

    @Test
    @DisplayName("Targets resolve against remembered entities and take their sensitivity")
    void shouldResolveTargetFromContext() {
        RankedContext remembered = new RankedContext("entity:budget report", "budget report", NodeType.ENTITY,
            1.0, 1.0, 0.0, 1.0, "open_file", Instant.now(),
            Map.of(MemoryStore.SENSITIVITY, DataSensitivity.RESTRICTED.name()));

        List<Step> steps = decomposer.decompose("open the budget", List.of(remembered));

        assertThat(steps).hasSize(1);
        assertThat(steps.get(0).action().target()).isEqualTo("budget report");
        assertThat(steps.get(0).action().sensitivity()).isEqualTo(DataSensitivity.RESTRICTED);
        assertThat(steps.get(0).action().name()).isEqualTo("open_file");
    }

    @Test
    @DisplayName("Opening something that is not a document opens an application")
    void shouldOpenApplication() {
        Step step = decomposer.decompose("please open calculator", List.of()).get(0);

        assertThat(step.action().name()).isEqualTo("open_application");
        assertThat(step.compensatingAction().name()).isEqualTo("close_application");
    }

    @Test
    @DisplayName("Unknown verbs and empty intents are rejected")
    void shouldRejectUnplannableIntent() {
        assertThatThrownBy(() -> decomposer.decompose("juggle the oranges", List.of()))
            .isInstanceOf(PlanValidationException.class)
            .hasMessageContaining("juggle");
        assertThatThrownBy(() -> decomposer.decompose("  ", List.of()))
            .isInstanceOf(PlanValidationException.class);
    }

    @Test
    @DisplayName("Learned durations replace category defaults")
    void shouldUseLearnedDurations() {
        PlanningHeuristics learned = category -> category == ActionCategory.COMPUTE
            ? Optional.of(Duration.ofSeconds(42))
            : Optional.empty();
        IntentDecomposer withHeuristics = new IntentDecomposer(learned, RetryPolicy.defaultPolicy());

        List<Step> steps = withHeuristics.decompose("read the notes then summarize them", List.of());

        assertThat(steps.get(0).estimatedDuration()).isEqualTo(ActionCategory.READ.defaultDuration());
        assertThat(steps.get(1).estimatedDuration()).isEqualTo(Duration.ofSeconds(42));
    }

    @Test
    @DisplayName("Query terms drop verbs, stop words and short words")
    void shouldExtractQueryTerms() {
        assertThat(decomposer.queryTerms("Open the quarterly report and email it to me"))
            .containsExactly("quarterly", "report");
    }
}
