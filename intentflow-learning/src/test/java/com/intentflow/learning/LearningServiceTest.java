package com.intentflow.learning;

import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.DataSensitivity;
import com.intentflow.core.model.FeedbackRecord;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.test.TimeController;
import com.intentflow.learning.LearningService.SignalKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LearningServiceTest {

    private static final ActionDescriptor EMAIL =
        ActionDescriptor.of(ActionCategory.COMMUNICATE, "send_email", "bob").withSensitivity(DataSensitivity.CONFIDENTIAL);
    private static final SignalKey EMAIL_KEY = new SignalKey(ActionCategory.COMMUNICATE, DataSensitivity.CONFIDENTIAL);

    private TimeController clock;
    private LearningService learning;
    private UUID taskId;

    @BeforeEach
    void setUp() {
        clock = TimeController.frozen();
        learning = new LearningService(LearningService.Settings.defaults(), clock);
        taskId = UUID.randomUUID();
    }

    private StepResultMessage failed(String stepId, int attempt) {
        return new StepResultMessage(StepResult.failure(taskId, UUID.randomUUID(), stepId, attempt, StepKind.FORWARD,
            "SMTP_DOWN", "mail server unreachable", true, 120, clock.instant()), EMAIL, "alice");
    }

    private StepResultMessage succeeded(String stepId, int attempt, ActionDescriptor action, long durationMs) {
        return new StepResultMessage(StepResult.success(taskId, UUID.randomUUID(), stepId, attempt, StepKind.FORWARD,
            null, durationMs, clock.instant()), action, "alice");
    }

    @Test
    @DisplayName("Unseen classes report the minimum weight")
    void unseenClassIsNeutral() {
        assertThat(learning.historicalSignal(ActionCategory.DELETE, DataSensitivity.RESTRICTED)).isEqualTo(0.0);
        assertThat(learning.expectedDuration(ActionCategory.DELETE)).isEmpty();
    }

    @Test
    @DisplayName("A failure moves the weight toward 1 by the smoothing factor")
    void failureRaisesWeight() {
        learning.recordStepResult(failed("s1", 1));

        assertThat(learning.historicalSignal(ActionCategory.COMMUNICATE, DataSensitivity.CONFIDENTIAL))
            .isCloseTo(0.2, within(1e-9));
        assertThat(learning.historicalSignal(ActionCategory.COMMUNICATE, DataSensitivity.PUBLIC)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("A redelivered step result is learned from once")
    void duplicateResultIsIgnored() {
        StepResultMessage result = failed("s1", 1);
        learning.recordStepResult(result);
        learning.recordStepResult(result);

        clock.advanceSeconds(61);
        learning.evaluateDue();

        assertThat(learning.historicalSignal(ActionCategory.COMMUNICATE, DataSensitivity.CONFIDENTIAL))
            .isCloseTo(0.2, within(1e-9));
        assertThat(learning.observations()).hasSize(1);
        assertThat(learning.revisions(EMAIL_KEY)).isEqualTo(1);
    }

    @Test
    @DisplayName("At most one revision per class per evaluation window")
    void revisionsAreRateLimited() {
        learning.recordStepResult(failed("s1", 1));

        // Inside the window: held back
        clock.advanceSeconds(10);
        learning.recordStepResult(succeeded("s1", 2, EMAIL, 100));
        clock.advanceSeconds(10);
        learning.recordStepResult(failed("s2", 1));
        assertThat(learning.revisions(EMAIL_KEY)).isEqualTo(1);
        assertThat(learning.weights()).containsEntry(EMAIL_KEY, 0.2);

        // Window elapsed: pending mean (0, 1, 1) folded in once
        clock.advanceSeconds(41);
        learning.recordStepResult(failed("s3", 1));

        assertThat(learning.revisions(EMAIL_KEY)).isEqualTo(2);
        double mean = 2.0 / 3.0;
        assertThat(learning.historicalSignal(ActionCategory.COMMUNICATE, DataSensitivity.CONFIDENTIAL))
            .isCloseTo(0.2 + 0.2 * (mean - 0.2), within(1e-9));
    }

    @Test
    @DisplayName("evaluateDue flushes samples held back by the window")
    void evaluateDueFlushesPending() {
        learning.recordStepResult(failed("s1", 1));
        clock.advanceSeconds(5);
        learning.recordStepResult(failed("s2", 1));
        assertThat(learning.evaluateDue()).isZero();

        clock.advanceMinutes(1);

        assertThat(learning.evaluateDue()).isEqualTo(1);
        assertThat(learning.historicalSignal(ActionCategory.COMMUNICATE, DataSensitivity.CONFIDENTIAL))
            .isCloseTo(0.2 + 0.2 * 0.8, within(1e-9));
        assertThat(learning.evaluateDue()).isZero();
    }

    @Test
    @DisplayName("Weights stay within the configured bounds")
    void weightsAreClamped() {
        learning = new LearningService(new LearningService.Settings(1.0, Duration.ZERO, 0.1, 0.5), clock);

        learning.recordStepResult(failed("s1", 1));
        assertThat(learning.historicalSignal(ActionCategory.COMMUNICATE, DataSensitivity.CONFIDENTIAL)).isEqualTo(0.5);

        learning.recordStepResult(succeeded("s1", 2, EMAIL, 50));
        assertThat(learning.historicalSignal(ActionCategory.COMMUNICATE, DataSensitivity.CONFIDENTIAL)).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Poor feedback raises the weight of every class the task touched")
    void feedbackAppliesToTouchedClasses() {
        learning = new LearningService(new LearningService.Settings(0.2, Duration.ZERO, 0.0, 1.0), clock);
        ActionDescriptor open = ActionDescriptor.of(ActionCategory.OPEN, "open_file", "report.pdf");
        learning.recordStepResult(succeeded("s1", 1, open, 200));
        learning.recordStepResult(succeeded("s2", 1, EMAIL, 900));

        learning.recordFeedback(new FeedbackRecord(taskId, 1, "sent to the wrong person", clock.instant()));

        assertThat(learning.historicalSignal(ActionCategory.OPEN, DataSensitivity.INTERNAL)).isCloseTo(0.2, within(1e-9));
        assertThat(learning.historicalSignal(ActionCategory.COMMUNICATE, DataSensitivity.CONFIDENTIAL))
            .isCloseTo(0.2, within(1e-9));
        assertThat(learning.feedback()).hasSize(1);
    }

    @Test
    @DisplayName("Feedback for an unknown task is kept but changes nothing")
    void feedbackWithoutHistoryIsStoredOnly() {
        learning.recordFeedback(new FeedbackRecord(UUID.randomUUID(), 2, null, clock.instant()));

        assertThat(learning.feedback()).hasSize(1);
        assertThat(learning.weights()).isEmpty();
        assertThat(learning.observations()).isEmpty();
    }

    @Test
    @DisplayName("Compensation results do not feed risk weights")
    void compensationResultsIgnored() {
        StepResult compensation = StepResult.failure(taskId, UUID.randomUUID(), "s1", 1, StepKind.COMPENSATION,
            "UNDO_FAILED", "could not recall", false, 10, clock.instant());

        learning.recordStepResult(new StepResultMessage(compensation, EMAIL, "alice"));

        assertThat(learning.weights()).isEmpty();
    }

    @Test
    @DisplayName("Durations of successful steps are averaged per category")
    void durationEstimates() {
        ActionDescriptor summarize = ActionDescriptor.of(ActionCategory.COMPUTE, "summarize", "report.pdf");

        learning.recordStepResult(succeeded("s1", 1, summarize, 4000));
        assertThat(learning.expectedDuration(ActionCategory.COMPUTE)).contains(Duration.ofSeconds(4));

        learning.recordStepResult(succeeded("s2", 1, summarize, 9000));
        assertThat(learning.expectedDuration(ActionCategory.COMPUTE)).contains(Duration.ofSeconds(5));

        // Failures carry no duration signal
        learning.recordStepResult(failed("s3", 1));
        assertThat(learning.expectedDuration(ActionCategory.COMMUNICATE)).isEmpty();
    }

    @Test
    @DisplayName("Raw observations are only ever appended")
    void observationsAppendOnly() {
        learning.recordStepResult(failed("s1", 1));
        clock.advanceSeconds(1);
        learning.recordStepResult(failed("s1", 2));

        assertThat(learning.observations()).hasSize(2);
        assertThat(learning.observations().get(0).source()).isEqualTo("step:" + taskId + ":s1:1");
        assertThat(learning.observations().get(1).observedAt()).isEqualTo(clock.instant());
    }
}
