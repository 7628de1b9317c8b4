package com.intentflow.learning;

import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.DataSensitivity;
import com.intentflow.core.model.FeedbackRecord;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.spi.PlanningHeuristics;
import com.intentflow.core.spi.RiskSignalProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Learns from finished work and human feedback.
 *
 * Keeps one exponential-moving-average weight per (action category, data sensitivity)
 * class. Samples are 1.0 for a failed or timed out forward attempt, 0.0 for a success,
 * and {@code (5 - rating) / 4} for feedback on a task that touched the class. Samples
 * arriving within the evaluation window of the previous revision are held back and
 * folded in as their mean at the next revision, so a class is revised at most once
 * per window.
 *
 * Raw observations are kept append-only; only the derived weights ever change.
 */
public class LearningService implements RiskSignalProvider, PlanningHeuristics {

    private static final Logger log = LoggerFactory.getLogger(LearningService.class);

    private static final int MAX_TRACKED_RESULTS = 100_000;

    /**
     * Tuning of the learner.
     *
     * @param smoothing        EMA factor applied to each revision, in (0, 1]
     * @param evaluationWindow minimum time between two revisions of one class
     * @param minWeight        lower bound of a learned weight
     * @param maxWeight        upper bound of a learned weight
     */
    public record Settings(double smoothing, Duration evaluationWindow, double minWeight, double maxWeight) {

        public Settings {
            if (smoothing <= 0.0 || smoothing > 1.0) {
                throw new IllegalArgumentException("smoothing must be in (0, 1]");
            }
            if (minWeight > maxWeight) {
                throw new IllegalArgumentException("minWeight must not exceed maxWeight");
            }
            evaluationWindow = evaluationWindow != null ? evaluationWindow : Duration.ZERO;
        }

        public static Settings defaults() {
            return new Settings(0.2, Duration.ofMinutes(1), 0.0, 1.0);
        }
    }

    /**
     * A risk class the learner keeps a weight for.
     */
    public record SignalKey(ActionCategory category, DataSensitivity sensitivity) {
        @Override
        public String toString() {
            return category + "/" + sensitivity;
        }
    }

    /**
     * One raw observation; never rewritten once recorded.
     */
    public record Observation(SignalKey key, UUID taskId, String source, double sample, Instant observedAt) {
    }

    private static final class WeightState {
        double weight;
        int revisions;
        Instant lastRevisedAt;
        final List<Double> pending = new ArrayList<>();
    }

    private final Settings settings;
    private final Clock clock;

    private final Map<SignalKey, WeightState> weights = new HashMap<>();
    private final Map<ActionCategory, Double> durationsMs = new EnumMap<>(ActionCategory.class);
    private final Map<UUID, Set<SignalKey>> classesByTask = new HashMap<>();
    // most recent dedup keys; redeliveries arrive close to the original
    private final Set<String> ingestedResults = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > MAX_TRACKED_RESULTS;
        }
    });
    private final List<Observation> observations = new ArrayList<>();
    private final List<FeedbackRecord> feedback = new ArrayList<>();

    public LearningService(Settings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    // ========== Ingestion ==========

    public synchronized void recordStepResult(StepResultMessage message) {
        StepResult result = message.result();
        if (message.action() == null || result.kind() != StepKind.FORWARD) {
            return;
        }
        if (!ingestedResults.add(result.dedupKey())) {
            log.debug("Duplicate step result {} ignored", result.dedupKey());
            return;
        }
        SignalKey key = new SignalKey(message.action().category(), message.action().sensitivity());
        classesByTask.computeIfAbsent(result.taskId(), id -> new LinkedHashSet<>()).add(key);

        double sample = result.isSuccess() ? 0.0 : 1.0;
        observe(new Observation(key, result.taskId(), "step:" + result.dedupKey(), sample, clock.instant()));

        if (result.isSuccess() && result.durationMs() > 0) {
            durationsMs.merge(key.category(), (double) result.durationMs(),
                (previous, observed) -> ema(previous, observed));
        }
    }

    public synchronized void recordFeedback(FeedbackRecord record) {
        feedback.add(record);
        Set<SignalKey> classes = classesByTask.getOrDefault(record.taskId(), Set.of());
        if (classes.isEmpty()) {
            log.debug("Feedback for task {} has no observed steps; stored without revision", record.taskId());
            return;
        }
        double sample = (double) (FeedbackRecord.MAX_RATING - record.humanRating())
            / (FeedbackRecord.MAX_RATING - FeedbackRecord.MIN_RATING);
        for (SignalKey key : classes) {
            observe(new Observation(key, record.taskId(), "feedback", sample, clock.instant()));
        }
    }

    private void observe(Observation observation) {
        observations.add(observation);
        WeightState state = weights.computeIfAbsent(observation.key(), k -> {
            WeightState fresh = new WeightState();
            fresh.weight = settings.minWeight();
            return fresh;
        });
        state.pending.add(observation.sample());
        reviseIfDue(observation.key(), state, observation.observedAt());
    }

    /**
     * Folds pending samples into any class whose evaluation window has elapsed.
     */
    public synchronized int evaluateDue() {
        Instant now = clock.instant();
        int revised = 0;
        for (Map.Entry<SignalKey, WeightState> entry : weights.entrySet()) {
            if (reviseIfDue(entry.getKey(), entry.getValue(), now)) {
                revised++;
            }
        }
        return revised;
    }

    private boolean reviseIfDue(SignalKey key, WeightState state, Instant now) {
        if (state.pending.isEmpty()) {
            return false;
        }
        if (state.lastRevisedAt != null
                && now.isBefore(state.lastRevisedAt.plus(settings.evaluationWindow()))) {
            return false;
        }
        double mean = state.pending.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double previous = state.weight;
        state.weight = clamp(ema(previous, mean));
        state.revisions++;
        state.lastRevisedAt = now;
        log.debug("Revised weight {}: {} -> {} from {} samples", key, previous, state.weight, state.pending.size());
        state.pending.clear();
        return true;
    }

    // ========== Signals ==========

    @Override
    public synchronized double historicalSignal(ActionCategory category, DataSensitivity sensitivity) {
        WeightState state = weights.get(new SignalKey(category, sensitivity));
        return state != null ? state.weight : settings.minWeight();
    }

    @Override
    public synchronized Optional<Duration> expectedDuration(ActionCategory category) {
        Double millis = durationsMs.get(category);
        return millis != null ? Optional.of(Duration.ofMillis(Math.round(millis))) : Optional.empty();
    }

    // ========== Introspection ==========

    public synchronized Map<SignalKey, Double> weights() {
        Map<SignalKey, Double> snapshot = new LinkedHashMap<>();
        weights.forEach((key, state) -> snapshot.put(key, state.weight));
        return Collections.unmodifiableMap(snapshot);
    }

    public synchronized int revisions(SignalKey key) {
        WeightState state = weights.get(key);
        return state != null ? state.revisions : 0;
    }

    public synchronized List<Observation> observations() {
        return List.copyOf(observations);
    }

    public synchronized List<FeedbackRecord> feedback() {
        return List.copyOf(feedback);
    }

    private double ema(double previous, double sample) {
        return previous + settings.smoothing() * (sample - previous);
    }

    private double clamp(double value) {
        return Math.max(settings.minWeight(), Math.min(settings.maxWeight(), value));
    }
}
