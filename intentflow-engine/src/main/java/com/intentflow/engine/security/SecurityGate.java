package com.intentflow.engine.security;

import com.intentflow.core.bus.Topics;
import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.RiskLevel;
import com.intentflow.core.model.Step;
import com.intentflow.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scores a plan and decides whether it may run.
 *
 * Step scores come from {@link RiskScorer}; a step classified MEDIUM or above never
 * scores below the low threshold, so it always needs at least a confirmation. The plan
 * score is the highest step score plus a small share of the risk-weighted mean of all
 * steps, which orders plans with the same maximum. Every decision is written to the
 * audit chain before the orchestrator dispatches anything.
 */
public class SecurityGate {

    private static final Logger log = LoggerFactory.getLogger(SecurityGate.class);

    static final double TIE_BREAK_WEIGHT = 0.01;

    private final RiskScorer scorer;
    private final RiskThresholds thresholds;
    private final ConfirmationTokenService tokens;
    private final AuditLog auditLog;

    public SecurityGate(RiskScorer scorer, RiskThresholds thresholds,
                        ConfirmationTokenService tokens, AuditLog auditLog) {
        this.scorer = scorer;
        this.thresholds = thresholds;
        this.tokens = tokens;
        this.auditLog = auditLog;
    }

    public RiskThresholds thresholds() {
        return thresholds;
    }

    /**
     * Score the plan, decide and record the decision.
     *
     * @return The decision with the scored plan; a confirmation token when one is required
     */
    public GateDecision evaluate(Task task, Plan plan) {
        auditLog.requireIntact(task.taskId());

        Map<String, Double> stepScores = new LinkedHashMap<>();
        for (Step step : plan.steps()) {
            stepScores.put(step.stepId(), stepScore(step));
        }
        double aggregate = aggregate(stepScores.values());
        Plan scored = plan.withRiskScores(stepScores, aggregate);

        AuditDecision decision;
        if (aggregate >= thresholds.high()) {
            decision = AuditDecision.REJECTED;
        } else if (aggregate >= thresholds.low()) {
            decision = AuditDecision.CONFIRMATION_REQUESTED;
        } else {
            decision = AuditDecision.AUTO_APPROVED;
        }

        String action = "evaluate plan v" + plan.version() + " "
            + plan.steps().stream().map(s -> s.action().name()).collect(Collectors.joining(",", "[", "]"));
        auditLog.append(task.taskId(), null, Topics.SECURITY_GATE, action, aggregate, decision);

        IssuedToken confirmation = null;
        if (decision == AuditDecision.CONFIRMATION_REQUESTED) {
            confirmation = tokens.issue(task.taskId(), plan.planId());
        }
        log.info("Plan v{} of task {} scored {} -> {}", plan.version(), task.taskId(),
            String.format("%.3f", aggregate), decision);
        return new GateDecision(decision, aggregate, scored, confirmation);
    }

    /**
     * Redeem a confirmation token and record the confirmation.
     */
    public void confirm(Task task, Plan plan, String token, String actor) {
        tokens.redeem(task.taskId(), plan.planId(), token);
        auditLog.append(task.taskId(), null, actor, "confirm plan v" + plan.version(),
            plan.aggregateRiskScore(), AuditDecision.CONFIRMED);
    }

    double stepScore(Step step) {
        double score = scorer.score(step.action());
        if (step.riskLevel().isAtLeast(RiskLevel.MEDIUM)) {
            score = Math.max(score, thresholds.low());
        }
        return score;
    }

    static double aggregate(Iterable<Double> scores) {
        double max = 0.0;
        double sum = 0.0;
        double squares = 0.0;
        for (double score : scores) {
            max = Math.max(max, score);
            sum += score;
            squares += score * score;
        }
        double weightedMean = sum == 0.0 ? 0.0 : squares / sum;
        return RiskScorer.clamp(max + TIE_BREAK_WEIGHT * weightedMean);
    }
}
