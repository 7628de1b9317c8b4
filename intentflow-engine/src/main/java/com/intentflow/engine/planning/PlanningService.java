package com.intentflow.engine.planning;

import com.intentflow.core.exception.MemoryUnavailableException;
import com.intentflow.core.logging.LoggingContext;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.PlanStatus;
import com.intentflow.core.model.RankedContext;
import com.intentflow.core.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Turns an intent into a validated, topologically ordered plan.
 *
 * Memory is consulted first; when it is unavailable planning continues with an empty
 * context and the plan is flagged as context-degraded.
 */
public class PlanningService {

    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    public static final int DEFAULT_CONTEXT_LIMIT = 10;

    private final MemoryClient memory;
    private final IntentDecomposer decomposer;
    private final PlanValidator validator;
    private final int contextLimit;
    private final Clock clock;

    public PlanningService(MemoryClient memory, IntentDecomposer decomposer, PlanValidator validator,
                           int contextLimit, Clock clock) {
        this.memory = memory;
        this.decomposer = decomposer;
        this.validator = validator;
        this.contextLimit = contextLimit;
        this.clock = clock;
    }

    public Plan plan(PlanningRequest request) {
        try (LoggingContext ctx = LoggingContext.forTask(request.taskId())) {
            List<String> terms = decomposer.queryTerms(request.intent());
            List<RankedContext> context;
            boolean degraded = false;
            try {
                context = memory.retrieveContext(request.taskId(), request.roleScope(), terms, contextLimit);
            } catch (MemoryUnavailableException e) {
                log.warn("Memory unavailable, planning with an empty context: {}", e.getMessage());
                context = List.of();
                degraded = true;
            }

            List<Step> ordered = validator.validate(decomposer.decompose(request.intent(), context));

            UUID planId = UUID.randomUUID();
            List<Step> placed = ordered.stream()
                .map(s -> s.withPlacement(planId, s.sequenceIndex()))
                .toList();

            Plan plan = new Plan(planId, request.taskId(), request.version(), placed,
                PlanValidator.criticalPath(placed), 0.0, PlanStatus.PROPOSED, degraded,
                request.previousPlanId(), clock.instant());
            log.info("Planned version {} with {} steps {}{}", plan.version(), placed.size(),
                placed.stream().map(s -> s.action().name()).toList(), degraded ? " (context degraded)" : "");
            return plan;
        }
    }
}
