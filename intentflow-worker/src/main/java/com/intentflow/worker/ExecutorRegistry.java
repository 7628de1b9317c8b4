package com.intentflow.worker;

import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.spi.CapabilityRegistry;
import com.intentflow.worker.tool.ToolSpec;
import com.intentflow.worker.tool.ToolSpecValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps action categories to a bounded set of executors.
 *
 * An executor is registered either for specific action names within a category or as
 * the category's fallback. Plans are checked against this registry when they are
 * validated, so an action without an executor never reaches dispatch.
 */
public class ExecutorRegistry implements CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    public static final int DEFAULT_MAX_PER_CATEGORY = 4;
    private static final String ANY_ACTION = "*";

    private final int maxPerCategory;
    private final ToolSpecValidator toolSpecValidator;
    private final Map<ActionCategory, Map<String, StepExecutor>> executors = new EnumMap<>(ActionCategory.class);

    public ExecutorRegistry() {
        this(DEFAULT_MAX_PER_CATEGORY, new ToolSpecValidator());
    }

    public ExecutorRegistry(int maxPerCategory, ToolSpecValidator toolSpecValidator) {
        this.maxPerCategory = maxPerCategory;
        this.toolSpecValidator = toolSpecValidator;
    }

    /**
     * Register the fallback executor of a category.
     */
    public void register(ActionCategory category, StepExecutor executor) {
        put(category, ANY_ACTION, executor);
    }

    /**
     * Register an executor for the named actions of a category.
     */
    public void register(ActionCategory category, Set<String> actionNames, StepExecutor executor) {
        for (String actionName : actionNames) {
            put(category, actionName, executor);
        }
    }

    /**
     * Validate a generated tool and register its executor under the tool name.
     *
     * @throws com.intentflow.core.exception.ToolSpecValidationException if the spec is invalid
     */
    public void registerTool(ToolSpec spec, StepExecutor executor) {
        toolSpecValidator.validate(spec);
        put(spec.category(), spec.name(), executor);
        log.info("Registered {} tool {} ({}, sandbox {})",
            spec.kind(), spec.name(), spec.category(), spec.sandboxProfile());
    }

    /**
     * Find the executor for an action: an exact name match first, then the category fallback.
     */
    public synchronized Optional<StepExecutor> resolve(ActionDescriptor action) {
        Map<String, StepExecutor> byName = executors.get(action.category());
        if (byName == null) {
            return Optional.empty();
        }
        StepExecutor exact = byName.get(action.name());
        return Optional.ofNullable(exact != null ? exact : byName.get(ANY_ACTION));
    }

    @Override
    public boolean supports(ActionDescriptor action) {
        return resolve(action).isPresent();
    }

    public synchronized int size(ActionCategory category) {
        Map<String, StepExecutor> byName = executors.get(category);
        return byName == null ? 0 : byName.size();
    }

    private synchronized void put(ActionCategory category, String actionName, StepExecutor executor) {
        Map<String, StepExecutor> byName = executors.computeIfAbsent(category, c -> new LinkedHashMap<>());
        if (!byName.containsKey(actionName) && byName.size() >= maxPerCategory) {
            throw new IllegalStateException(String.format(
                "Category %s already has %d executors", category, maxPerCategory));
        }
        byName.put(actionName, executor);
        log.debug("Registered executor for {}/{}", category, actionName);
    }
}
