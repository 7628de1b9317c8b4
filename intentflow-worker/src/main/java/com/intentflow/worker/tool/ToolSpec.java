package com.intentflow.worker.tool;

import com.intentflow.core.model.ActionCategory;

import java.util.List;

/**
 * Declaration of a generated tool. Tools are only registered after
 * {@link ToolSpecValidator} accepts the declaration.
 */
public record ToolSpec(
    String name,
    ToolKind kind,
    ActionCategory category,
    SandboxProfile sandboxProfile,
    List<ToolParameter> parameters
) {
    public ToolSpec {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }
}
