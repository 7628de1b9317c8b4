package com.intentflow.core.exception;

import java.util.List;

/**
 * Thrown when a generated tool specification does not satisfy the tool schema.
 */
public class ToolSpecValidationException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_TOOL_SPEC";

    public ToolSpecValidationException(String toolName, List<String> violations) {
        super(ERROR_CODE, String.format(
            "Tool spec %s rejected: %s",
            toolName, String.join("; ", violations)
        ));
    }
}
