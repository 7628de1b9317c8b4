package com.intentflow.worker.tool;

import com.intentflow.core.exception.ToolSpecValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a {@link ToolSpec} against the fixed tool schema.
 */
public class ToolSpecValidator {

    public static final int MAX_PARAMETERS = 16;
    public static final Set<String> PARAMETER_TYPES = Set.of("string", "number", "boolean");

    private static final Pattern NAME_PATTERN = Pattern.compile("[a-z][a-z0-9_]{2,63}");

    /**
     * @return Every rule the spec breaks; empty when it is valid
     */
    public List<String> violations(ToolSpec spec) {
        List<String> violations = new ArrayList<>();
        if (spec.name() == null || !NAME_PATTERN.matcher(spec.name()).matches()) {
            violations.add("name must match " + NAME_PATTERN.pattern());
        }
        if (spec.kind() == null) {
            violations.add("kind is required");
        }
        if (spec.category() == null) {
            violations.add("category is required");
        }
        if (spec.sandboxProfile() == null) {
            violations.add("sandboxProfile is required");
        }

        if (spec.parameters().size() > MAX_PARAMETERS) {
            violations.add("at most " + MAX_PARAMETERS + " parameters are allowed");
        }
        Set<String> seen = new HashSet<>();
        for (ToolParameter parameter : spec.parameters()) {
            if (parameter.name() == null || !NAME_PATTERN.matcher(parameter.name()).matches()) {
                violations.add("parameter name '" + parameter.name() + "' must match " + NAME_PATTERN.pattern());
            } else if (!seen.add(parameter.name())) {
                violations.add("duplicate parameter '" + parameter.name() + "'");
            }
            if (!PARAMETER_TYPES.contains(parameter.type())) {
                violations.add("parameter '" + parameter.name() + "' has unsupported type " + parameter.type());
            }
        }

        if (spec.category() != null && spec.category().hasSideEffects()
                && spec.sandboxProfile() == SandboxProfile.READ_ONLY) {
            violations.add(spec.category() + " tools cannot run READ_ONLY");
        }
        if (spec.kind() == ToolKind.INTEGRATION && spec.sandboxProfile() == SandboxProfile.NETWORK_ISOLATED) {
            violations.add("INTEGRATION tools need network access");
        }
        return violations;
    }

    /**
     * @throws ToolSpecValidationException if the spec breaks any rule
     */
    public void validate(ToolSpec spec) {
        List<String> violations = violations(spec);
        if (!violations.isEmpty()) {
            throw new ToolSpecValidationException(spec.name(), violations);
        }
    }
}
