package com.intentflow.worker;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.intentflow.core.exception.ToolSpecValidationException;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.worker.tool.SandboxProfile;
import com.intentflow.worker.tool.ToolKind;
import com.intentflow.worker.tool.ToolSpec;
import com.intentflow.worker.tool.ToolSpecValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorRegistryTest {

    private final StepExecutor fallback = context -> JsonNodeFactory.instance.textNode("fallback");
    private final StepExecutor specific = context -> JsonNodeFactory.instance.textNode("specific");

    @Test
    void resolve_shouldPreferExactActionName() {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register(ActionCategory.OPEN, fallback);
        registry.register(ActionCategory.OPEN, Set.of("open_file"), specific);

        assertSame(specific, registry.resolve(ActionDescriptor.of(ActionCategory.OPEN, "open_file", "a.pdf")).orElseThrow());
        assertSame(fallback, registry.resolve(ActionDescriptor.of(ActionCategory.OPEN, "open_application", "mail")).orElseThrow());
    }

    @Test
    void supports_shouldBeFalseForUnregisteredCategory() {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register(ActionCategory.READ, fallback);

        assertTrue(registry.supports(ActionDescriptor.of(ActionCategory.READ, "read_file", "notes.txt")));
        assertFalse(registry.supports(ActionDescriptor.of(ActionCategory.DELETE, "delete_file", "notes.txt")));
    }

    @Test
    void supports_shouldBeFalseForUnknownNameWithoutFallback() {
        ExecutorRegistry registry = new ExecutorRegistry();
        registry.register(ActionCategory.COMMUNICATE, Set.of("compose_email"), specific);

        assertFalse(registry.supports(ActionDescriptor.of(ActionCategory.COMMUNICATE, "send_sms", "bob")));
    }

    @Test
    void register_shouldEnforceBoundPerCategory() {
        ExecutorRegistry registry = new ExecutorRegistry(2, new ToolSpecValidator());
        registry.register(ActionCategory.COMPUTE, Set.of("a_one", "a_two"), specific);

        assertThrows(IllegalStateException.class,
            () -> registry.register(ActionCategory.COMPUTE, Set.of("a_three"), specific));
        // replacing an existing name does not grow the set
        assertDoesNotThrow(() -> registry.register(ActionCategory.COMPUTE, Set.of("a_one"), fallback));
        assertEquals(2, registry.size(ActionCategory.COMPUTE));
    }

    @Test
    void registerTool_shouldValidateBeforeRegistering() {
        ExecutorRegistry registry = new ExecutorRegistry();
        ToolSpec invalid = new ToolSpec("wipe_disk", ToolKind.SCRIPT, ActionCategory.DELETE,
            SandboxProfile.READ_ONLY, List.of());

        assertThrows(ToolSpecValidationException.class, () -> registry.registerTool(invalid, specific));
        assertFalse(registry.supports(ActionDescriptor.of(ActionCategory.DELETE, "wipe_disk", "/")));
    }

    @Test
    void registerTool_shouldRegisterUnderToolName() {
        ExecutorRegistry registry = new ExecutorRegistry();
        ToolSpec spec = new ToolSpec("archive_mail", ToolKind.AUTOMATION, ActionCategory.WRITE_SYSTEM_STATE,
            SandboxProfile.RESTRICTED, List.of());

        registry.registerTool(spec, specific);

        assertTrue(registry.supports(ActionDescriptor.of(ActionCategory.WRITE_SYSTEM_STATE, "archive_mail", "inbox")));
    }
}
