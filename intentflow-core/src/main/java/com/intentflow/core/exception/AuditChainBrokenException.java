package com.intentflow.core.exception;

import java.util.UUID;

/**
 * Thrown when audit chain verification finds a mismatching link.
 */
public class AuditChainBrokenException extends OrchestratorException {

    public static final String ERROR_CODE = "AUDIT_CHAIN_BROKEN";

    public AuditChainBrokenException(UUID taskId, long sequence) {
        super(ERROR_CODE, String.format(
            "Audit chain of task %s is broken at entry %d",
            taskId, sequence
        ));
    }
}
