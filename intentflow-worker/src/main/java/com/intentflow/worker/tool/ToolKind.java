package com.intentflow.worker.tool;

/**
 * How a generated tool is carried out.
 */
public enum ToolKind {
    /** Parameterised script run by a sandboxed interpreter. */
    SCRIPT,
    /** Recorded UI automation replayed by a computer-use agent. */
    AUTOMATION,
    /** Call into a third-party service API. */
    INTEGRATION
}
