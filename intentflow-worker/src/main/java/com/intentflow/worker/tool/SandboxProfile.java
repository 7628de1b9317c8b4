package com.intentflow.worker.tool;

/**
 * Isolation a tool runs under.
 */
public enum SandboxProfile {
    /** No writes outside a scratch area, no network. */
    READ_ONLY,
    /** Writes allowed to the user's workspace, network through an allow-list. */
    RESTRICTED,
    /** Writes allowed, no network at all. */
    NETWORK_ISOLATED
}
