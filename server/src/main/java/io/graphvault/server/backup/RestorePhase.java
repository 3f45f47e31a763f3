package io.graphvault.server.backup;

/**
 * Restore state machine:
 * IDLE -> VALIDATING -> CLEARING -> CREATING_NODES -> CREATING_RELATIONSHIPS -> DONE,
 * with FAILED reachable from any phase. Selective restore skips CLEARING.
 */
public enum RestorePhase {
    IDLE,
    VALIDATING,
    CLEARING,
    CREATING_NODES,
    CREATING_RELATIONSHIPS,
    DONE,
    FAILED
}
