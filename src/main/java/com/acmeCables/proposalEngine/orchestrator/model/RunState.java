package com.acmeCables.proposalEngine.orchestrator.model;

/**
 * Lifecycle of one proposal run.
 *
 * <pre>
 * LOADED -> MATCHED -> PRICED -> SYNTHESIZED -> COMPLETE
 *    \__________\__________\___________\______-> FAILED
 * </pre>
 */
public enum RunState {
    LOADED,
    MATCHED,
    PRICED,
    SYNTHESIZED,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
