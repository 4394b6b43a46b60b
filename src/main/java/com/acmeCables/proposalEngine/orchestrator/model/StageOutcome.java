package com.acmeCables.proposalEngine.orchestrator.model;

public enum StageOutcome {
    SUCCESS,
    DEGRADED,
    FAILED
}
