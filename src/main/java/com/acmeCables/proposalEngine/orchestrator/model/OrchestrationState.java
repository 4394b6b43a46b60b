package com.acmeCables.proposalEngine.orchestrator.model;

import com.acmeCables.proposalEngine.match.model.MatchResult;
import com.acmeCables.proposalEngine.pricing.model.PricingSummary;
import com.acmeCables.proposalEngine.rfp.model.Rfp;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Orchestration state - the in-progress proposal of one run.
 *
 * Owned and written only by the orchestrator thread; each field is set once, after the
 * stage producing it has completed.
 */
@Data
@Builder
public class OrchestrationState {

    private String rfpId;

    private String correlationId;

    @Builder.Default
    private RunState runState = RunState.LOADED;

    private Rfp rfp;

    /**
     * Result of the match stage, one entry per RFP item in RFP order.
     */
    private StageResult<List<MatchResult>> matchStage;

    private PricingSummary pricing;

    /**
     * Result of the narrative stage; degraded with a null value when synthesis failed.
     */
    private StageResult<String> narrativeStage;

    /**
     * Human-readable notes about every degradation seen during the run.
     */
    @Builder.Default
    private List<String> degradations = new ArrayList<>();

    /**
     * Set when the run moves to FAILED.
     */
    private String failureReason;

    public void advanceTo(RunState next) {
        if (runState.isTerminal()) {
            throw new IllegalStateException("Run for RFP " + rfpId + " already terminated in state " + runState);
        }
        runState = next;
    }

    public boolean isDegraded() {
        return !degradations.isEmpty();
    }
}
