package com.acmeCables.proposalEngine.orchestrator.model;

import com.acmeCables.proposalEngine.gateway.model.ErrorCode;
import com.acmeCables.proposalEngine.match.model.MatchResult;
import com.acmeCables.proposalEngine.pricing.model.PricingLine;
import com.acmeCables.proposalEngine.pricing.model.ProposalTotals;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Final result of one proposal run.
 *
 * <p>A COMPLETE result always carries every item's match result (matched or not) and the pricing
 * of matched items. {@code errorCode} is null for a clean run and {@link ErrorCode#PARTIAL_FAILURE}
 * when something degraded. A FAILED result carries no pricing and states its reason.</p>
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProposalResult {

    String rfpId;

    String correlationId;

    RunState state;

    ErrorCode errorCode;

    List<MatchResult> matchResults;

    List<PricingLine> pricingLines;

    ProposalTotals totals;

    String narrative;

    boolean narrativeDegraded;

    List<String> degradations;

    String failureReason;

    Instant completedAt;

    @With
    boolean persisted;

    public boolean isDegraded() {
        return errorCode == ErrorCode.PARTIAL_FAILURE;
    }
}
