package com.acmeCables.proposalEngine.orchestrator.service;

import com.acmeCables.proposalEngine.gateway.model.ErrorCode;
import com.acmeCables.proposalEngine.match.model.MatchResult;
import com.acmeCables.proposalEngine.match.model.ScoredCandidate;
import com.acmeCables.proposalEngine.match.service.SpecMatchEngine;
import com.acmeCables.proposalEngine.narrative.model.NarrativeRequest;
import com.acmeCables.proposalEngine.narrative.service.NarrativeSynthesizer;
import com.acmeCables.proposalEngine.orchestrator.exception.RfpNotFoundException;
import com.acmeCables.proposalEngine.orchestrator.exception.RfpValidationException;
import com.acmeCables.proposalEngine.orchestrator.exception.RunCancelledException;
import com.acmeCables.proposalEngine.orchestrator.model.OrchestrationState;
import com.acmeCables.proposalEngine.orchestrator.model.ProposalResult;
import com.acmeCables.proposalEngine.orchestrator.model.RunHandle;
import com.acmeCables.proposalEngine.orchestrator.model.RunState;
import com.acmeCables.proposalEngine.orchestrator.model.StageResult;
import com.acmeCables.proposalEngine.pricing.exception.AllocationInvariantViolationException;
import com.acmeCables.proposalEngine.pricing.model.PricingSummary;
import com.acmeCables.proposalEngine.pricing.model.ProposalTotals;
import com.acmeCables.proposalEngine.pricing.service.PricingEngine;
import com.acmeCables.proposalEngine.pricing.service.TestCostPoolResolver;
import com.acmeCables.proposalEngine.repository.ProposalResultRepository;
import com.acmeCables.proposalEngine.repository.RfpRepository;
import com.acmeCables.proposalEngine.resilience.RetryPolicy;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import com.acmeCables.proposalEngine.rfp.model.Rfp;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrator service - workflow owner of one proposal run per RFP.
 *
 * Workflow steps:
 * LOAD -> VALIDATE -> MATCH -> PRICE -> SYNTHESIZE -> COMPLETE -> STORE
 *
 * Loading and validation failures are thrown to the caller. Once the RFP is loaded every run
 * ends in a ProposalResult: COMPLETE (possibly degraded, with PARTIAL_FAILURE) or FAILED with its
 * error code. Degraded retrieval, re-rank and narrative never fail the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalOrchestrator {

    static final String MDC_CORRELATION_ID = "correlationId";
    static final String MDC_RFP_ID = "rfpId";

    private final RfpRepository rfpRepository;
    private final ProposalResultRepository proposalResultRepository;
    private final RfpValidator rfpValidator;
    private final RunRegistry runRegistry;
    private final SpecMatchEngine specMatchEngine;
    private final TestCostPoolResolver testCostPoolResolver;
    private final PricingEngine pricingEngine;
    private final NarrativeSynthesizer narrativeSynthesizer;
    private final RetryPolicy retryPolicy;

    /**
     * Runs the proposal pipeline for one RFP.
     *
     * @throws RfpNotFoundException if the RFP does not exist
     * @throws RfpValidationException if the RFP is malformed or a run for it is already in progress
     * @throws UpstreamUnavailableException if the RFP could not be loaded after retries
     */
    public ProposalResult run(String rfpId, String correlationId) {
        if (rfpId == null || rfpId.isBlank()) {
            throw new RfpValidationException("rfpId is required");
        }
        RunHandle handle = runRegistry.register(rfpId, correlationId);
        MDC.put(MDC_CORRELATION_ID, correlationId);
        MDC.put(MDC_RFP_ID, rfpId);
        try {
            log.info("Starting proposal run - correlationId: {}, rfpId: {}", correlationId, rfpId);

            Rfp rfp = load(rfpId, correlationId);
            rfpValidator.validate(rfp);

            OrchestrationState state = OrchestrationState.builder()
                    .rfpId(rfpId)
                    .correlationId(correlationId)
                    .rfp(rfp)
                    .build();

            ProposalResult result = execute(state, handle);
            return store(result);
        } finally {
            runRegistry.unregister(handle);
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_RFP_ID);
        }
    }

    /**
     * @return true if an in-flight run for the RFP was found and cancelled
     */
    public boolean cancel(String rfpId) {
        return runRegistry.cancel(rfpId);
    }

    public Optional<ProposalResult> findLatest(String rfpId) {
        return proposalResultRepository.findLatest(rfpId);
    }

    private ProposalResult execute(OrchestrationState state, RunHandle handle) {
        String correlationId = state.getCorrelationId();
        try {
            handle.throwIfCancelled();
            match(state, handle);

            handle.throwIfCancelled();
            price(state);

            handle.throwIfCancelled();
            synthesize(state);

            handle.throwIfCancelled();
            return complete(state);

        } catch (RunCancelledException e) {
            log.warn("Run cancelled - correlationId: {}, rfpId: {}, state: {}", correlationId, state.getRfpId(), state.getRunState());
            return fail(state, ErrorCode.CANCELLED, e.getMessage());
        } catch (AllocationInvariantViolationException e) {
            log.error("Allocation invariant violated - correlationId: {}, rfpId: {}", correlationId, state.getRfpId(), e);
            return fail(state, ErrorCode.INTERNAL_ERROR, e.getMessage());
        } catch (UpstreamUnavailableException e) {
            log.error("Collaborator unavailable - correlationId: {}, rfpId: {}, state: {}, error: {}",
                    correlationId, state.getRfpId(), state.getRunState(), e.getMessage());
            return fail(state, ErrorCode.UPSTREAM_UNAVAILABLE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error in proposal run - correlationId: {}, rfpId: {}, state: {}",
                    correlationId, state.getRfpId(), state.getRunState(), e);
            return fail(state, ErrorCode.INTERNAL_ERROR, e.getMessage());
        }
    }

    /**
     * Step LOAD - read the RFP through the persistence collaborator, with retries.
     */
    private Rfp load(String rfpId, String correlationId) {
        log.debug("Step LOAD - correlationId: {}, rfpId: {}", correlationId, rfpId);
        Optional<Rfp> rfp = retryPolicy.execute("RFP load", () -> rfpRepository.loadRfp(rfpId));
        return rfp.orElseThrow(() -> {
            log.warn("RFP not found - correlationId: {}, rfpId: {}", correlationId, rfpId);
            return new RfpNotFoundException("RFP " + rfpId + " not found");
        });
    }

    /**
     * Step MATCH - retrieve, score and select candidates for every item.
     */
    private void match(OrchestrationState state, RunHandle handle) {
        log.info("Step MATCH - correlationId: {}, rfpId: {}, items: {}",
                state.getCorrelationId(), state.getRfpId(), state.getRfp().getItems().size());

        StageResult<List<MatchResult>> matchStage = specMatchEngine.matchAll(state.getRfp().getItems(), handle);
        state.setMatchStage(matchStage);
        state.getDegradations().addAll(matchStage.getNotes());
        state.advanceTo(RunState.MATCHED);

        long matched = matchStage.getValue().stream().filter(MatchResult::isMatched).count();
        log.info("Step MATCH done - correlationId: {}, matched: {}/{}, outcome: {}",
                state.getCorrelationId(), matched, matchStage.getValue().size(), matchStage.getOutcome());
    }

    /**
     * Step PRICE - material costs and test-cost allocation over matched items.
     */
    private void price(OrchestrationState state) {
        Rfp rfp = state.getRfp();
        BigDecimal pool = testCostPoolResolver.resolvePool(rfp);
        log.info("Step PRICE - correlationId: {}, rfpId: {}, testCostPool: {}",
                state.getCorrelationId(), state.getRfpId(), pool);

        PricingSummary pricing = pricingEngine.price(rfp.getItems(), state.getMatchStage().getValue(), pool);
        state.setPricing(pricing);
        state.advanceTo(RunState.PRICED);

        if (pricing.getTotals().getUnallocatedTestCost().signum() > 0) {
            log.warn("Test cost pool not allocated, no matched item carries material cost - correlationId: {}, pool: {}",
                    state.getCorrelationId(), pool);
        }
    }

    /**
     * Step SYNTHESIZE - narrative summary; degrades without failing the run.
     */
    private void synthesize(OrchestrationState state) {
        log.info("Step SYNTHESIZE - correlationId: {}, rfpId: {}", state.getCorrelationId(), state.getRfpId());
        StageResult<String> narrativeStage = narrativeSynthesizer.synthesize(
                buildNarrativeRequest(state), state.getCorrelationId());
        state.setNarrativeStage(narrativeStage);
        if (narrativeStage.isDegraded()) {
            state.getDegradations().addAll(narrativeStage.getNotes());
        }
        state.advanceTo(RunState.SYNTHESIZED);
    }

    private ProposalResult complete(OrchestrationState state) {
        state.advanceTo(RunState.COMPLETE);
        ErrorCode errorCode = state.isDegraded() ? ErrorCode.PARTIAL_FAILURE : null;
        log.info("Proposal run complete - correlationId: {}, rfpId: {}, grandTotal: {}, degraded: {}",
                state.getCorrelationId(), state.getRfpId(), state.getPricing().getTotals().getGrandTotal(), state.isDegraded());

        StageResult<String> narrativeStage = state.getNarrativeStage();
        return ProposalResult.builder()
                .rfpId(state.getRfpId())
                .correlationId(state.getCorrelationId())
                .state(RunState.COMPLETE)
                .errorCode(errorCode)
                .matchResults(state.getMatchStage().getValue())
                .pricingLines(state.getPricing().getLines())
                .totals(state.getPricing().getTotals())
                .narrative(narrativeStage.getValue())
                .narrativeDegraded(narrativeStage.isDegraded())
                .degradations(List.copyOf(state.getDegradations()))
                .completedAt(Instant.now())
                .build();
    }

    /**
     * Partial results are discarded: a FAILED result carries no match or pricing data.
     */
    private ProposalResult fail(OrchestrationState state, ErrorCode errorCode, String reason) {
        state.setFailureReason(reason);
        state.advanceTo(RunState.FAILED);
        return ProposalResult.builder()
                .rfpId(state.getRfpId())
                .correlationId(state.getCorrelationId())
                .state(RunState.FAILED)
                .errorCode(errorCode)
                .matchResults(List.of())
                .pricingLines(List.of())
                .totals(ProposalTotals.empty())
                .degradations(List.copyOf(state.getDegradations()))
                .failureReason(reason)
                .completedAt(Instant.now())
                .build();
    }

    /**
     * Step STORE - hand the terminated result to the persistence collaborator. A store failure is
     * reported through {@code persisted=false} and never changes the result data.
     */
    private ProposalResult store(ProposalResult result) {
        try {
            retryPolicy.execute("proposal store", () -> {
                proposalResultRepository.store(result);
                return Boolean.TRUE;
            });
            return result.withPersisted(true);
        } catch (RuntimeException e) {
            log.error("Failed to store proposal result - correlationId: {}, rfpId: {}, error: {}",
                    result.getCorrelationId(), result.getRfpId(), e.getMessage());
            return result.withPersisted(false);
        }
    }

    private NarrativeRequest buildNarrativeRequest(OrchestrationState state) {
        Rfp rfp = state.getRfp();
        List<MatchResult> matchResults = state.getMatchStage().getValue();
        ProposalTotals totals = state.getPricing().getTotals();

        List<NarrativeRequest.TopMatch> topMatches = new ArrayList<>();
        for (MatchResult result : matchResults) {
            if (!result.isMatched()) {
                continue;
            }
            String candidateName = result.getRankedCandidates().stream()
                    .filter(candidate -> candidate.getCandidateId().equals(result.getChosenCandidateId()))
                    .map(ScoredCandidate::getCandidateName)
                    .findFirst()
                    .orElse(null);
            topMatches.add(NarrativeRequest.TopMatch.builder()
                    .itemId(result.getItemId())
                    .candidateId(result.getChosenCandidateId())
                    .candidateName(candidateName)
                    .score(result.getFinalScore())
                    .build());
        }

        return NarrativeRequest.builder()
                .rfpId(rfp.getRfpId())
                .title(rfp.getTitle())
                .buyer(rfp.getBuyer())
                .itemCount(matchResults.size())
                .matchedItemCount(totals.getMatchedItemCount())
                .totalMaterialCost(totals.getTotalMaterialCost())
                .testCost(totals.getAllocatedTestCost())
                .grandTotal(totals.getGrandTotal())
                .topMatches(topMatches)
                .build();
    }
}
