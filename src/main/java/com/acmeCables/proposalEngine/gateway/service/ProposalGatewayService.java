package com.acmeCables.proposalEngine.gateway.service;

import com.acmeCables.proposalEngine.gateway.dto.ProposalRequest;
import com.acmeCables.proposalEngine.gateway.exception.NoActiveRunException;
import com.acmeCables.proposalEngine.gateway.exception.ProposalRunFailedException;
import com.acmeCables.proposalEngine.orchestrator.exception.RfpNotFoundException;
import com.acmeCables.proposalEngine.orchestrator.model.ProposalResult;
import com.acmeCables.proposalEngine.orchestrator.model.RunState;
import com.acmeCables.proposalEngine.orchestrator.service.ProposalOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Gateway service - business side of the proposal endpoints.
 *
 * Responsibilities:
 * - Resolve the correlation id of the request
 * - Forward the run to the orchestrator
 * - Turn a FAILED run into a structured error
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalGatewayService {

    private final CorrelationIdService correlationIdService;
    private final ProposalOrchestrator proposalOrchestrator;

    /**
     * Processes an RFP by id.
     *
     * @return a COMPLETE result, possibly degraded with PARTIAL_FAILURE
     * @throws ProposalRunFailedException if the run terminated in FAILED state
     */
    public ProposalResult processRfp(ProposalRequest request, String correlationIdHeader) {
        String correlationId = correlationIdService.resolveCorrelationId(correlationIdHeader);
        String rfpId = request.getRfpId().trim();
        log.info("Proposal request received - correlationId: {}, rfpId: {}", correlationId, rfpId);

        ProposalResult result = proposalOrchestrator.run(rfpId, correlationId);
        if (result.getState() == RunState.FAILED) {
            throw new ProposalRunFailedException(result.getErrorCode(), correlationId, result.getFailureReason());
        }

        log.info("Proposal request completed - correlationId: {}, rfpId: {}, errorCode: {}, persisted: {}",
                correlationId, rfpId, result.getErrorCode(), result.isPersisted());
        return result;
    }

    /**
     * @throws NoActiveRunException if no run for the RFP is in progress
     */
    public void cancelRun(String rfpId) {
        if (!proposalOrchestrator.cancel(rfpId)) {
            throw new NoActiveRunException("No run in progress for RFP " + rfpId);
        }
        log.info("Proposal run cancel requested - rfpId: {}", rfpId);
    }

    /**
     * @throws RfpNotFoundException if no result was stored for the RFP
     */
    public ProposalResult getLatestResult(String rfpId) {
        return proposalOrchestrator.findLatest(rfpId)
                .orElseThrow(() -> new RfpNotFoundException("No proposal stored for RFP " + rfpId));
    }
}
