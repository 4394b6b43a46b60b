package com.acmeCables.proposalEngine.gateway.controller;

import com.acmeCables.proposalEngine.gateway.dto.ProposalRequest;
import com.acmeCables.proposalEngine.gateway.service.ProposalGatewayService;
import com.acmeCables.proposalEngine.orchestrator.model.ProposalResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Proposal REST controller - thin HTTP layer over the proposal pipeline.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract HTTP headers
 * - Delegate business logic to ProposalGatewayService
 */
@RestController
@RequestMapping("/api/v1/proposals")
@RequiredArgsConstructor
public class ProposalController {

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final ProposalGatewayService proposalGatewayService;

    /**
     * Processes an RFP by id. A degraded run is still returned with 200 and errorCode PARTIAL_FAILURE.
     */
    @PostMapping
    public ResponseEntity<ProposalResult> process(
            @Valid @RequestBody ProposalRequest request,
            @RequestHeader(value = CORRELATION_ID_HEADER, required = false) String correlationIdHeader) {

        ProposalResult result = proposalGatewayService.processRfp(request, correlationIdHeader);
        return ResponseEntity.ok()
                .header(CORRELATION_ID_HEADER, result.getCorrelationId())
                .body(result);
    }

    @GetMapping("/{rfpId}")
    public ResponseEntity<ProposalResult> latest(@PathVariable String rfpId) {
        return ResponseEntity.ok(proposalGatewayService.getLatestResult(rfpId));
    }

    /**
     * Cancels the in-flight run of an RFP.
     */
    @DeleteMapping("/{rfpId}/run")
    public ResponseEntity<Void> cancel(@PathVariable String rfpId) {
        proposalGatewayService.cancelRun(rfpId);
        return ResponseEntity.accepted().build();
    }
}
