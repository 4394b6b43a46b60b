package com.acmeCables.proposalEngine.gateway.controller;

import com.acmeCables.proposalEngine.gateway.dto.ProposalRequest;
import com.acmeCables.proposalEngine.gateway.exception.NoActiveRunException;
import com.acmeCables.proposalEngine.gateway.exception.ProposalRunFailedException;
import com.acmeCables.proposalEngine.gateway.model.ErrorCode;
import com.acmeCables.proposalEngine.gateway.service.ProposalGatewayService;
import com.acmeCables.proposalEngine.orchestrator.exception.RfpNotFoundException;
import com.acmeCables.proposalEngine.orchestrator.exception.RfpValidationException;
import com.acmeCables.proposalEngine.orchestrator.model.ProposalResult;
import com.acmeCables.proposalEngine.orchestrator.model.RunState;
import com.acmeCables.proposalEngine.pricing.model.ProposalTotals;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ProposalControllerTest {

    private static final String BODY = "{\"rfpId\":\"RFP-2026-001\"}";

    @Mock private ProposalGatewayService proposalGatewayService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ProposalController(proposalGatewayService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ProposalResult result(ErrorCode errorCode) {
        return ProposalResult.builder()
                .rfpId("RFP-2026-001")
                .correlationId("corr-1")
                .state(RunState.COMPLETE)
                .errorCode(errorCode)
                .matchResults(List.of())
                .pricingLines(List.of())
                .totals(ProposalTotals.empty())
                .persisted(true)
                .build();
    }

    @Nested
    @DisplayName("POST /api/v1/proposals")
    class Process {

        @Test
        @DisplayName("returns the result and echoes the correlation id")
        void success() throws Exception {
            when(proposalGatewayService.processRfp(any(ProposalRequest.class), eq("corr-1"))).thenReturn(result(null));

            mockMvc.perform(post("/api/v1/proposals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .header(ProposalController.CORRELATION_ID_HEADER, "corr-1")
                            .content(BODY))
                    .andExpect(status().isOk())
                    .andExpect(header().string(ProposalController.CORRELATION_ID_HEADER, "corr-1"))
                    .andExpect(jsonPath("$.rfpId").value("RFP-2026-001"))
                    .andExpect(jsonPath("$.state").value("COMPLETE"))
                    .andExpect(jsonPath("$.persisted").value(true));
        }

        @Test
        @DisplayName("a degraded run is still 200 with PARTIAL_FAILURE")
        void partialFailure() throws Exception {
            when(proposalGatewayService.processRfp(any(ProposalRequest.class), isNull()))
                    .thenReturn(result(ErrorCode.PARTIAL_FAILURE));

            mockMvc.perform(post("/api/v1/proposals").contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.errorCode").value("PARTIAL_FAILURE"))
                    .andExpect(jsonPath("$.degraded").value(true));
        }

        @Test
        @DisplayName("a blank rfpId is a VALIDATION_ERROR")
        void blankRfpId() throws Exception {
            mockMvc.perform(post("/api/v1/proposals").contentType(MediaType.APPLICATION_JSON).content("{\"rfpId\":\" \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.message").value("rfpId: rfpId is required"));
            verifyNoInteractions(proposalGatewayService);
        }

        @Test
        @DisplayName("a malformed body is a VALIDATION_ERROR")
        void malformedBody() throws Exception {
            mockMvc.perform(post("/api/v1/proposals").contentType(MediaType.APPLICATION_JSON).content("{rfpId"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("an unknown RFP is NOT_FOUND")
        void notFound() throws Exception {
            when(proposalGatewayService.processRfp(any(ProposalRequest.class), isNull()))
                    .thenThrow(new RfpNotFoundException("RFP RFP-2026-001 not found"));

            mockMvc.perform(post("/api/v1/proposals").contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.message").value("RFP RFP-2026-001 not found"));
        }

        @Test
        @DisplayName("a malformed RFP is a VALIDATION_ERROR")
        void malformedRfp() throws Exception {
            when(proposalGatewayService.processRfp(any(ProposalRequest.class), isNull()))
                    .thenThrow(new RfpValidationException("RFP RFP-2026-001 is malformed: RFP has no items"));

            mockMvc.perform(post("/api/v1/proposals").contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("an unreachable store is UPSTREAM_UNAVAILABLE")
        void upstreamUnavailable() throws Exception {
            when(proposalGatewayService.processRfp(any(ProposalRequest.class), isNull()))
                    .thenThrow(new UpstreamUnavailableException("RFP load unavailable after 3 attempt(s)"));

            mockMvc.perform(post("/api/v1/proposals").contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.code").value("UPSTREAM_UNAVAILABLE"));
        }

        @Test
        @DisplayName("a cancelled run is CANCELLED")
        void cancelled() throws Exception {
            when(proposalGatewayService.processRfp(any(ProposalRequest.class), isNull()))
                    .thenThrow(new ProposalRunFailedException(ErrorCode.CANCELLED, "corr-1", "Run for RFP RFP-2026-001 was cancelled"));

            mockMvc.perform(post("/api/v1/proposals").contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("CANCELLED"))
                    .andExpect(jsonPath("$.message").value("Run for RFP RFP-2026-001 was cancelled"));
        }

        @Test
        @DisplayName("an internal failure does not leak its reason")
        void internalError() throws Exception {
            when(proposalGatewayService.processRfp(any(ProposalRequest.class), isNull()))
                    .thenThrow(new ProposalRunFailedException(ErrorCode.INTERNAL_ERROR, "corr-1", "Allocated test cost 1 does not reconcile"));

            mockMvc.perform(post("/api/v1/proposals").contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                    .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
        }
    }

    @Nested
    @DisplayName("GET /api/v1/proposals/{rfpId}")
    class Latest {

        @Test
        @DisplayName("returns the latest stored result")
        void found() throws Exception {
            when(proposalGatewayService.getLatestResult("RFP-2026-001")).thenReturn(result(null));

            mockMvc.perform(get("/api/v1/proposals/RFP-2026-001"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.correlationId").value("corr-1"));
        }

        @Test
        @DisplayName("is NOT_FOUND before any run was stored")
        void notFound() throws Exception {
            when(proposalGatewayService.getLatestResult("RFP-9"))
                    .thenThrow(new RfpNotFoundException("No proposal stored for RFP RFP-9"));

            mockMvc.perform(get("/api/v1/proposals/RFP-9"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        }
    }

    @Nested
    @DisplayName("DELETE /api/v1/proposals/{rfpId}/run")
    class Cancel {

        @Test
        @DisplayName("accepts a cancel of a running RFP")
        void accepted() throws Exception {
            mockMvc.perform(delete("/api/v1/proposals/RFP-2026-001/run"))
                    .andExpect(status().isAccepted());
            verify(proposalGatewayService).cancelRun("RFP-2026-001");
        }

        @Test
        @DisplayName("is NOT_FOUND without a run in progress")
        void noRun() throws Exception {
            doThrow(new NoActiveRunException("No run in progress for RFP RFP-9"))
                    .when(proposalGatewayService).cancelRun("RFP-9");

            mockMvc.perform(delete("/api/v1/proposals/RFP-9/run"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        }
    }
}
