package com.acmeCables.proposalEngine.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for processing an RFP by id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalRequest {

    @NotBlank(message = "rfpId is required")
    private String rfpId;
}
