package com.acmeCables.proposalEngine.pricing.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProposalTotals {

    int matchedItemCount;

    BigDecimal totalMaterialCost;

    /**
     * Test-cost pool derived from the RFP test requirements.
     */
    BigDecimal testCostPool;

    BigDecimal allocatedTestCost;

    /**
     * Part of the pool that could not be allocated because no matched item carries material cost.
     */
    BigDecimal unallocatedTestCost;

    /**
     * Material plus allocated test cost.
     */
    BigDecimal grandTotal;

    public static ProposalTotals empty() {
        return ProposalTotals.builder()
                .matchedItemCount(0)
                .totalMaterialCost(BigDecimal.ZERO)
                .testCostPool(BigDecimal.ZERO)
                .allocatedTestCost(BigDecimal.ZERO)
                .unallocatedTestCost(BigDecimal.ZERO)
                .grandTotal(BigDecimal.ZERO)
                .build();
    }
}
