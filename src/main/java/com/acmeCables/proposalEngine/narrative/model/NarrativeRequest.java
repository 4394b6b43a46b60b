package com.acmeCables.proposalEngine.narrative.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregated figures handed to the narrative synthesizer. Built only from completed match and
 * pricing data.
 */
@Value
@Builder
public class NarrativeRequest {

    String rfpId;

    String title;

    String buyer;

    int itemCount;

    int matchedItemCount;

    BigDecimal totalMaterialCost;

    BigDecimal testCost;

    BigDecimal grandTotal;

    /**
     * Chosen product of every matched item, in RFP order.
     */
    List<TopMatch> topMatches;

    @Value
    @Builder
    public static class TopMatch {

        String itemId;

        String candidateId;

        String candidateName;

        double score;
    }
}
