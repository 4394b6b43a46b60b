package com.acmeCables.proposalEngine.pricing.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PricingSummary {

    List<PricingLine> lines;

    ProposalTotals totals;
}
