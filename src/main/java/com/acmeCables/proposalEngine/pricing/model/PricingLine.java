package com.acmeCables.proposalEngine.pricing.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Cost figures of one matched item. {@code totalCost = materialCost + allocatedTestCost}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PricingLine {

    String itemId;

    String candidateId;

    BigDecimal quantity;

    BigDecimal unitPrice;

    BigDecimal materialCost;

    BigDecimal allocatedTestCost;

    BigDecimal totalCost;
}
