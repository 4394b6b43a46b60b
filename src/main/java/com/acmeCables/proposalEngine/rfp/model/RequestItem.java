package com.acmeCables.proposalEngine.rfp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One line of the RFP scope of supply.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestItem {

    String itemId;

    String description;

    BigDecimal quantity;

    /**
     * Unit of measurement, e.g. "meters" or "pieces".
     */
    String unit;

    /**
     * Required attributes in RFP order. Every entry counts once in the item score.
     */
    Map<String, RequiredAttribute> requiredAttributes;
}
