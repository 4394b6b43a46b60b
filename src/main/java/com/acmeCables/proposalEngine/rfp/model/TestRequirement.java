package com.acmeCables.proposalEngine.rfp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A testing requirement of the RFP. Its catalogued price feeds the shared test-cost pool.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestRequirement {

    String testName;

    String description;

    /**
     * e.g. "IS: 7098 Part 1"
     */
    String requiredStandard;

    String frequency;
}
