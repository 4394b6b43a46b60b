package com.acmeCables.proposalEngine.match.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Score of one required attribute against one candidate, 0 to 100.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttributeScore {

    String attributeName;

    String requiredValue;

    /**
     * Null when the candidate does not carry the attribute.
     */
    String candidateValue;

    double score;

    AttributeMatchType matchType;
}
