package com.acmeCables.proposalEngine.match.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * A retrieved candidate with its deterministic item-level score and per-attribute breakdown.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoredCandidate {

    String candidateId;

    String candidateName;

    /**
     * Carried for the price tie-break; pricing itself reads the catalog.
     */
    BigDecimal unitPrice;

    /**
     * Vector-search similarity. Informational only, never used for ranking.
     */
    double similarity;

    double score;

    List<AttributeScore> attributeScores;
}
