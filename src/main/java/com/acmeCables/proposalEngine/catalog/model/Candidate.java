package com.acmeCables.proposalEngine.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Catalog entry eligible to fulfil a request item. Immutable for the lifetime of a run;
 * match results refer to it by {@link #candidateId} only.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Candidate {

    String candidateId;

    String name;

    String category;

    Map<String, String> attributes;

    BigDecimal unitPrice;
}
