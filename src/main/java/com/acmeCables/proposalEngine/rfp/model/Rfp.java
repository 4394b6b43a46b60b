package com.acmeCables.proposalEngine.rfp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured procurement request, as produced by the ingestion side and loaded by id.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Rfp {

    String rfpId;

    String title;

    String buyer;

    String summary;

    List<RequestItem> items;

    List<TestRequirement> testRequirements;
}
