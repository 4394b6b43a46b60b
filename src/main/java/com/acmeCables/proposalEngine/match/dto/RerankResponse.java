package com.acmeCables.proposalEngine.match.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Arguments of the re-rank function call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RerankResponse {

    @JsonProperty("rankedCandidateIds")
    private List<String> rankedCandidateIds;

    @JsonProperty("reasoning")
    private String reasoning;
}
