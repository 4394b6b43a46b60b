package com.acmeCables.proposalEngine.retrieval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QdrantSearchRequest {

    @JsonProperty("vector")
    private float[] vector;

    @JsonProperty("limit")
    private Integer limit;

    @JsonProperty("with_payload")
    private Boolean withPayload;
}
