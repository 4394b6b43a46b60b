package com.acmeCables.proposalEngine.retrieval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for the Cohere v2 embed endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CohereEmbedRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("texts")
    private List<String> texts;

    /**
     * "search_query" for queries, "search_document" for indexed catalog entries.
     */
    @JsonProperty("input_type")
    private String inputType;

    @JsonProperty("embedding_types")
    private List<String> embeddingTypes;
}
