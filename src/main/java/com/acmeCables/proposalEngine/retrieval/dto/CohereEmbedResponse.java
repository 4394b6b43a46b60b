package com.acmeCables.proposalEngine.retrieval.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CohereEmbedResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("embeddings")
    private Embeddings embeddings;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Embeddings {
        @JsonProperty("float")
        private List<List<Float>> floatEmbeddings;
    }
}
