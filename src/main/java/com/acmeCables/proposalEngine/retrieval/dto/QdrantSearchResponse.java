package com.acmeCables.proposalEngine.retrieval.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for Qdrant's points search. Catalog points carry the candidate id in
 * {@code payload.metadata.sku_id}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class QdrantSearchResponse {

    @JsonProperty("result")
    private List<Point> result;

    @JsonProperty("status")
    private String status;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Point {
        @JsonProperty("id")
        private Object id;

        @JsonProperty("score")
        private Double score;

        @JsonProperty("payload")
        private Map<String, Object> payload;
    }
}
