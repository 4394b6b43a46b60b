package com.acmeCables.proposalEngine.retrieval.service;

import com.acmeCables.proposalEngine.resilience.RestClientFailures;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import com.acmeCables.proposalEngine.retrieval.dto.QdrantSearchRequest;
import com.acmeCables.proposalEngine.retrieval.dto.QdrantSearchResponse;
import com.acmeCables.proposalEngine.retrieval.model.VectorHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for Qdrant's REST search over the catalog collection.
 */
@Slf4j
@Service
public class QdrantVectorSearchClient implements VectorSearchClient {

    private static final String API_KEY_HEADER = "api-key";

    private final RestClient restClient;

    @Value("${qdrant.api-key:}")
    private String apiKey;

    @Value("${qdrant.collection:sku_index}")
    private String collection;

    @Autowired
    public QdrantVectorSearchClient(@Value("${qdrant.url:http://localhost:6333}") String baseUrl) {
        this(RestClient.builder(), baseUrl);
    }

    QdrantVectorSearchClient(RestClient.Builder restClientBuilder, String baseUrl) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public List<VectorHit> query(float[] vector, int topK) {
        QdrantSearchRequest request = QdrantSearchRequest.builder()
                .vector(vector)
                .limit(topK)
                .withPayload(true)
                .build();

        QdrantSearchResponse response;
        try {
            RestClient.RequestBodySpec spec = restClient.post()
                    .uri("/collections/{collection}/points/search", collection);
            if (apiKey != null && !apiKey.isBlank()) {
                spec = spec.header(API_KEY_HEADER, apiKey);
            }
            response = spec.body(request)
                    .retrieve()
                    .body(QdrantSearchResponse.class);
        } catch (RestClientException e) {
            log.error("Error calling Qdrant search - collection: {}, error: {}", collection, e.getMessage());
            throw RestClientFailures.translate("Qdrant search", e);
        }

        if (response == null || response.getResult() == null) {
            throw new UpstreamUnavailableException("Qdrant search returned no result");
        }

        List<VectorHit> hits = new ArrayList<>();
        for (QdrantSearchResponse.Point point : response.getResult()) {
            String candidateId = candidateId(point);
            if (candidateId == null) {
                log.warn("Skipping Qdrant point without sku_id - collection: {}, pointId: {}", collection, point.getId());
                continue;
            }
            hits.add(VectorHit.builder()
                    .candidateId(candidateId)
                    .similarity(point.getScore() != null ? point.getScore() : 0.0)
                    .build());
        }
        log.debug("Qdrant search completed - collection: {}, hits: {}", collection, hits.size());
        return hits;
    }

    private static String candidateId(QdrantSearchResponse.Point point) {
        if (point.getPayload() == null) {
            return null;
        }
        Object metadata = point.getPayload().get("metadata");
        if (metadata instanceof Map<?, ?> metadataMap && metadataMap.get("sku_id") != null) {
            return metadataMap.get("sku_id").toString();
        }
        Object skuId = point.getPayload().get("sku_id");
        return skuId != null ? skuId.toString() : null;
    }
}
