package com.acmeCables.proposalEngine.retrieval.service;

import com.acmeCables.proposalEngine.resilience.RestClientFailures;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import com.acmeCables.proposalEngine.retrieval.dto.CohereEmbedRequest;
import com.acmeCables.proposalEngine.retrieval.dto.CohereEmbedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Client for the Cohere embed endpoint. Query texts are embedded with input type "search_query".
 */
@Slf4j
@Service
public class CohereEmbeddingClient implements EmbeddingClient {

    private final RestClient restClient;

    @Value("${cohere.api.key:}")
    private String apiKey;

    @Value("${cohere.api.model:embed-english-v3.0}")
    private String model;

    @Autowired
    public CohereEmbeddingClient(@Value("${cohere.api.url:https://api.cohere.com/v2/embed}") String apiUrl) {
        this(RestClient.builder(), apiUrl);
    }

    CohereEmbeddingClient(RestClient.Builder restClientBuilder, String apiUrl) {
        this.restClient = restClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public float[] embed(String text) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Cohere API key is not configured. Set cohere.api.key in application.yaml");
        }

        CohereEmbedRequest request = CohereEmbedRequest.builder()
                .model(model)
                .texts(List.of(text))
                .inputType("search_query")
                .embeddingTypes(List.of("float"))
                .build();

        CohereEmbedResponse response;
        try {
            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(CohereEmbedResponse.class);
        } catch (RestClientException e) {
            log.error("Error calling Cohere embed API: {}", e.getMessage());
            throw RestClientFailures.translate("Cohere embed API", e);
        }

        if (response == null || response.getEmbeddings() == null
                || response.getEmbeddings().getFloatEmbeddings() == null
                || response.getEmbeddings().getFloatEmbeddings().isEmpty()) {
            throw new UpstreamUnavailableException("Cohere embed API returned no embedding");
        }

        List<Float> values = response.getEmbeddings().getFloatEmbeddings().get(0);
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i);
        }
        log.debug("Generated query embedding - model: {}, dimension: {}", model, vector.length);
        return vector;
    }
}
