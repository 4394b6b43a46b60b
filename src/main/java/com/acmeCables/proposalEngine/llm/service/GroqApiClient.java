package com.acmeCables.proposalEngine.llm.service;

import com.acmeCables.proposalEngine.llm.dto.GroqApiRequest;
import com.acmeCables.proposalEngine.llm.dto.GroqApiResponse;
import com.acmeCables.proposalEngine.resilience.RestClientFailures;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Client for interacting with Groq API.
 * Handles HTTP communication with Groq's OpenAI-compatible chat completions endpoint.
 */
@Slf4j
@Service
public class GroqApiClient implements LanguageModelClient {

    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private final RestClient restClient;

    @Value("${groq.api.key:}")
    private String apiKey;

    @Value("${groq.api.model:" + DEFAULT_MODEL + "}")
    private String model;

    @Value("${groq.api.temperature:0.3}")
    private Double defaultTemperature;

    @Value("${groq.api.max-completion-tokens:1024}")
    private Integer maxCompletionTokens;

    @Autowired
    public GroqApiClient(@Value("${groq.api.url:https://api.groq.com/openai/v1/chat/completions}") String apiUrl) {
        this(RestClient.builder(), apiUrl);
    }

    GroqApiClient(RestClient.Builder restClientBuilder, String apiUrl) {
        this.restClient = restClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, double temperature) {
        GroqApiRequest request = baseRequest(systemPrompt, userPrompt)
                .temperature(temperature)
                .build();

        log.debug("Calling Groq API - model: {}, message length: {}", model, userPrompt.length());
        GroqApiResponse response = post(request);
        return response.getContent();
    }

    @Override
    public String callFunction(String systemPrompt,
                               String userPrompt,
                               String functionName,
                               String functionDescription,
                               Map<String, Object> parametersSchema) {
        GroqApiRequest.Tool tool = GroqApiRequest.Tool.builder()
                .type("function")
                .function(GroqApiRequest.Function.builder()
                        .name(functionName)
                        .description(functionDescription)
                        .parameters(parametersSchema)
                        .build())
                .build();

        GroqApiRequest request = baseRequest(systemPrompt, userPrompt)
                .temperature(defaultTemperature)
                .tools(List.of(tool))
                // Groq only accepts string values: "none", "auto", "required"
                .toolChoice("required")
                .build();

        log.debug("Calling Groq API with tools - model: {}, function: {}, message length: {}",
                model, functionName, userPrompt.length());
        GroqApiResponse response = post(request);
        return response.getFunctionArguments(functionName);
    }

    private GroqApiRequest.GroqApiRequestBuilder baseRequest(String systemPrompt, String userPrompt) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Groq API key is not configured. Set groq.api.key in application.yaml");
        }
        return GroqApiRequest.builder()
                .messages(List.of(
                        GroqApiRequest.Message.builder().role("system").content(systemPrompt).build(),
                        GroqApiRequest.Message.builder().role("user").content(userPrompt).build()
                ))
                .model(model)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(false);
    }

    private GroqApiResponse post(GroqApiRequest request) {
        try {
            GroqApiResponse response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);

            if (response == null) {
                throw new UpstreamUnavailableException("Groq API returned null response");
            }

            log.debug("Groq API response received - model: {}, tokens used: {}",
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");
            return response;

        } catch (RestClientException e) {
            log.error("Error calling Groq API: {}", e.getMessage());
            throw RestClientFailures.translate("Groq API", e);
        }
    }
}
