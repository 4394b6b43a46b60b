package com.acmeCables.proposalEngine.llm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for Groq API chat completions, with optional function-calling tools.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GroqApiRequest {

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("model")
    private String model;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("max_completion_tokens")
    private Integer maxCompletionTokens;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("tools")
    private List<Tool> tools;

    /**
     * "none", "auto" or "required".
     */
    @JsonProperty("tool_choice")
    private String toolChoice;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Message {
        @JsonProperty("role")
        private String role;

        @JsonProperty("content")
        private String content;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Tool {
        @JsonProperty("type")
        private String type; // "function"

        @JsonProperty("function")
        private Function function;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Function {
        @JsonProperty("name")
        private String name;

        @JsonProperty("description")
        private String description;

        /**
         * JSON schema of the function arguments.
         */
        @JsonProperty("parameters")
        private Map<String, Object> parameters;
    }
}
