package com.acmeCables.proposalEngine.match.model;

import java.util.List;
import java.util.Map;

/**
 * Function definition for candidate re-ranking.
 * Defines the structured function schema for function calling.
 */
public final class RerankFunctionDefinition {

    private RerankFunctionDefinition() {}

    public static Map<String, Object> getFunctionSchema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "rankedCandidateIds", Map.of(
                    "type", "array",
                    "items", Map.of("type", "string"),
                    "description", "All given candidate ids, best fit for the requested item first"
                ),
                "reasoning", Map.of(
                    "type", "string",
                    "description", "One or two sentences explaining the preferred order"
                )
            ),
            "required", List.of("rankedCandidateIds")
        );
    }

    public static final String FUNCTION_NAME = "report_candidate_ranking";
    public static final String FUNCTION_DESCRIPTION = """
        Reports the preferred order of catalog candidates for one RFP item.
        Use this function to return every candidate id exactly once, ordered from the best
        technical fit for the requested item to the weakest.
        """;
}
