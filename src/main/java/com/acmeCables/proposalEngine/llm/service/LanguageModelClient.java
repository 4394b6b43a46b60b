package com.acmeCables.proposalEngine.llm.service;

import java.util.Map;

/**
 * Language-model collaborator. Implementations throw
 * {@link com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException}
 * for transport failures and timeouts.
 */
public interface LanguageModelClient {

    /**
     * Free-text completion.
     */
    String complete(String systemPrompt, String userPrompt, double temperature);

    /**
     * Forces a call of the given function and returns its arguments as a JSON string.
     *
     * @param parametersSchema JSON schema of the function arguments
     * @return arguments JSON, or null when the model did not call the function
     */
    String callFunction(String systemPrompt,
                        String userPrompt,
                        String functionName,
                        String functionDescription,
                        Map<String, Object> parametersSchema);
}
