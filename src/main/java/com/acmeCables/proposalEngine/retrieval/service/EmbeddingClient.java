package com.acmeCables.proposalEngine.retrieval.service;

/**
 * Embedding collaborator: text to vector.
 */
public interface EmbeddingClient {

    /**
     * @throws com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException
     *         on transport failure
     */
    float[] embed(String text);
}
