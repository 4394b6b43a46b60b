package com.acmeCables.proposalEngine.retrieval.service;

import com.acmeCables.proposalEngine.retrieval.model.VectorHit;

import java.util.List;

/**
 * Vector-index collaborator over the product catalog.
 */
public interface VectorSearchClient {

    /**
     * @param topK maximum number of hits
     * @return hits ordered by decreasing similarity
     * @throws com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException
     *         on transport failure
     */
    List<VectorHit> query(float[] vector, int topK);
}
