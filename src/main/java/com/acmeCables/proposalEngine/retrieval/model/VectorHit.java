package com.acmeCables.proposalEngine.retrieval.model;

import lombok.Builder;
import lombok.Value;

/**
 * One nearest-neighbour hit: a catalog candidate id and its similarity to the query.
 */
@Value
@Builder
public class VectorHit {

    String candidateId;

    double similarity;
}
