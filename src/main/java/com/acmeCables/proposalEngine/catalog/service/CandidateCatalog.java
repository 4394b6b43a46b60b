package com.acmeCables.proposalEngine.catalog.service;

import com.acmeCables.proposalEngine.catalog.model.Candidate;

import java.util.Optional;

/**
 * Read-only catalog of products. Local and fast; calls into it are not retried.
 */
public interface CandidateCatalog {

    Optional<Candidate> getCandidate(String candidateId);
}
