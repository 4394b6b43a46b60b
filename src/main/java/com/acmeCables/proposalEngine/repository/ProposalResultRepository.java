package com.acmeCables.proposalEngine.repository;

import com.acmeCables.proposalEngine.orchestrator.model.ProposalResult;

import java.util.Optional;

/**
 * Persistence collaborator receiving terminated proposal runs.
 */
public interface ProposalResultRepository {

    void store(ProposalResult result);

    Optional<ProposalResult> findLatest(String rfpId);
}
