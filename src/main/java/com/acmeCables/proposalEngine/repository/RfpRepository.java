package com.acmeCables.proposalEngine.repository;

import com.acmeCables.proposalEngine.rfp.model.Rfp;

import java.util.Optional;

/**
 * Persistence collaborator holding RFP records produced by ingestion.
 */
public interface RfpRepository {

    Optional<Rfp> loadRfp(String rfpId);
}
