package com.acmeCables.proposalEngine.orchestrator.exception;

/**
 * Exception thrown when the persistence collaborator has no RFP with the requested id.
 */
public class RfpNotFoundException extends RuntimeException {

    public RfpNotFoundException(String message) {
        super(message);
    }
}
