package com.acmeCables.proposalEngine.orchestrator.exception;

/**
 * Exception thrown when a run observes that it has been cancelled.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String message) {
        super(message);
    }
}
