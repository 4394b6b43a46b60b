package com.acmeCables.proposalEngine.gateway.exception;

/**
 * Exception thrown when a cancel is requested for an RFP that has no run in progress.
 */
public class NoActiveRunException extends RuntimeException {

    public NoActiveRunException(String message) {
        super(message);
    }
}
