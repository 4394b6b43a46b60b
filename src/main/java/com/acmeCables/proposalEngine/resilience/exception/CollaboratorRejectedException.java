package com.acmeCables.proposalEngine.resilience.exception;

/**
 * Exception thrown when an external collaborator rejects a request outright (bad key, bad
 * request, unknown collection). Not retried.
 */
public class CollaboratorRejectedException extends RuntimeException {

    public CollaboratorRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
