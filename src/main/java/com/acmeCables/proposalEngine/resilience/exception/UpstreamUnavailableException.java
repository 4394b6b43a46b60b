package com.acmeCables.proposalEngine.resilience.exception;

/**
 * Exception thrown when an external collaborator (embedding, vector search, language model,
 * persistence) times out or fails in transport. Retryable.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
