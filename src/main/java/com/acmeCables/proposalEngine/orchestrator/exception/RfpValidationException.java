package com.acmeCables.proposalEngine.orchestrator.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception thrown when an RFP or one of its items is malformed. Never retried;
 * the violations are surfaced verbatim to the caller.
 */
@Getter
public class RfpValidationException extends RuntimeException {

    private final List<String> violations;

    public RfpValidationException(String message) {
        this(message, List.of(message));
    }

    public RfpValidationException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }
}
