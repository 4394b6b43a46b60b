package com.acmeCables.proposalEngine.gateway.exception;

import com.acmeCables.proposalEngine.gateway.model.ErrorCode;
import lombok.Getter;

/**
 * Exception thrown when a run terminated in FAILED state.
 */
@Getter
public class ProposalRunFailedException extends RuntimeException {

    private final ErrorCode errorCode;

    private final String correlationId;

    public ProposalRunFailedException(ErrorCode errorCode, String correlationId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.correlationId = correlationId;
    }
}
