package com.acmeCables.proposalEngine.gateway.model;

import org.springframework.http.HttpStatus;

/**
 * Structured outcome codes exposed to callers of "process RFP by id".
 */
public enum ErrorCode {

    NOT_FOUND(HttpStatus.NOT_FOUND),

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),

    UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),

    /**
     * Narrative, re-rank or some item retrievals degraded; match and pricing data are present.
     */
    PARTIAL_FAILURE(HttpStatus.OK),

    CANCELLED(HttpStatus.CONFLICT),

    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
