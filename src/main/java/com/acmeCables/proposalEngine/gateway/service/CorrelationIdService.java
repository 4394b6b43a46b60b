package com.acmeCables.proposalEngine.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating correlation IDs for request tracking.
 */
@Service
public class CorrelationIdService {

    /**
     * Uses the caller's correlation id when one was supplied, otherwise generates a new one.
     */
    public String resolveCorrelationId(String suppliedCorrelationId) {
        if (suppliedCorrelationId != null && !suppliedCorrelationId.isBlank()) {
            return suppliedCorrelationId.trim();
        }
        return UUID.randomUUID().toString();
    }
}
