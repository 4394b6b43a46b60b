package com.acmeCables.proposalEngine.pricing.exception;

import java.math.BigDecimal;

/**
 * Exception thrown when allocated test costs do not reconcile with the test-cost pool.
 * Valid inputs never produce it; it marks an internal defect and fails the run.
 */
public class AllocationInvariantViolationException extends RuntimeException {

    public AllocationInvariantViolationException(BigDecimal pool, BigDecimal allocated) {
        super("Allocated test cost " + allocated.toPlainString()
                + " does not reconcile with test-cost pool " + pool.toPlainString());
    }
}
