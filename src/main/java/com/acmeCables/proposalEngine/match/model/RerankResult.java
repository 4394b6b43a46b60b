package com.acmeCables.proposalEngine.match.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of an attempted re-rank. {@code order} is empty when no re-rank was applied.
 */
@Value
public class RerankResult {

    List<String> order;

    boolean degraded;

    String detail;

    public static RerankResult skipped() {
        return new RerankResult(List.of(), false, null);
    }

    public static RerankResult applied(List<String> order) {
        return new RerankResult(List.copyOf(order), false, null);
    }

    public static RerankResult fallback(String detail) {
        return new RerankResult(List.of(), true, detail);
    }

    public boolean isApplied() {
        return !order.isEmpty();
    }
}
