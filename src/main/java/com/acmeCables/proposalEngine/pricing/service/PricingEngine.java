package com.acmeCables.proposalEngine.pricing.service;

import com.acmeCables.proposalEngine.catalog.model.Candidate;
import com.acmeCables.proposalEngine.catalog.service.CandidateCatalog;
import com.acmeCables.proposalEngine.match.model.MatchResult;
import com.acmeCables.proposalEngine.pricing.exception.AllocationInvariantViolationException;
import com.acmeCables.proposalEngine.pricing.model.PricingLine;
import com.acmeCables.proposalEngine.pricing.model.PricingSummary;
import com.acmeCables.proposalEngine.pricing.model.ProposalTotals;
import com.acmeCables.proposalEngine.rfp.model.RequestItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pricing engine - turns matched items into cost lines and spreads the test-cost pool.
 *
 * <p>All amounts are rounded to 2 decimals, HALF_UP. The pool is allocated in proportion to
 * material cost with every share rounded down to the cent; the leftover cents go to the line with
 * the highest material cost (earliest in RFP order on ties), so the allocations add up to the pool
 * exactly and none is negative. When no matched
 * item carries material cost nothing is allocated and the whole pool is reported as unallocated.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingEngine {

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final int RATIO_SCALE = 12;

    private final CandidateCatalog candidateCatalog;

    /**
     * @param items request items in RFP order
     * @param matchResults match results, one per item; unmatched ones are ignored
     * @param testCostPool shared test cost to allocate
     * @throws AllocationInvariantViolationException if allocations do not reconcile with the pool
     */
    public PricingSummary price(List<RequestItem> items, List<MatchResult> matchResults, BigDecimal testCostPool) {
        BigDecimal pool = scaled(testCostPool != null ? testCostPool : BigDecimal.ZERO);
        Map<String, MatchResult> byItemId = matchResults.stream()
                .collect(Collectors.toMap(MatchResult::getItemId, Function.identity(), (first, second) -> first));

        List<PricingLine> lines = new ArrayList<>();
        for (RequestItem item : items) {
            MatchResult match = byItemId.get(item.getItemId());
            if (match == null || !match.isMatched()) {
                continue;
            }
            BigDecimal unitPrice = unitPrice(match.getChosenCandidateId());
            BigDecimal material = scaled(item.getQuantity().multiply(unitPrice));
            lines.add(PricingLine.builder()
                    .itemId(item.getItemId())
                    .candidateId(match.getChosenCandidateId())
                    .quantity(item.getQuantity())
                    .unitPrice(unitPrice)
                    .materialCost(material)
                    .allocatedTestCost(scaled(BigDecimal.ZERO))
                    .totalCost(material)
                    .build());
        }

        BigDecimal totalMaterial = scaled(lines.stream()
                .map(PricingLine::getMaterialCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add));

        boolean allocatable = !lines.isEmpty() && totalMaterial.signum() > 0;
        if (allocatable) {
            lines = allocate(lines, pool, totalMaterial);
        }

        BigDecimal allocated = scaled(lines.stream()
                .map(PricingLine::getAllocatedTestCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        if (allocatable && allocated.compareTo(pool) != 0) {
            log.error("Test cost allocation does not reconcile - pool: {}, allocated: {}", pool, allocated);
            throw new AllocationInvariantViolationException(pool, allocated);
        }

        BigDecimal unallocated = allocatable ? scaled(BigDecimal.ZERO) : pool;
        ProposalTotals totals = ProposalTotals.builder()
                .matchedItemCount(lines.size())
                .totalMaterialCost(totalMaterial)
                .testCostPool(pool)
                .allocatedTestCost(allocated)
                .unallocatedTestCost(unallocated)
                .grandTotal(scaled(totalMaterial.add(allocated)))
                .build();

        log.debug("Pricing computed - lines: {}, material: {}, pool: {}, unallocated: {}",
                lines.size(), totalMaterial, pool, unallocated);
        return PricingSummary.builder()
                .lines(List.copyOf(lines))
                .totals(totals)
                .build();
    }

    private List<PricingLine> allocate(List<PricingLine> lines, BigDecimal pool, BigDecimal totalMaterial) {
        List<BigDecimal> shares = new ArrayList<>(lines.size());
        BigDecimal sum = BigDecimal.ZERO;
        int largest = 0;
        for (int i = 0; i < lines.size(); i++) {
            BigDecimal material = lines.get(i).getMaterialCost();
            BigDecimal share = pool.multiply(material)
                    .divide(totalMaterial, RATIO_SCALE, RoundingMode.DOWN)
                    .setScale(SCALE, RoundingMode.DOWN);
            shares.add(share);
            sum = sum.add(share);
            // strict comparison keeps the earliest line on ties
            if (material.compareTo(lines.get(largest).getMaterialCost()) > 0) {
                largest = i;
            }
        }
        // shares are rounded down, so the remainder is never negative
        BigDecimal remainder = pool.subtract(sum);
        if (remainder.signum() > 0) {
            shares.set(largest, shares.get(largest).add(remainder));
        }

        List<PricingLine> allocated = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            PricingLine line = lines.get(i);
            BigDecimal share = shares.get(i);
            allocated.add(line.toBuilder()
                    .allocatedTestCost(share)
                    .totalCost(scaled(line.getMaterialCost().add(share)))
                    .build());
        }
        return allocated;
    }

    private BigDecimal unitPrice(String candidateId) {
        Candidate candidate = candidateCatalog.getCandidate(candidateId)
                .orElseThrow(() -> new IllegalStateException("Chosen candidate " + candidateId + " is not in the catalog"));
        BigDecimal price = candidate.getUnitPrice();
        if (price == null) {
            log.warn("No price found for candidate {} - pricing at 0", candidateId);
            return scaled(BigDecimal.ZERO);
        }
        return price;
    }

    private static BigDecimal scaled(BigDecimal amount) {
        return amount.setScale(SCALE, ROUNDING);
    }
}
