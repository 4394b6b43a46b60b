package com.acmeCables.proposalEngine.pricing.service;

import com.acmeCables.proposalEngine.catalog.model.TestPrice;
import com.acmeCables.proposalEngine.catalog.service.TestPriceCatalog;
import com.acmeCables.proposalEngine.rfp.model.Rfp;
import com.acmeCables.proposalEngine.rfp.model.TestRequirement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Derives the shared test-cost pool of an RFP: the sum of the catalogued prices of its test
 * requirements. A test without a catalogued price contributes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TestCostPoolResolver {

    private final TestPriceCatalog testPriceCatalog;

    public BigDecimal resolvePool(Rfp rfp) {
        BigDecimal pool = BigDecimal.ZERO;
        if (rfp.getTestRequirements() == null) {
            return pool.setScale(2, RoundingMode.HALF_UP);
        }
        for (TestRequirement requirement : rfp.getTestRequirements()) {
            Optional<TestPrice> price = testPriceCatalog.findPrice(requirement.getTestName());
            if (price.isEmpty()) {
                log.warn("No price found for test - rfpId: {}, test: {}", rfp.getRfpId(), requirement.getTestName());
                continue;
            }
            pool = pool.add(price.get().getPrice());
        }
        return pool.setScale(2, RoundingMode.HALF_UP);
    }
}
