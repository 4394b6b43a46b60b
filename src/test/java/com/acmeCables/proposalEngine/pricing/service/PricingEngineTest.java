package com.acmeCables.proposalEngine.pricing.service;

import com.acmeCables.proposalEngine.catalog.model.Candidate;
import com.acmeCables.proposalEngine.catalog.service.CandidateCatalog;
import com.acmeCables.proposalEngine.match.model.MatchResult;
import com.acmeCables.proposalEngine.match.model.MatchStatus;
import com.acmeCables.proposalEngine.pricing.model.PricingLine;
import com.acmeCables.proposalEngine.pricing.model.PricingSummary;
import com.acmeCables.proposalEngine.pricing.model.ProposalTotals;
import com.acmeCables.proposalEngine.rfp.model.RequestItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class PricingEngineTest {

    @Mock private CandidateCatalog candidateCatalog;

    private final Map<String, Candidate> catalog = new HashMap<>();
    private PricingEngine pricingEngine;

    @BeforeEach
    void setUp() {
        pricingEngine = new PricingEngine(candidateCatalog);
        lenient().when(candidateCatalog.getCandidate(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(catalog.get(invocation.<String>getArgument(0))));
    }

    private void catalogue(String candidateId, String unitPrice) {
        catalog.put(candidateId, Candidate.builder()
                .candidateId(candidateId)
                .unitPrice(unitPrice != null ? new BigDecimal(unitPrice) : null)
                .build());
    }

    private static RequestItem item(String itemId, String quantity) {
        return RequestItem.builder().itemId(itemId).quantity(new BigDecimal(quantity)).build();
    }

    private static MatchResult matched(String itemId, String candidateId) {
        return MatchResult.builder()
                .itemId(itemId)
                .chosenCandidateId(candidateId)
                .status(MatchStatus.MATCHED)
                .rankedCandidates(List.of())
                .attributeScores(List.of())
                .build();
    }

    private static MatchResult unmatched(String itemId) {
        return MatchResult.builder()
                .itemId(itemId)
                .status(MatchStatus.UNMATCHED)
                .rankedCandidates(List.of())
                .attributeScores(List.of())
                .build();
    }

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    @Nested
    @DisplayName("price()")
    class Price {

        @Test
        @DisplayName("allocates the test pool in proportion to material cost")
        void proportionalAllocation() {
            catalogue("SKU-1", "100");
            catalogue("SKU-2", "200");
            catalogue("SKU-3", "300");
            List<RequestItem> items = List.of(item("I1", "1"), item("I2", "1"), item("I3", "1"));

            PricingSummary summary = pricingEngine.price(items,
                    List.of(matched("I1", "SKU-1"), matched("I2", "SKU-2"), matched("I3", "SKU-3")), amount("60"));

            assertThat(summary.getLines()).extracting(PricingLine::getAllocatedTestCost)
                    .containsExactly(amount("10.00"), amount("20.00"), amount("30.00"));
            assertThat(summary.getLines()).extracting(PricingLine::getTotalCost)
                    .containsExactly(amount("110.00"), amount("220.00"), amount("330.00"));
            ProposalTotals totals = summary.getTotals();
            assertThat(totals.getMatchedItemCount()).isEqualTo(3);
            assertThat(totals.getTotalMaterialCost()).isEqualByComparingTo("600");
            assertThat(totals.getAllocatedTestCost()).isEqualByComparingTo("60");
            assertThat(totals.getUnallocatedTestCost()).isEqualByComparingTo("0");
            assertThat(totals.getGrandTotal()).isEqualByComparingTo("660");
        }

        @Test
        @DisplayName("gives the rounding remainder to the largest material cost")
        void roundingRemainder() {
            catalogue("SKU-1", "1");
            List<RequestItem> items = List.of(item("I1", "1"), item("I2", "1"), item("I3", "2"));
            List<MatchResult> matches = List.of(matched("I1", "SKU-1"), matched("I2", "SKU-1"), matched("I3", "SKU-1"));

            PricingSummary summary = pricingEngine.price(items, matches, amount("100"));

            // 25.00, 25.00, 50.00 splits evenly; 100 / 3 equal lines would not
            assertThat(summary.getLines()).extracting(PricingLine::getAllocatedTestCost)
                    .containsExactly(amount("25.00"), amount("25.00"), amount("50.00"));

            PricingSummary thirds = pricingEngine.price(
                    List.of(item("I1", "1"), item("I2", "1"), item("I3", "1")), matches, amount("100"));
            assertThat(thirds.getLines()).extracting(PricingLine::getAllocatedTestCost)
                    .containsExactly(amount("33.34"), amount("33.33"), amount("33.33"));
            assertThat(thirds.getTotals().getAllocatedTestCost()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("never allocates a negative share when the pool is smaller than one cent per line")
        void tinyPoolAcrossEqualLines() {
            catalogue("SKU-1", "100");
            List<RequestItem> items = List.of(item("I1", "1"), item("I2", "1"), item("I3", "1"), item("I4", "1"));
            List<MatchResult> matches = List.of(matched("I1", "SKU-1"), matched("I2", "SKU-1"),
                    matched("I3", "SKU-1"), matched("I4", "SKU-1"));

            PricingSummary summary = pricingEngine.price(items, matches, amount("0.02"));

            assertThat(summary.getLines()).extracting(PricingLine::getAllocatedTestCost)
                    .allSatisfy(share -> assertThat(share.signum()).isGreaterThanOrEqualTo(0))
                    .containsExactly(amount("0.02"), amount("0.00"), amount("0.00"), amount("0.00"));
            assertThat(summary.getLines()).extracting(PricingLine::getTotalCost)
                    .allSatisfy(total -> assertThat(total).isGreaterThanOrEqualTo(amount("100.00")));
            assertThat(summary.getTotals().getAllocatedTestCost()).isEqualByComparingTo("0.02");
        }

        @Test
        @DisplayName("computes material cost as quantity times unit price")
        void materialCost() {
            catalogue("SKU-HT", "1450.00");

            PricingSummary summary = pricingEngine.price(List.of(item("I1", "5000")),
                    List.of(matched("I1", "SKU-HT")), amount("78000"));

            PricingLine line = summary.getLines().get(0);
            assertThat(line.getMaterialCost()).isEqualTo(amount("7250000.00"));
            assertThat(line.getAllocatedTestCost()).isEqualTo(amount("78000.00"));
            assertThat(line.getUnitPrice()).isEqualByComparingTo("1450");
            assertThat(summary.getTotals().getGrandTotal()).isEqualTo(amount("7328000.00"));
        }

        @Test
        @DisplayName("excludes unmatched items and keeps RFP order")
        void skipsUnmatched() {
            catalogue("SKU-1", "10");
            catalogue("SKU-3", "30");
            List<RequestItem> items = List.of(item("I1", "1"), item("I2", "1"), item("I3", "1"));

            PricingSummary summary = pricingEngine.price(items,
                    List.of(matched("I3", "SKU-3"), unmatched("I2"), matched("I1", "SKU-1")), amount("40"));

            assertThat(summary.getLines()).extracting(PricingLine::getItemId).containsExactly("I1", "I3");
            assertThat(summary.getTotals().getMatchedItemCount()).isEqualTo(2);
            assertThat(summary.getTotals().getAllocatedTestCost()).isEqualByComparingTo("40");
        }

        @Test
        @DisplayName("leaves the pool unallocated when nothing matched")
        void noMatches() {
            PricingSummary summary = pricingEngine.price(List.of(item("I1", "1")), List.of(unmatched("I1")), amount("500"));

            assertThat(summary.getLines()).isEmpty();
            assertThat(summary.getTotals().getMatchedItemCount()).isZero();
            assertThat(summary.getTotals().getAllocatedTestCost()).isEqualByComparingTo("0");
            assertThat(summary.getTotals().getUnallocatedTestCost()).isEqualByComparingTo("500");
            assertThat(summary.getTotals().getGrandTotal()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("leaves the pool unallocated when matched items carry no material cost")
        void zeroMaterialCost() {
            catalogue("SKU-FREE", null);

            PricingSummary summary = pricingEngine.price(List.of(item("I1", "10")),
                    List.of(matched("I1", "SKU-FREE")), amount("500"));

            assertThat(summary.getLines()).hasSize(1);
            assertThat(summary.getLines().get(0).getMaterialCost()).isEqualByComparingTo("0");
            assertThat(summary.getLines().get(0).getAllocatedTestCost()).isEqualByComparingTo("0");
            assertThat(summary.getTotals().getUnallocatedTestCost()).isEqualByComparingTo("500");
        }

        @Test
        @DisplayName("prices an empty pool at zero test cost")
        void emptyPool() {
            catalogue("SKU-1", "10");

            PricingSummary summary = pricingEngine.price(List.of(item("I1", "3")),
                    List.of(matched("I1", "SKU-1")), null);

            assertThat(summary.getTotals().getTestCostPool()).isEqualByComparingTo("0");
            assertThat(summary.getLines().get(0).getTotalCost()).isEqualByComparingTo("30");
        }

        @Test
        @DisplayName("fails when the chosen candidate is not catalogued")
        void unknownCandidate() {
            assertThatThrownBy(() -> pricingEngine.price(List.of(item("I1", "1")),
                    List.of(matched("I1", "SKU-GONE")), amount("10")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("SKU-GONE");
        }
    }
}
