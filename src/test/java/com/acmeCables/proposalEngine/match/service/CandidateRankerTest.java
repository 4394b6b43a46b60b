package com.acmeCables.proposalEngine.match.service;

import com.acmeCables.proposalEngine.match.model.ScoredCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateRankerTest {

    private final CandidateRanker ranker = new CandidateRanker();

    private static ScoredCandidate candidate(String id, double score, String price, double similarity) {
        return ScoredCandidate.builder()
                .candidateId(id)
                .score(score)
                .unitPrice(price != null ? new BigDecimal(price) : null)
                .similarity(similarity)
                .build();
    }

    @Test
    @DisplayName("orders by score, then cheaper price, then candidate id")
    void tieBreaks() {
        List<ScoredCandidate> ranked = ranker.rank(List.of(
                candidate("SKU-C", 80.0, "100.00", 0.9),
                candidate("SKU-B", 90.0, "200.00", 0.1),
                candidate("SKU-A", 80.0, "100.00", 0.5),
                candidate("SKU-D", 80.0, "90.00", 0.2),
                candidate("SKU-E", 80.0, null, 0.99)));

        assertThat(ranked).extracting(ScoredCandidate::getCandidateId)
                .containsExactly("SKU-B", "SKU-D", "SKU-A", "SKU-C", "SKU-E");
    }

    @Test
    @DisplayName("ignores the retrieval order")
    void independentOfInputOrder() {
        List<ScoredCandidate> input = new ArrayList<>(List.of(
                candidate("SKU-1", 60.0, "10", 0.3),
                candidate("SKU-2", 60.0, "10", 0.8),
                candidate("SKU-3", 75.0, "50", 0.1)));
        List<ScoredCandidate> first = ranker.rank(input);
        Collections.reverse(input);

        assertThat(ranker.rank(input)).isEqualTo(first);
    }
}
