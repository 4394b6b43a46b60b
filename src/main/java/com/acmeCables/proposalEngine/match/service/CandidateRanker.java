package com.acmeCables.proposalEngine.match.service;

import com.acmeCables.proposalEngine.match.model.ScoredCandidate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic ordering of scored candidates: score desc, unit price asc, candidate id asc.
 * The input order (vector-search order) never influences the outcome.
 */
@Component
public class CandidateRanker {

    static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingDouble(ScoredCandidate::getScore).reversed()
            .thenComparing(ScoredCandidate::getUnitPrice, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()))
            .thenComparing(ScoredCandidate::getCandidateId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    public List<ScoredCandidate> rank(List<ScoredCandidate> candidates) {
        List<ScoredCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(RANKING);
        return List.copyOf(ranked);
    }
}
