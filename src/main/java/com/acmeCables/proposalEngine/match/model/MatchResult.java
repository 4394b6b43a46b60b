package com.acmeCables.proposalEngine.match.model;

import com.acmeCables.proposalEngine.gateway.model.ErrorCode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of matching one request item.
 *
 * <p>{@code status} is {@link MatchStatus#UNMATCHED} iff no candidate reached the acceptance
 * threshold, or retrieval failed (then {@code annotation} is set). An unmatched item keeps its
 * ranked candidates for visibility but has no chosen candidate and is excluded from pricing.</p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class MatchResult {

    private static final int TOP_CANDIDATES = 3;

    String itemId;

    /**
     * Deterministic ranking: score desc, unit price asc, candidate id asc.
     */
    List<ScoredCandidate> rankedCandidates;

    String chosenCandidateId;

    double finalScore;

    /**
     * Attribute breakdown of the chosen candidate, or of the best-ranked one when unmatched.
     */
    List<AttributeScore> attributeScores;

    MatchStatus status;

    /**
     * Set when the item could not be matched because a collaborator was unavailable.
     */
    ErrorCode annotation;

    String annotationDetail;

    /**
     * Candidate ids in the order the language model preferred, when a re-rank was applied.
     */
    List<String> rerankOrder;

    boolean rerankDegraded;

    public boolean isMatched() {
        return status == MatchStatus.MATCHED;
    }

    public boolean isReranked() {
        return rerankOrder != null && !rerankOrder.isEmpty();
    }

    /**
     * First three ranked candidates, for the side-by-side comparison view.
     */
    public List<ScoredCandidate> getTopCandidates() {
        if (rankedCandidates == null) {
            return List.of();
        }
        return rankedCandidates.subList(0, Math.min(TOP_CANDIDATES, rankedCandidates.size()));
    }

    public static MatchResult unavailable(String itemId, String detail) {
        return MatchResult.builder()
                .itemId(itemId)
                .rankedCandidates(List.of())
                .attributeScores(List.of())
                .status(MatchStatus.UNMATCHED)
                .annotation(ErrorCode.UPSTREAM_UNAVAILABLE)
                .annotationDetail(detail)
                .build();
    }
}
