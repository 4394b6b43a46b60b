package com.acmeCables.proposalEngine.match.service;

import com.acmeCables.proposalEngine.catalog.model.Candidate;
import com.acmeCables.proposalEngine.catalog.service.CandidateCatalog;
import com.acmeCables.proposalEngine.config.ProposalEngineProperties;
import com.acmeCables.proposalEngine.match.model.AttributeScore;
import com.acmeCables.proposalEngine.match.model.MatchResult;
import com.acmeCables.proposalEngine.match.model.MatchStatus;
import com.acmeCables.proposalEngine.match.model.RerankResult;
import com.acmeCables.proposalEngine.match.model.ScoredCandidate;
import com.acmeCables.proposalEngine.orchestrator.exception.RunCancelledException;
import com.acmeCables.proposalEngine.orchestrator.model.RunHandle;
import com.acmeCables.proposalEngine.orchestrator.model.StageResult;
import com.acmeCables.proposalEngine.resilience.RetryPolicy;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import com.acmeCables.proposalEngine.retrieval.model.VectorHit;
import com.acmeCables.proposalEngine.retrieval.service.EmbeddingClient;
import com.acmeCables.proposalEngine.retrieval.service.VectorSearchClient;
import com.acmeCables.proposalEngine.rfp.model.RequestItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spec-match engine - finds and scores catalog candidates for every RFP item.
 *
 * <p>Per item: build a query text, embed it, fetch the top-K nearest catalog entries, score every
 * candidate attribute by attribute, rank deterministically, optionally re-rank the best ones, and
 * accept the winner only if it reaches the acceptance threshold.</p>
 *
 * <p>Items of one run are matched concurrently on the shared matching pool. Results are collected
 * in RFP order. An item whose retrieval is unavailable, or that is still running when the stage
 * timeout elapses, becomes UNMATCHED with an {@code UPSTREAM_UNAVAILABLE} annotation and the
 * stage is reported as degraded.</p>
 */
@Slf4j
@Service
public class SpecMatchEngine {

    private final EmbeddingClient embeddingClient;
    private final VectorSearchClient vectorSearchClient;
    private final CandidateCatalog candidateCatalog;
    private final AttributeScorer attributeScorer;
    private final CandidateRanker candidateRanker;
    private final RerankService rerankService;
    private final RetryPolicy retryPolicy;
    private final ProposalEngineProperties properties;
    private final AsyncTaskExecutor matchingExecutor;

    public SpecMatchEngine(EmbeddingClient embeddingClient,
                           VectorSearchClient vectorSearchClient,
                           CandidateCatalog candidateCatalog,
                           AttributeScorer attributeScorer,
                           CandidateRanker candidateRanker,
                           RerankService rerankService,
                           RetryPolicy retryPolicy,
                           ProposalEngineProperties properties,
                           @Qualifier("matchingExecutor") AsyncTaskExecutor matchingExecutor) {
        this.embeddingClient = embeddingClient;
        this.vectorSearchClient = vectorSearchClient;
        this.candidateCatalog = candidateCatalog;
        this.attributeScorer = attributeScorer;
        this.candidateRanker = candidateRanker;
        this.rerankService = rerankService;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.matchingExecutor = matchingExecutor;
    }

    /**
     * Matches all items of a run.
     *
     * @return one result per item, in item order; degraded if any item lost retrieval or re-rank
     * @throws RunCancelledException if the run is cancelled while matching
     */
    public StageResult<List<MatchResult>> matchAll(List<RequestItem> items, RunHandle handle) {
        long deadline = System.nanoTime() + properties.getMatch().getStageTimeout().toNanos();

        List<Future<MatchResult>> tasks = new ArrayList<>(items.size());
        for (RequestItem item : items) {
            Future<MatchResult> task = matchingExecutor.submit(() -> matchItem(item));
            handle.track(task);
            tasks.add(task);
        }

        List<MatchResult> results = new ArrayList<>(items.size());
        List<String> notes = new ArrayList<>();
        try {
            for (int i = 0; i < items.size(); i++) {
                String itemId = items.get(i).getItemId();
                MatchResult result = await(itemId, tasks.get(i), deadline, handle);
                results.add(result);
                if (result.getAnnotation() != null) {
                    notes.add("Item " + itemId + " unmatched: " + result.getAnnotationDetail());
                }
                if (result.isRerankDegraded()) {
                    notes.add("Item " + itemId + " re-rank fell back to deterministic ranking");
                }
            }
        } catch (RuntimeException e) {
            tasks.forEach(task -> task.cancel(true));
            throw e;
        }

        return notes.isEmpty() ? StageResult.success(List.copyOf(results)) : StageResult.degraded(List.copyOf(results), notes);
    }

    private MatchResult await(String itemId, Future<MatchResult> task, long deadline, RunHandle handle) {
        handle.throwIfCancelled();
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return task.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Item matching timed out - rfpId: {}, itemId: {}", handle.getRfpId(), itemId);
            return MatchResult.unavailable(itemId, "Matching stage timed out");
        } catch (CancellationException e) {
            handle.throwIfCancelled();
            return MatchResult.unavailable(itemId, "Matching task cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Run for RFP " + handle.getRfpId() + " interrupted while matching");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Matching item " + itemId + " failed", cause);
        }
    }

    /**
     * Matches one item. Retrieval failures after retries yield an annotated UNMATCHED result.
     */
    public MatchResult matchItem(RequestItem item) {
        String itemId = item.getItemId();
        List<VectorHit> hits;
        try {
            String query = buildQueryText(item);
            float[] vector = retryPolicy.execute("embedding", () -> embeddingClient.embed(query));
            hits = retryPolicy.execute("vector search",
                    () -> vectorSearchClient.query(vector, properties.getMatch().getTopK()));
        } catch (UpstreamUnavailableException e) {
            log.warn("Retrieval unavailable - itemId: {}, error: {}", itemId, e.getMessage());
            return MatchResult.unavailable(itemId, e.getMessage());
        }

        List<ScoredCandidate> scored = new ArrayList<>();
        for (VectorHit hit : hits) {
            Optional<Candidate> candidate = candidateCatalog.getCandidate(hit.getCandidateId());
            if (candidate.isEmpty()) {
                log.warn("Vector search returned candidate unknown to the catalog - itemId: {}, candidateId: {}",
                        itemId, hit.getCandidateId());
                continue;
            }
            scored.add(score(item, candidate.get(), hit.getSimilarity()));
        }
        List<ScoredCandidate> ranked = candidateRanker.rank(scored);

        RerankResult rerank = rerankService.rerank(item, ranked);
        MatchResult result = select(itemId, ranked, rerank);
        log.debug("Item matched - itemId: {}, candidates: {}, status: {}, chosen: {}, score: {}",
                itemId, ranked.size(), result.getStatus(), result.getChosenCandidateId(), result.getFinalScore());
        return result;
    }

    private ScoredCandidate score(RequestItem item, Candidate candidate, double similarity) {
        List<AttributeScore> attributeScores = attributeScorer.scoreAttributes(item, candidate);
        return ScoredCandidate.builder()
                .candidateId(candidate.getCandidateId())
                .candidateName(candidate.getName())
                .unitPrice(candidate.getUnitPrice())
                .similarity(similarity)
                .score(attributeScorer.itemScore(attributeScores))
                .attributeScores(attributeScores)
                .build();
    }

    private MatchResult select(String itemId, List<ScoredCandidate> ranked, RerankResult rerank) {
        MatchResult.MatchResultBuilder result = MatchResult.builder()
                .itemId(itemId)
                .rankedCandidates(ranked)
                .rerankOrder(rerank.getOrder())
                .rerankDegraded(rerank.isDegraded());

        if (ranked.isEmpty()) {
            return result.status(MatchStatus.UNMATCHED).attributeScores(List.of()).build();
        }

        ScoredCandidate best = ranked.get(0);
        if (best.getScore() < properties.getMatch().getAcceptanceThreshold()) {
            return result.status(MatchStatus.UNMATCHED)
                    .finalScore(best.getScore())
                    .attributeScores(best.getAttributeScores())
                    .build();
        }

        ScoredCandidate chosen = best;
        if (rerank.isApplied()) {
            String preferredId = rerank.getOrder().get(0);
            chosen = ranked.stream()
                    .filter(candidate -> candidate.getCandidateId().equals(preferredId))
                    .findFirst()
                    .orElse(best);
        }
        return result.status(MatchStatus.MATCHED)
                .chosenCandidateId(chosen.getCandidateId())
                .finalScore(chosen.getScore())
                .attributeScores(chosen.getAttributeScores())
                .build();
    }

    /**
     * Description followed by the required attributes as {@code name: value} pairs.
     */
    static String buildQueryText(RequestItem item) {
        StringJoiner attributes = new StringJoiner(", ");
        if (item.getRequiredAttributes() != null) {
            item.getRequiredAttributes().forEach((name, requirement) ->
                    attributes.add(name + ": " + requirement.getValue()));
        }
        String description = item.getDescription() != null ? item.getDescription().trim() : "";
        if (attributes.length() == 0) {
            return description;
        }
        return description.isEmpty() ? attributes.toString() : description + ". " + attributes;
    }
}
