package com.acmeCables.proposalEngine.match.service;

import com.acmeCables.proposalEngine.config.ProposalEngineProperties;
import com.acmeCables.proposalEngine.llm.service.LanguageModelClient;
import com.acmeCables.proposalEngine.match.dto.RerankResponse;
import com.acmeCables.proposalEngine.match.model.RerankFunctionDefinition;
import com.acmeCables.proposalEngine.match.model.RerankResult;
import com.acmeCables.proposalEngine.match.model.ScoredCandidate;
import com.acmeCables.proposalEngine.match.prompt.RerankPrompt;
import com.acmeCables.proposalEngine.orchestrator.exception.RunCancelledException;
import com.acmeCables.proposalEngine.resilience.RetryPolicy;
import com.acmeCables.proposalEngine.rfp.model.RequestItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Optional language-model re-ranking of the best candidates of one item.
 *
 * <p>Only candidates at or above the acceptance threshold are offered, at most {@code topN} of
 * them, so a re-rank can never turn an unmatched item into a matched one. The model's order is
 * sanitised: unknown ids are dropped, duplicates removed, omitted candidates appended in
 * deterministic order. Any failure falls back to the deterministic ranking.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RerankService {

    private final LanguageModelClient languageModelClient;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final ProposalEngineProperties properties;

    /**
     * @param ranked candidates in deterministic order
     */
    public RerankResult rerank(RequestItem item, List<ScoredCandidate> ranked) {
        if (!properties.getRerank().isEnabled()) {
            return RerankResult.skipped();
        }
        double threshold = properties.getMatch().getAcceptanceThreshold();
        List<ScoredCandidate> eligible = ranked.stream()
                .filter(candidate -> candidate.getScore() >= threshold)
                .limit(Math.max(0, properties.getRerank().getTopN()))
                .toList();
        if (eligible.size() < 2) {
            return RerankResult.skipped();
        }

        try {
            String arguments = retryPolicy.execute("candidate re-rank", () -> languageModelClient.callFunction(
                    RerankPrompt.SYSTEM_PROMPT,
                    RerankPrompt.buildUserMessage(item, eligible),
                    RerankFunctionDefinition.FUNCTION_NAME,
                    RerankFunctionDefinition.FUNCTION_DESCRIPTION,
                    RerankFunctionDefinition.getFunctionSchema()));
            if (arguments == null || arguments.isBlank()) {
                log.warn("Re-rank returned no function call - itemId: {}", item.getItemId());
                return RerankResult.fallback("Re-rank returned no function call");
            }

            RerankResponse response = objectMapper.readValue(arguments, RerankResponse.class);
            List<String> order = sanitize(response.getRankedCandidateIds(), eligible);
            if (order.isEmpty()) {
                log.warn("Re-rank returned no known candidate ids - itemId: {}, returned: {}",
                        item.getItemId(), response.getRankedCandidateIds());
                return RerankResult.fallback("Re-rank returned no known candidate ids");
            }
            log.debug("Re-rank applied - itemId: {}, order: {}", item.getItemId(), order);
            return RerankResult.applied(order);

        } catch (RunCancelledException e) {
            throw e;
        } catch (JsonProcessingException e) {
            log.warn("Re-rank arguments unreadable - itemId: {}, error: {}", item.getItemId(), e.getOriginalMessage());
            return RerankResult.fallback("Re-rank response unreadable");
        } catch (RuntimeException e) {
            log.warn("Re-rank failed, keeping deterministic ranking - itemId: {}, error: {}",
                    item.getItemId(), e.getMessage());
            return RerankResult.fallback("Re-rank failed: " + e.getMessage());
        }
    }

    /**
     * @return empty when the model named none of the eligible candidates
     */
    static List<String> sanitize(List<String> returned, List<ScoredCandidate> eligible) {
        Set<String> eligibleIds = new LinkedHashSet<>();
        eligible.forEach(candidate -> eligibleIds.add(candidate.getCandidateId()));

        Set<String> order = new LinkedHashSet<>();
        if (returned != null) {
            for (String id : returned) {
                if (id != null && eligibleIds.contains(id.trim())) {
                    order.add(id.trim());
                }
            }
        }
        if (order.isEmpty()) {
            return List.of();
        }
        order.addAll(eligibleIds);
        return new ArrayList<>(order);
    }
}
