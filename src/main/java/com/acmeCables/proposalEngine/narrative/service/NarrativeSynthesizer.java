package com.acmeCables.proposalEngine.narrative.service;

import com.acmeCables.proposalEngine.config.ProposalEngineProperties;
import com.acmeCables.proposalEngine.llm.service.LanguageModelClient;
import com.acmeCables.proposalEngine.narrative.model.NarrativeRequest;
import com.acmeCables.proposalEngine.narrative.prompt.NarrativePrompt;
import com.acmeCables.proposalEngine.orchestrator.exception.RunCancelledException;
import com.acmeCables.proposalEngine.orchestrator.model.StageResult;
import com.acmeCables.proposalEngine.resilience.RetryPolicy;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Narrative synthesizer boundary - asks the language model for the proposal summary.
 *
 * <p>Never fails the run: any error, including a blank reply, yields a degraded stage result with a
 * null narrative. When synthesis is switched off the stage succeeds without a narrative.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NarrativeSynthesizer {

    private final LanguageModelClient languageModelClient;
    private final RetryPolicy retryPolicy;
    private final ProposalEngineProperties properties;

    public StageResult<String> synthesize(NarrativeRequest request, String correlationId) {
        if (!properties.getNarrative().isEnabled()) {
            log.info("Narrative synthesis disabled - correlationId: {}, rfpId: {}", correlationId, request.getRfpId());
            return StageResult.success(null);
        }

        String userPrompt = NarrativePrompt.buildUserPrompt(request);
        double temperature = properties.getNarrative().getTemperature();
        try {
            String narrative = retryPolicy.execute("narrative synthesis",
                    () -> languageModelClient.complete(NarrativePrompt.SYSTEM_PROMPT, userPrompt, temperature));
            if (narrative == null || narrative.isBlank()) {
                log.warn("Language model returned a blank narrative - correlationId: {}, rfpId: {}",
                        correlationId, request.getRfpId());
                return StageResult.degraded(null, List.of("Narrative synthesis returned no text"));
            }
            log.info("Narrative synthesized - correlationId: {}, rfpId: {}, length: {}",
                    correlationId, request.getRfpId(), narrative.length());
            return StageResult.success(narrative.trim());
        } catch (RunCancelledException e) {
            throw e;
        } catch (UpstreamUnavailableException e) {
            log.warn("Narrative synthesis unavailable - correlationId: {}, rfpId: {}, error: {}",
                    correlationId, request.getRfpId(), e.getMessage());
            return StageResult.degraded(null, List.of("Narrative synthesis unavailable: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Narrative synthesis failed - correlationId: {}, rfpId: {}", correlationId, request.getRfpId(), e);
            return StageResult.degraded(null, List.of("Narrative synthesis failed: " + e.getMessage()));
        }
    }
}
