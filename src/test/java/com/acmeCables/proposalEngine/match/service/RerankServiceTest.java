package com.acmeCables.proposalEngine.match.service;

import com.acmeCables.proposalEngine.config.ProposalEngineProperties;
import com.acmeCables.proposalEngine.llm.service.LanguageModelClient;
import com.acmeCables.proposalEngine.match.model.RerankFunctionDefinition;
import com.acmeCables.proposalEngine.match.model.RerankResult;
import com.acmeCables.proposalEngine.match.model.ScoredCandidate;
import com.acmeCables.proposalEngine.resilience.RetryPolicy;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import com.acmeCables.proposalEngine.rfp.model.RequestItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RerankServiceTest {

    private static final RequestItem ITEM = RequestItem.builder()
            .itemId("ITEM-1")
            .description("11 kV XLPE cable")
            .quantity(BigDecimal.ONE)
            .build();

    @Mock private LanguageModelClient languageModelClient;

    private ProposalEngineProperties properties;
    private ExecutorService callExecutor;
    private RerankService rerankService;

    @BeforeEach
    void setUp() {
        properties = new ProposalEngineProperties();
        properties.getRerank().setEnabled(true);
        callExecutor = Executors.newCachedThreadPool();
        RetryPolicy retryPolicy = RetryPolicy.exponential("test", 2, Duration.ofMillis(1), 1.0,
                Duration.ofSeconds(2), callExecutor);
        rerankService = new RerankService(languageModelClient, retryPolicy, new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    private static ScoredCandidate scored(String id, double score) {
        return ScoredCandidate.builder()
                .candidateId(id)
                .candidateName(id + " cable")
                .score(score)
                .attributeScores(List.of())
                .build();
    }

    private static final List<ScoredCandidate> RANKED = List.of(
            scored("SKU-A", 95.0), scored("SKU-B", 90.0), scored("SKU-C", 70.0), scored("SKU-D", 65.0), scored("SKU-E", 20.0));

    private void modelReturns(String arguments) {
        when(languageModelClient.callFunction(anyString(), anyString(),
                eq(RerankFunctionDefinition.FUNCTION_NAME), anyString(), anyMap()))
                .thenReturn(arguments);
    }

    @Nested
    @DisplayName("rerank()")
    class Rerank {

        @Test
        @DisplayName("applies the model's order over the top eligible candidates")
        void applied() {
            modelReturns("{\"rankedCandidateIds\":[\"SKU-C\",\"SKU-A\",\"SKU-B\"],\"reasoning\":\"better armour\"}");

            RerankResult result = rerankService.rerank(ITEM, RANKED);

            assertThat(result.isApplied()).isTrue();
            assertThat(result.isDegraded()).isFalse();
            assertThat(result.getOrder()).containsExactly("SKU-C", "SKU-A", "SKU-B");
        }

        @Test
        @DisplayName("offers only the top N candidates at or above the threshold")
        void offersTopEligible() {
            modelReturns("{\"rankedCandidateIds\":[\"SKU-A\"]}");

            rerankService.rerank(ITEM, RANKED);

            verify(languageModelClient).callFunction(anyString(), contains("SKU-C"),
                    eq(RerankFunctionDefinition.FUNCTION_NAME), anyString(), anyMap());
            verify(languageModelClient, never()).callFunction(anyString(), contains("SKU-D"),
                    anyString(), anyString(), anyMap());
        }

        @Test
        @DisplayName("is skipped when disabled")
        void disabled() {
            properties.getRerank().setEnabled(false);

            RerankResult result = rerankService.rerank(ITEM, RANKED);

            assertThat(result.isApplied()).isFalse();
            assertThat(result.isDegraded()).isFalse();
            verifyNoInteractions(languageModelClient);
        }

        @Test
        @DisplayName("is skipped with fewer than two eligible candidates")
        void notEnoughCandidates() {
            RerankResult result = rerankService.rerank(ITEM, List.of(scored("SKU-A", 80.0), scored("SKU-B", 30.0)));

            assertThat(result.isApplied()).isFalse();
            assertThat(result.isDegraded()).isFalse();
            verifyNoInteractions(languageModelClient);
        }

        @Test
        @DisplayName("falls back when the model is unavailable")
        void unavailable() {
            when(languageModelClient.callFunction(anyString(), anyString(), anyString(), anyString(), anyMap()))
                    .thenThrow(new UpstreamUnavailableException("Groq down"));

            RerankResult result = rerankService.rerank(ITEM, RANKED);

            assertThat(result.isApplied()).isFalse();
            assertThat(result.isDegraded()).isTrue();
            assertThat(result.getDetail()).contains("Groq down");
        }

        @Test
        @DisplayName("falls back on unreadable arguments")
        void unreadable() {
            modelReturns("not json");

            RerankResult result = rerankService.rerank(ITEM, RANKED);

            assertThat(result.isDegraded()).isTrue();
        }

        @Test
        @DisplayName("falls back when no function was called")
        void noFunctionCall() {
            modelReturns(null);

            assertThat(rerankService.rerank(ITEM, RANKED).isDegraded()).isTrue();
        }

        @Test
        @DisplayName("falls back when the model names only unknown candidates")
        void onlyUnknownIds() {
            modelReturns("{\"rankedCandidateIds\":[\"SKU-X\",\"SKU-E\"]}");

            RerankResult result = rerankService.rerank(ITEM, RANKED);

            assertThat(result.isApplied()).isFalse();
            assertThat(result.isDegraded()).isTrue();
        }
    }

    @Nested
    @DisplayName("sanitize()")
    class Sanitize {

        private final List<ScoredCandidate> eligible = List.of(scored("SKU-A", 95.0), scored("SKU-B", 90.0), scored("SKU-C", 70.0));

        @Test
        @DisplayName("drops unknown ids and duplicates, appends omitted candidates in ranking order")
        void cleansOrder() {
            List<String> order = RerankService.sanitize(Arrays.asList("SKU-B", "SKU-X", " SKU-B ", null), eligible);

            assertThat(order).containsExactly("SKU-B", "SKU-A", "SKU-C");
        }

        @Test
        @DisplayName("is empty when nothing known was returned")
        void empty() {
            assertThat(RerankService.sanitize(null, eligible)).isEmpty();
            assertThat(RerankService.sanitize(List.of("SKU-X"), eligible)).isEmpty();
        }
    }
}
