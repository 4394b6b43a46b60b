package com.acmeCables.proposalEngine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Pipeline knobs for matching, re-ranking, narrative and collaborator resilience.
 *
 * <p>Defaults mirror the documented behaviour: top-10 retrieval, acceptance threshold 50,
 * numeric tolerance 10%, re-rank off, 3 attempts with exponential backoff.</p>
 */
@Data
@ConfigurationProperties(prefix = "proposal")
public class ProposalEngineProperties {

    private final Match match = new Match();
    private final Rerank rerank = new Rerank();
    private final Narrative narrative = new Narrative();
    private final Retry retry = new Retry();

    @Data
    public static class Match {

        /** Candidates requested from vector search per item. */
        private int topK = 10;

        /** Minimum SpecMatch% for an item to be MATCHED. */
        private double acceptanceThreshold = 50.0;

        /** Relative band for numeric attribute values, 0.10 = within 10%. */
        private double numericTolerance = 0.10;

        /** Items matched concurrently, shared across runs. */
        private int maxConcurrentItems = 4;

        /** Wall-clock budget of the whole match stage of a run. */
        private Duration stageTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Rerank {

        private boolean enabled = false;

        /** How many above-threshold candidates the language model may reorder. */
        private int topN = 3;
    }

    @Data
    public static class Narrative {

        private boolean enabled = true;

        private double temperature = 0.7;
    }

    @Data
    public static class Retry {

        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(200);

        private double backoffMultiplier = 2.0;

        /** Timeout of a single collaborator call attempt. */
        private Duration callTimeout = Duration.ofSeconds(10);
    }
}
