package com.acmeCables.proposalEngine.match.prompt;

import com.acmeCables.proposalEngine.match.model.AttributeScore;
import com.acmeCables.proposalEngine.match.model.ScoredCandidate;
import com.acmeCables.proposalEngine.rfp.model.RequestItem;

import java.util.List;

/**
 * System prompt and user message for re-ranking the top candidates of one item.
 */
public class RerankPrompt {

    private RerankPrompt() {}

    public static final String SYSTEM_PROMPT = """
        You are the Technical Agent of a cable manufacturing OEM.
        You compare catalog products (SKUs) against one RFP line item and decide which product
        is the best technical fit.

        You MUST call the report_candidate_ranking function with every candidate id exactly once.

        Prioritize:
        - Exact matches on critical specs (voltage, conductor size, insulation type)
        - Standards compliance (IS, IEC, BS standards)
        - Material specifications

        RULES:
        - Only use candidate ids from the list you are given
        - Do not drop or invent candidates
        """;

    public static String buildUserMessage(RequestItem item, List<ScoredCandidate> candidates) {
        StringBuilder message = new StringBuilder();
        message.append("RFP item ").append(item.getItemId()).append(": ")
                .append(item.getDescription() != null ? item.getDescription() : "").append('\n');
        message.append("Required specifications:\n");
        if (item.getRequiredAttributes() != null) {
            item.getRequiredAttributes().forEach((name, requirement) ->
                    message.append("- ").append(name).append(": ").append(requirement.getValue())
                            .append(" (tolerance: ").append(requirement.getTolerance()).append(")\n"));
        }
        message.append("\nCandidates:\n");
        for (ScoredCandidate candidate : candidates) {
            message.append("- id: ").append(candidate.getCandidateId())
                    .append(", name: ").append(candidate.getCandidateName())
                    .append(", spec match: ").append(candidate.getScore()).append("%\n");
            for (AttributeScore score : candidate.getAttributeScores()) {
                message.append("    ").append(score.getAttributeName()).append(": ")
                        .append(score.getCandidateValue() != null ? score.getCandidateValue() : "N/A")
                        .append(" [").append(score.getMatchType()).append("]\n");
            }
        }
        return message.toString();
    }
}
