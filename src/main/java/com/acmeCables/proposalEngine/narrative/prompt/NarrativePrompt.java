package com.acmeCables.proposalEngine.narrative.prompt;

import com.acmeCables.proposalEngine.narrative.model.NarrativeRequest;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Prompts for the proposal summary written for the buyer.
 */
public class NarrativePrompt {

    private NarrativePrompt() {}

    public static final String SYSTEM_PROMPT = """
        You are the proposal writer of a cable manufacturing OEM responding to a procurement RFP.

        You receive the technical matching results and the pricing of the proposal.
        Your output must be professional, accurate and ready for submission to the buyer.

        RULES:
        - Use only the figures provided, never invent products, scores or amounts
        - Quote amounts exactly as given, in INR
        - Plain prose, no markdown, no bullet lists
        """;

    /**
     * Builds the user prompt: the instruction followed by the RFP context.
     */
    public static String buildUserPrompt(NarrativeRequest request) {
        StringBuilder context = new StringBuilder();
        context.append("RFP: ").append(request.getTitle() != null ? request.getTitle() : request.getRfpId()).append('\n');
        context.append("Buyer: ").append(request.getBuyer() != null ? request.getBuyer() : "Unknown").append("\n\n");

        context.append("Technical Recommendations (")
                .append(request.getMatchedItemCount()).append(" of ").append(request.getItemCount())
                .append(" items matched):\n");
        if (request.getTopMatches() != null) {
            for (NarrativeRequest.TopMatch match : request.getTopMatches()) {
                context.append("- Item ").append(match.getItemId()).append(": ")
                        .append(match.getCandidateName() != null ? match.getCandidateName() : match.getCandidateId())
                        .append(" (Match: ").append(match.getScore()).append("%)\n");
            }
        }

        context.append("\nPricing Summary:\n");
        context.append("- Material Cost: INR ").append(formatAmount(request.getTotalMaterialCost())).append('\n');
        context.append("- Testing Cost: INR ").append(formatAmount(request.getTestCost())).append('\n');
        context.append("- Grand Total: INR ").append(formatAmount(request.getGrandTotal())).append('\n');

        return """
            Based on this RFP analysis, write a professional 2-3 paragraph summary
            explaining our proposed solution and pricing. Focus on:
            1. How well our products match the requirements
            2. Key technical highlights
            3. Competitive pricing

            """ + context;
    }

    static String formatAmount(BigDecimal amount) {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return format.format(amount != null ? amount : BigDecimal.ZERO);
    }
}
