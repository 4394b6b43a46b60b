package com.acmeCables.proposalEngine.match.service;

import com.acmeCables.proposalEngine.catalog.model.Candidate;
import com.acmeCables.proposalEngine.config.ProposalEngineProperties;
import com.acmeCables.proposalEngine.match.model.AttributeMatchType;
import com.acmeCables.proposalEngine.match.model.AttributeScore;
import com.acmeCables.proposalEngine.rfp.model.RequestItem;
import com.acmeCables.proposalEngine.rfp.model.RequiredAttribute;
import com.acmeCables.proposalEngine.rfp.model.ToleranceKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic attribute-level scoring of a candidate against a request item.
 *
 * <p>Rule ladder for one attribute, first hit wins:</p>
 * <ol>
 *   <li>candidate lacks the attribute: 0 ({@link AttributeMatchType#MISSING})</li>
 *   <li>values equal ignoring case and whitespace, or numerically equal with the same unit: 100</li>
 *   <li>both numeric with compatible units, within the tolerance band of the required value: 80</li>
 *   <li>one value contains the other: 60</li>
 *   <li>shared words: 50 plus up to 10 by overlap fraction</li>
 *   <li>otherwise 0</li>
 * </ol>
 * <p>{@link ToleranceKind#EXACT} stops after rule 2 and {@link ToleranceKind#NUMERIC_PERCENT} after rule 3.
 * Two numeric values with compatible units that fall outside the band score 0 without trying the
 * textual rules.</p>
 */
@Component
@RequiredArgsConstructor
public class AttributeScorer {

    static final double EXACT_SCORE = 100.0;
    static final double NUMERIC_SCORE = 80.0;
    static final double CONTAINS_SCORE = 60.0;
    static final double OVERLAP_BASE_SCORE = 50.0;
    static final double OVERLAP_RANGE = 10.0;

    private static final Pattern NUMBER = Pattern.compile("(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^a-z0-9.]+");
    private static final double EPSILON = 1e-9;

    private final AttributeNameResolver nameResolver;
    private final ProposalEngineProperties properties;

    /**
     * Scores every required attribute of the item, in RFP order.
     */
    public List<AttributeScore> scoreAttributes(RequestItem item, Candidate candidate) {
        Map<String, RequiredAttribute> required = item.getRequiredAttributes();
        if (required == null || required.isEmpty()) {
            return List.of();
        }
        Map<String, String> candidateAttributes = candidate.getAttributes() != null ? candidate.getAttributes() : Map.of();
        List<AttributeScore> scores = new ArrayList<>(required.size());
        required.forEach((name, requirement) -> {
            String candidateValue = nameResolver.resolve(name, candidateAttributes);
            scores.add(scoreAttribute(name, requirement, candidateValue));
        });
        return List.copyOf(scores);
    }

    /**
     * Simple average of attribute scores, rounded to 2 decimals and clamped to [0, 100].
     * An item with no required attributes scores 0.
     */
    public double itemScore(List<AttributeScore> attributeScores) {
        if (attributeScores == null || attributeScores.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (AttributeScore score : attributeScores) {
            sum += score.getScore();
        }
        double average = BigDecimal.valueOf(sum / attributeScores.size())
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
        return Math.max(0.0, Math.min(EXACT_SCORE, average));
    }

    AttributeScore scoreAttribute(String name, RequiredAttribute requirement, String candidateValue) {
        String requiredValue = requirement.getValue();
        AttributeScore.AttributeScoreBuilder score = AttributeScore.builder()
                .attributeName(name)
                .requiredValue(requiredValue)
                .candidateValue(candidateValue);

        if (candidateValue == null || requiredValue == null) {
            return score.score(0.0).matchType(AttributeMatchType.MISSING).build();
        }

        String req = canonical(requiredValue);
        String cand = canonical(candidateValue);
        if (req.equals(cand)) {
            return exact(score);
        }

        NumericValue reqNumber = NumericValue.parse(req);
        NumericValue candNumber = NumericValue.parse(cand);
        boolean comparable = reqNumber != null && candNumber != null && reqNumber.unitCompatibleWith(candNumber);
        if (comparable && reqNumber.value().compareTo(candNumber.value()) == 0 && reqNumber.sameUnit(candNumber)) {
            return exact(score);
        }

        ToleranceKind tolerance = requirement.getTolerance() != null ? requirement.getTolerance() : ToleranceKind.NONE;
        if (tolerance == ToleranceKind.EXACT) {
            return noMatch(score);
        }

        if (comparable) {
            if (withinBand(reqNumber.value(), candNumber.value())) {
                return score.score(NUMERIC_SCORE).matchType(AttributeMatchType.NUMERIC_TOLERANCE).build();
            }
            return noMatch(score);
        }

        if (tolerance == ToleranceKind.NUMERIC_PERCENT) {
            return noMatch(score);
        }

        String reqText = lower(requiredValue);
        String candText = lower(candidateValue);
        if (reqText.contains(candText) || candText.contains(reqText)) {
            return score.score(CONTAINS_SCORE).matchType(AttributeMatchType.PARTIAL_TEXT).build();
        }

        Set<String> reqWords = words(reqText);
        Set<String> candWords = words(candText);
        Set<String> common = new HashSet<>(reqWords);
        common.retainAll(candWords);
        if (!common.isEmpty()) {
            double fraction = (double) common.size() / Math.max(reqWords.size(), candWords.size());
            double graded = BigDecimal.valueOf(OVERLAP_BASE_SCORE + OVERLAP_RANGE * fraction)
                    .setScale(2, RoundingMode.HALF_UP)
                    .doubleValue();
            return score.score(Math.min(CONTAINS_SCORE, graded)).matchType(AttributeMatchType.PARTIAL_TEXT).build();
        }
        return noMatch(score);
    }

    private boolean withinBand(BigDecimal required, BigDecimal candidate) {
        double band = Math.abs(required.doubleValue()) * properties.getMatch().getNumericTolerance();
        return Math.abs(required.doubleValue() - candidate.doubleValue()) <= band + EPSILON;
    }

    private static AttributeScore exact(AttributeScore.AttributeScoreBuilder score) {
        return score.score(EXACT_SCORE).matchType(AttributeMatchType.EXACT_MATCH).build();
    }

    private static AttributeScore noMatch(AttributeScore.AttributeScoreBuilder score) {
        return score.score(0.0).matchType(AttributeMatchType.NO_MATCH).build();
    }

    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static String canonical(String value) {
        return WHITESPACE.matcher(lower(value)).replaceAll("");
    }

    private static Set<String> words(String text) {
        Set<String> words = new HashSet<>();
        for (String word : WORD_SEPARATOR.split(text)) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * First decimal number of a whitespace-free value and the text following it as the unit.
     */
    private record NumericValue(BigDecimal value, String unit) {

        static NumericValue parse(String canonicalValue) {
            Matcher matcher = NUMBER.matcher(canonicalValue);
            if (!matcher.find()) {
                return null;
            }
            return new NumericValue(new BigDecimal(matcher.group(1)), canonicalValue.substring(matcher.end()));
        }

        boolean unitCompatibleWith(NumericValue other) {
            return unit.isEmpty() || other.unit.isEmpty() || unit.equals(other.unit);
        }

        boolean sameUnit(NumericValue other) {
            return unit.equals(other.unit);
        }
    }
}
