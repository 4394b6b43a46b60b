package com.acmeCables.proposalEngine.match.model;

/**
 * Which scoring rule produced an attribute score.
 */
public enum AttributeMatchType {
    EXACT_MATCH,
    NUMERIC_TOLERANCE,
    PARTIAL_TEXT,
    NO_MATCH,
    MISSING
}
