package com.acmeCables.proposalEngine.rfp.model;

/**
 * How strictly a required attribute value must be met by a candidate.
 */
public enum ToleranceKind {

    /**
     * Only an exact value match scores.
     */
    EXACT,

    /**
     * Exact match, or a numeric value within the configured percentage band.
     */
    NUMERIC_PERCENT,

    /**
     * Full scoring ladder: exact, numeric band, then partial textual overlap.
     */
    NONE
}
