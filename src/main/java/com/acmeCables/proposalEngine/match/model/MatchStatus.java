package com.acmeCables.proposalEngine.match.model;

public enum MatchStatus {
    MATCHED,
    UNMATCHED
}
