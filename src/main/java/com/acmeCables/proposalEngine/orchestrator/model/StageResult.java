package com.acmeCables.proposalEngine.orchestrator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Tagged result handed from one pipeline stage to the next.
 *
 * <p>A degraded result still carries a usable value (possibly null, as for a missing narrative);
 * a failed one never does.</p>
 *
 * @param <T> stage payload
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StageResult<T> {

    StageOutcome outcome;

    T value;

    List<String> notes;

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(StageOutcome.SUCCESS, value, List.of());
    }

    public static <T> StageResult<T> degraded(T value, List<String> notes) {
        return new StageResult<>(StageOutcome.DEGRADED, value, List.copyOf(notes));
    }

    public static <T> StageResult<T> failed(String reason) {
        return new StageResult<>(StageOutcome.FAILED, null, List.of(reason));
    }

    public boolean isSuccess() {
        return outcome == StageOutcome.SUCCESS;
    }

    public boolean isDegraded() {
        return outcome == StageOutcome.DEGRADED;
    }

    public boolean isFailed() {
        return outcome == StageOutcome.FAILED;
    }
}
