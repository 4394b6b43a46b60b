package com.acmeCables.proposalEngine.orchestrator.model;

import com.acmeCables.proposalEngine.orchestrator.exception.RunCancelledException;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on an in-flight run, used for cooperative cancellation.
 *
 * <p>Item-matching tasks register their futures here so that {@link #cancel()} can interrupt them.</p>
 */
public class RunHandle {

    @Getter
    private final String rfpId;

    @Getter
    private final String correlationId;

    @Getter
    private final Instant startedAt = Instant.now();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();

    public RunHandle(String rfpId, String correlationId) {
        this.rfpId = rfpId;
        this.correlationId = correlationId;
    }

    public void track(Future<?> task) {
        tasks.add(task);
        // cancel() may have run between submission and tracking
        if (cancelled.get()) {
            task.cancel(true);
        }
    }

    /**
     * @return true if this call cancelled the run, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        tasks.forEach(task -> task.cancel(true));
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new RunCancelledException("Run for RFP " + rfpId + " was cancelled");
        }
    }
}
