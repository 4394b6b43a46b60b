package com.acmeCables.proposalEngine.orchestrator.service;

import com.acmeCables.proposalEngine.orchestrator.exception.RfpValidationException;
import com.acmeCables.proposalEngine.orchestrator.model.RunHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight runs by RFP id. At most one run per RFP at a time.
 */
@Slf4j
@Component
public class RunRegistry {

    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();

    /**
     * @throws RfpValidationException if a run for the same RFP is already in progress
     */
    public RunHandle register(String rfpId, String correlationId) {
        RunHandle handle = new RunHandle(rfpId, correlationId);
        RunHandle existing = runs.putIfAbsent(rfpId, handle);
        if (existing != null) {
            log.warn("Rejected concurrent run - correlationId: {}, rfpId: {}, running correlationId: {}",
                    correlationId, rfpId, existing.getCorrelationId());
            throw new RfpValidationException("A run for RFP " + rfpId + " is already in progress");
        }
        return handle;
    }

    public void unregister(RunHandle handle) {
        runs.remove(handle.getRfpId(), handle);
    }

    /**
     * @return true if an in-flight run was found and cancelled
     */
    public boolean cancel(String rfpId) {
        RunHandle handle = runs.get(rfpId);
        if (handle == null) {
            return false;
        }
        boolean cancelled = handle.cancel();
        log.info("Cancel requested - rfpId: {}, correlationId: {}, cancelled: {}",
                rfpId, handle.getCorrelationId(), cancelled);
        return true;
    }

    public boolean isRunning(String rfpId) {
        return runs.containsKey(rfpId);
    }
}
