package com.acmeCables.proposalEngine.util;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Copies the submitting thread's MDC (correlation id, rfp id) into the worker thread for the
 * duration of the task, then clears it.
 */
public class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                runnable.run();
            } finally {
                MDC.clear();
            }
        };
    }
}
