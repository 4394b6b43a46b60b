package com.acmeCables.proposalEngine.util;

import org.springframework.core.task.TaskDecorator;

import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Executor service that copies the submitting thread's MDC (correlation id, rfp id)
 * into the worker thread for the duration of each task.
 */
public class MdcAwareExecutorService extends AbstractExecutorService {

    private final ExecutorService delegate;
    private final TaskDecorator mdcDecorator = new MdcTaskDecorator();

    public MdcAwareExecutorService(ExecutorService delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(mdcDecorator.decorate(command));
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        return delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
    }
}
