package com.acmeCables.proposalEngine.resilience;

import com.acmeCables.proposalEngine.orchestrator.exception.RunCancelledException;
import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Single retry policy applied to every call into an external collaborator.
 *
 * <p>Parameterized by max attempts, backoff curve and a retryable-error predicate. Each attempt is
 * bounded by a per-call timeout; a timed-out attempt counts as a retryable failure. When attempts
 * are exhausted the caller sees an {@link UpstreamUnavailableException}; non-retryable errors
 * propagate unchanged on the first attempt.</p>
 */
@Slf4j
public class RetryPolicy {

    /**
     * Transport failures and per-call timeouts.
     */
    public static final Predicate<Throwable> UPSTREAM_TRANSIENT =
            e -> e instanceof UpstreamUnavailableException || e instanceof TimeoutException;

    private final String name;
    private final int maxAttempts;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService callExecutor;

    public RetryPolicy(String name,
                       int maxAttempts,
                       IntervalFunction backoff,
                       Predicate<Throwable> retryable,
                       Duration callTimeout,
                       ExecutorService callExecutor) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff)
                .retryOnException(retryable)
                .build());
        this.timeLimiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(callTimeout)
                .cancelRunningFuture(true)
                .build());
        this.callExecutor = callExecutor;
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying {} call - policy: {}, attempt: {}, wait: {}ms, error: {}",
                        event.getName(), name, event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    public static RetryPolicy exponential(String name,
                                          int maxAttempts,
                                          Duration initialBackoff,
                                          double multiplier,
                                          Duration callTimeout,
                                          ExecutorService callExecutor) {
        return new RetryPolicy(name, maxAttempts,
                IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier),
                UPSTREAM_TRANSIENT, callTimeout, callExecutor);
    }

    /**
     * Runs the call with per-attempt timeout and bounded retries.
     *
     * @param operation collaborator operation name for logs and error messages
     * @param call the collaborator call
     * @return the call result
     * @throws UpstreamUnavailableException when every attempt failed or timed out
     * @throws RunCancelledException when the calling thread was interrupted
     */
    public <T> T execute(String operation, Supplier<T> call) {
        AtomicReference<Future<T>> inFlight = new AtomicReference<>();
        Callable<T> attempt = () -> timeLimiter.executeFutureSupplier(() -> {
            Future<T> future = callExecutor.submit(call::get);
            inFlight.set(future);
            return future;
        });
        try {
            return Retry.decorateCallable(retry, attempt).call();
        } catch (InterruptedException e) {
            // the time limiter only cancels on timeout
            Future<T> future = inFlight.get();
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted during " + operation);
        } catch (UpstreamUnavailableException e) {
            throwIfInterrupted(operation);
            throw new UpstreamUnavailableException(
                    operation + " unavailable after " + maxAttempts + " attempt(s): " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throwIfInterrupted(operation);
            throw new UpstreamUnavailableException(
                    operation + " timed out after " + maxAttempts + " attempt(s)", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(operation + " failed: " + e.getMessage(), e);
        }
    }

    public String getName() {
        return name;
    }

    private static void throwIfInterrupted(String operation) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RunCancelledException("Interrupted during " + operation);
        }
    }
}
