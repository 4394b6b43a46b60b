package com.acmeCables.proposalEngine.config;

import com.acmeCables.proposalEngine.resilience.RetryPolicy;
import com.acmeCables.proposalEngine.util.MdcAwareExecutorService;
import com.acmeCables.proposalEngine.util.MdcTaskDecorator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executors and the collaborator retry policy.
 *
 * <p>Item matching runs on a fixed pool sized by {@code proposal.match.max-concurrent-items}.
 * Collaborator calls run on their own cached pool so that the per-call time limit can abandon
 * a stuck call without blocking a matching worker slot forever.</p>
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public ThreadPoolTaskExecutor matchingExecutor(ProposalEngineProperties properties) {
        int threads = Math.max(1, properties.getMatch().getMaxConcurrentItems());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("match-item-");
        executor.setDaemon(true);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collaboratorCallExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("collaborator-call-");
        threadFactory.setDaemon(true);
        return new MdcAwareExecutorService(Executors.newCachedThreadPool(threadFactory));
    }

    @Bean
    public RetryPolicy collaboratorRetryPolicy(ProposalEngineProperties properties,
                                               @Qualifier("collaboratorCallExecutor") ExecutorService collaboratorCallExecutor) {
        ProposalEngineProperties.Retry retry = properties.getRetry();
        return RetryPolicy.exponential(
                "collaborator",
                retry.getMaxAttempts(),
                retry.getInitialBackoff(),
                retry.getBackoffMultiplier(),
                retry.getCallTimeout(),
                collaboratorCallExecutor);
    }
}
