package com.qubicescrow.verification.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Signal Analysis Executor Configuration
 *
 * Dedicated pool for running the four signal analyzers of a verification in parallel.
 * Analysis is CPU-bound and never blocks on I/O, so the pool stays small.
 *
 * Rejection: caller runs, a saturated pool slows verification down instead of failing it.
 */
@Slf4j
@Configuration
public class SignalAnalysisExecutorConfiguration {

    @Bean(name = "signalAnalysisExecutor")
    public ThreadPoolTaskExecutor signalAnalysisExecutor(FraudDetectionProperties properties) {
        FraudDetectionProperties.Executor settings = properties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("signal-analysis-");
        executor.setRejectedExecutionHandler(new CallerRunsWithLogging());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        log.info("Initialized signal analysis executor - Core: {}, Max: {}, Queue: {}",
                settings.getCorePoolSize(), settings.getMaxPoolSize(), settings.getQueueCapacity());

        return executor;
    }

    private static class CallerRunsWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (!executor.isShutdown()) {
                log.warn("PERFORMANCE: Signal analysis pool saturated, running in caller thread - "
                                + "Pool: {}, Active: {}, Queue: {}",
                        executor.getPoolSize(),
                        executor.getActiveCount(),
                        executor.getQueue().size());
                r.run();
            } else {
                log.error("CRITICAL: Signal analysis executor shut down, task rejected: {}", r);
                throw new RejectedExecutionException("Signal analysis executor is shut down");
            }
        }
    }
}
