package com.kotsin.structure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * AsyncConfig - Worker pool for per-symbol processing.
 *
 * Fixed size so batch concurrency is bounded by {@code execution.worker-pool-size}.
 * The queue is unbounded: a batch submits its whole scope up front and the
 * scaffold waits on each symbol in order.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class AsyncConfig {

    private final ExecutionConfig executionConfig;

    @Bean(name = "symbolExecutor")
    public ThreadPoolTaskExecutor symbolExecutor() {
        int poolSize = Math.max(1, executionConfig.getWorkerPoolSize());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("symbol-worker-");

        // Allow core threads to timeout when idle
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);

        // Wait for in-flight symbols on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) Math.max(30, executionConfig.getSymbolTimeoutSeconds()));

        executor.initialize();

        log.info("[SYMBOL-EXECUTOR] Initialized: poolSize={}, symbolTimeoutSeconds={}",
                poolSize, executionConfig.getSymbolTimeoutSeconds());
        return executor;
    }
}
