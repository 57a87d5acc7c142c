package com.purchasingpower.codegraph.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for per-project source analysis.
 *
 * <p>Projects are analyzed concurrently; their results are merged afterwards by the calling thread.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor(AppProperties properties) {
        int parallelism = properties.getAnalysis().getParallelism();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        // one task per manifest
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("project-analysis-");
        // a full queue runs the project on the submitting thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("✅ Analysis executor configured: parallelism={}", parallelism);
        return executor;
    }
}
