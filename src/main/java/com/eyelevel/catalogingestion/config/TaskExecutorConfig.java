package com.eyelevel.catalogingestion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool that runs parse jobs once the transaction that created their session has committed.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Pool sizing comes from {@code app.ingestion.worker.*}. Parsing is I/O and CPU heavy, so the
     * queue absorbs bursts instead of growing the pool.
     *
     * @return the executor parse jobs are submitted to.
     */
    @Bean("applicationTaskExecutor")
    public AsyncTaskExecutor applicationTaskExecutor(
            @Value("${app.ingestion.worker.core-pool-size:2}") int corePoolSize,
            @Value("${app.ingestion.worker.max-pool-size:4}") int maxPoolSize,
            @Value("${app.ingestion.worker.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("catalog-parse-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
