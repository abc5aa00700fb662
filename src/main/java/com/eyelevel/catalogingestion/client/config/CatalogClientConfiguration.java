package com.eyelevel.catalogingestion.client.config;

import com.eyelevel.catalogingestion.client.StagedPageAggregator;
import com.eyelevel.catalogingestion.client.UploadStatusPoller;
import com.eyelevel.catalogingestion.common.apiclient.authentication.Authentication;
import com.eyelevel.catalogingestion.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.catalogingestion.common.apiclient.model.HeaderConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the review client against a running ingestion service: the {@link WebClient}, its
 * {@link Authentication} and headers, the polling scheduler and the page fetch pool.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "catalog-client", name = "base-url")
public class CatalogClientConfiguration {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    private final CatalogClientProperties properties;

    @Bean("catalogWebClient")
    public WebClient catalogWebClient() {
        log.info("Initializing catalog ingestion WebClient with base URL: {}", properties.getBaseUrl());
        return WebClient.builder()
                        .baseUrl(properties.getBaseUrl())
                        .exchangeStrategies(ExchangeStrategies.builder()
                                                              .codecs(codecs -> codecs.defaultCodecs()
                                                                                      .maxInMemorySize(MAX_IN_MEMORY_SIZE))
                                                              .build())
                        .build();
    }

    @Bean("catalogAuthentication")
    public Authentication catalogAuthentication() {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            log.warn("Catalog ingestion API key is not configured. Requests are sent without '{}'.",
                     properties.getApiKeyHeader());
        }
        return new APIKeyAuthentication(properties.getApiKeyHeader(), properties.getApiKey());
    }

    @Bean("catalogClientHeader")
    public HeaderConfig catalogClientHeader() {
        return new CatalogClientHeaderConfig(properties.getWorkspaceId());
    }

    @Bean(name = "catalogPageFetchExecutor")
    public ThreadPoolTaskExecutor catalogPageFetchExecutor() {
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFetchParallelism());
        executor.setMaxPoolSize(properties.getFetchParallelism());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("catalog-page-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public StagedPageAggregator stagedPageAggregator() {
        return new StagedPageAggregator(catalogPageFetchExecutor(), properties.getPageSize(),
                                        properties.getFetchParallelism());
    }

    /**
     * The polling scheduler is owned by the poller rather than exposed as a bean, so it never competes
     * with the application's own {@code @Scheduled} scheduler.
     */
    @Bean(destroyMethod = "shutdown")
    public UploadStatusPoller uploadStatusPoller() {
        final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("catalog-poll-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return new UploadStatusPoller(scheduler, properties.getPollInterval());
    }
}
