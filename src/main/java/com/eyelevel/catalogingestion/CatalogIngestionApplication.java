package com.eyelevel.catalogingestion;

import com.eyelevel.catalogingestion.client.config.CatalogClientProperties;
import com.eyelevel.catalogingestion.config.CatalogIngestionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the catalog ingestion service.
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds "app.ingestion" to {@link CatalogIngestionConfig} and
 *     "catalog-client" to {@link CatalogClientProperties}.</li>
 *     <li>{@link EnableScheduling}: runs the expiry cleanup and stale-parse sweeps.</li>
 *     <li>{@link EnableRetry}: retries transient file store failures.</li>
 * </ul>
 * Repositories and entities are picked up from this package by Spring Boot's JPA auto-configuration.
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = {CatalogIngestionConfig.class, CatalogClientProperties.class})
@EnableRetry
public class CatalogIngestionApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting CatalogIngestionApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(CatalogIngestionApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "CatalogIngestion"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("  - Storage:    {}", env.getProperty("app.ingestion.storage.type", "local"));
        log.info("------------------------------------------------------------------");
    }
}
