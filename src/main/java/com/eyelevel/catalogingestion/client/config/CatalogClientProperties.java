package com.eyelevel.catalogingestion.client.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds the "catalog-client" properties used by the review client. The client beans are only created
 * when {@code catalog-client.base-url} is set.
 */
@Data
@ConfigurationProperties(prefix = "catalog-client")
public class CatalogClientProperties {

    private String baseUrl;

    private String apiKeyHeader = "X-API-Key";

    private String apiKey;

    /**
     * Sent as {@code X-Workspace-Id}; scopes latest-session discovery on the server.
     */
    private String workspaceId = "default";

    private Duration pollInterval = Duration.ofSeconds(2);

    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Page size of staged-data listings. The server caps it at 200.
     */
    private int pageSize = 200;

    private int fetchParallelism = 4;
}
