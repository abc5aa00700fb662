package com.eyelevel.catalogingestion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds application properties under the "app.ingestion" prefix: upload limits, retention, the
 * default parser heuristics, import bounds and the file store selection.
 */
@Data
@ConfigurationProperties(prefix = "app.ingestion")
public class CatalogIngestionConfig {

    /**
     * Largest accepted upload in bytes.
     */
    private long maxFileSize = 1024L * 1024L * 1024L;

    /**
     * How long staged data survives after parsing finished.
     */
    private long retentionHours = 48;

    private Paging paging = new Paging();
    private Parse parse = new Parse();
    private Import importer = new Import();
    private Storage storage = new Storage();

    @Data
    public static class RetryConfig {
        private int attempts = 2;
        private long delayMs = 500;
    }

    @Data
    public static class Paging {
        private int defaultLimit = 50;
        private int maxLimit = 200;
    }

    @Data
    public static class Parse {
        /**
         * Products scored below this confidence are flagged for review.
         */
        private int reviewThreshold = 80;
        private int familyConfidence = 60;
        private int variationConfidence = 75;
    }

    @Data
    public static class Import {
        private int timeoutSeconds = 300;
    }

    @Data
    public static class Storage {
        /**
         * {@code local} or {@code s3}.
         */
        private String type = "local";
        private String localRoot = "./data/catalog-ingestion";
        private RetryConfig retry = new RetryConfig();
    }
}
