package com.eyelevel.catalogingestion.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * AWS client beans for the S3-backed file store. Only active when
 * {@code app.ingestion.storage.type=s3}; the local file store needs none of this.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "app.ingestion.storage", name = "type", havingValue = "s3")
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.s3.retry-count:4}")
    private int s3RetryCount;

    /**
     * Static keys for the "local" profile, the default provider chain (instance role) elsewhere.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("Non-local profile active. Using DefaultCredentialsProvider.");
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(s3RetryCount).build();
        return ClientOverrideConfiguration.builder().retryPolicy(adaptiveRetryPolicy).build();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider,
                             ClientOverrideConfiguration clientOverrideConfig) {
        log.info("Configuring AWS S3Client for region: {}", awsRegion);
        return S3Client.builder().credentialsProvider(credentialsProvider).region(Region.of(awsRegion))
                       .overrideConfiguration(clientOverrideConfig).build();
    }
}
