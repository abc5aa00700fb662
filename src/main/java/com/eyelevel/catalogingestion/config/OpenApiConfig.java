package com.eyelevel.catalogingestion.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Catalog Ingestion API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Ingests manufacturer PDF catalogs and stages the extracted families, products,
                                variations and images for review before they are committed to the production catalog.

                                Workflow:
                                * **Upload:** a PDF is accepted, stored and parsed in the background.
                                * **Poll:** the upload status endpoint reports page progress until the parse completes or fails.
                                * **Review:** staged rows are listed page by page, edited, or skipped.
                                * **Import:** a completed upload is copied into the production catalog in one transaction.

                                **Note:** staged data expires after the retention window and is reclaimed by the cleanup job.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
