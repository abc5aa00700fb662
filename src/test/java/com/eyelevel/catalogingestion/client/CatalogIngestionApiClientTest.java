package com.eyelevel.catalogingestion.client;

import com.eyelevel.catalogingestion.client.config.CatalogClientHeaderConfig;
import com.eyelevel.catalogingestion.client.config.CatalogClientProperties;
import com.eyelevel.catalogingestion.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.catalogingestion.common.json.jackson.JacksonJsonParser;
import com.eyelevel.catalogingestion.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.catalogingestion.dto.staged.PageResult;
import com.eyelevel.catalogingestion.dto.staged.StagedProductPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedProductResponse;
import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import com.eyelevel.catalogingestion.exception.TransportException;
import com.eyelevel.catalogingestion.exception.apiclient.ConflictException;
import com.eyelevel.catalogingestion.exception.apiclient.NotFoundException;
import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogIngestionApiClientTest {

    private static final String UPLOAD_ID = "7c9e6679-7425-40de-944b-e07fc1f90ae7";

    private final ObjectMapper objectMapper = JsonMapper.builder()
                                                        .findAndAddModules()
                                                        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                                                        .build();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @Test
    void unwrapsStatusEnvelopeAndSendsWorkspaceAndKeyHeaders() {
        CatalogIngestionApiClient client = client(HttpStatus.OK, """
                {"display_message":"Upload is parsing.","status_code":200,
                 "response":{"upload_id":"%s","filename":"catalog.pdf","status":"parsing",
                             "total_pages":12,"pages_processed":5,"current_step":"Processing page 5 of 12"}}
                """.formatted(UPLOAD_ID));

        UploadSessionResponse status = client.getStatus(UPLOAD_ID);

        assertThat(status.uploadId()).isEqualTo(UPLOAD_ID);
        assertThat(status.status()).isEqualTo(UploadStatus.PARSING);
        assertThat(status.pagesProcessed()).isEqualTo(5);
        assertThat(status.totalPages()).isEqualTo(12);

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().getPath()).isEqualTo("/uploads/" + UPLOAD_ID + "/status");
        assertThat(request.headers().getFirst(CatalogClientHeaderConfig.WORKSPACE_HEADER)).isEqualTo("showroom");
        assertThat(request.headers().getFirst("X-API-Key")).isEqualTo("secret");
    }

    @Test
    void latestSessionListingOmitsUploadIdParameter() {
        CatalogIngestionApiClient client = client(HttpStatus.OK, """
                {"response":{"items":[{"id":11,"upload_id":"%s","name":"Harbor Sofa","model_number":"4411",
                                       "base_price":149900,"import_status":"pending","version":0}],
                             "total":201,"offset":200,"limit":200}}
                """.formatted(UPLOAD_ID));

        PageResult<StagedProductResponse> page = client.listProducts(null, null, 200, 200);

        assertThat(page.total()).isEqualTo(201);
        assertThat(page.items()).singleElement().satisfies(product -> {
            assertThat(product.modelNumber()).isEqualTo("4411");
            assertThat(product.basePrice()).isEqualTo(149900L);
            assertThat(product.importStatus()).isEqualTo(ImportStatus.PENDING);
        });

        String query = requests.get(0).url().getQuery();
        assertThat(query).contains("offset=200").contains("limit=200").doesNotContain("upload_id")
                         .doesNotContain("family_id");
    }

    @Test
    void patchIsSentAsJson() {
        CatalogIngestionApiClient client = client(HttpStatus.OK, """
                {"response":{"id":11,"upload_id":"%s","name":"Harbor Sofa","version":1}}
                """.formatted(UPLOAD_ID));

        StagedProductResponse updated = client.updateProduct(11L, StagedProductPatch.builder()
                                                                                  .name("Harbor Sofa")
                                                                                  .version(0L)
                                                                                  .build());

        assertThat(updated.version()).isEqualTo(1L);
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.PATCH);
        assertThat(request.url().getPath()).isEqualTo("/staged/products/11");
        assertThat(request.headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
    }

    @Test
    void clientErrorsKeepTheirStatusType() {
        assertThatThrownBy(() -> client(HttpStatus.NOT_FOUND, "{\"display_message\":\"Upload session not found\"}")
                .getStatus(UPLOAD_ID))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> client(HttpStatus.CONFLICT, "{\"display_message\":\"already imported\"}")
                .importSession(UPLOAD_ID))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("already imported");
    }

    @Test
    void serverErrorsAndConnectionFailuresBecomeTransportErrors() {
        assertThatThrownBy(() -> client(HttpStatus.SERVICE_UNAVAILABLE, "").getStatus(UPLOAD_ID))
                .isInstanceOf(TransportException.class);

        CatalogIngestionApiClient unreachable = client(request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), request.method(), request.url(), new HttpHeaders())));
        assertThatThrownBy(() -> unreachable.getStatus(UPLOAD_ID))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("Connection refused");
    }

    private CatalogIngestionApiClient client(final HttpStatus status, final String body) {
        return client(request -> Mono.just(ClientResponse.create(status)
                                                         .header(HttpHeaders.CONTENT_TYPE,
                                                                 MediaType.APPLICATION_JSON_VALUE)
                                                         .body(body)
                                                         .build()));
    }

    private CatalogIngestionApiClient client(final ExchangeFunction exchange) {
        CatalogClientProperties properties = new CatalogClientProperties();
        properties.setBaseUrl("http://ingestion.test");
        properties.setApiKey("secret");
        properties.setWorkspaceId("showroom");

        WebClient webClient = WebClient.builder()
                                       .baseUrl(properties.getBaseUrl())
                                       .exchangeFunction(request -> {
                                           requests.add(request);
                                           return exchange.exchange(request);
                                       })
                                       .build();
        return new CatalogIngestionApiClient(webClient,
                                             new APIKeyAuthentication(properties.getApiKeyHeader(),
                                                                      properties.getApiKey()),
                                             new CatalogClientHeaderConfig(properties.getWorkspaceId()),
                                             new JacksonJsonParser(objectMapper),
                                             new JacksonJsonSerializer(objectMapper),
                                             properties);
    }
}
