package com.eyelevel.catalogingestion.client;

import com.eyelevel.catalogingestion.client.config.CatalogClientProperties;
import com.eyelevel.catalogingestion.common.apiclient.ApiClient;
import com.eyelevel.catalogingestion.common.apiclient.authentication.Authentication;
import com.eyelevel.catalogingestion.common.apiclient.model.ApiRequest;
import com.eyelevel.catalogingestion.common.apiclient.model.ApiResponse;
import com.eyelevel.catalogingestion.common.apiclient.model.HeaderConfig;
import com.eyelevel.catalogingestion.common.json.JsonParser;
import com.eyelevel.catalogingestion.common.json.JsonSerializer;
import com.eyelevel.catalogingestion.dto.cleanup.CleanupReport;
import com.eyelevel.catalogingestion.dto.importer.ProductionImportResult;
import com.eyelevel.catalogingestion.dto.staged.PageResult;
import com.eyelevel.catalogingestion.dto.staged.StagedDeletionResult;
import com.eyelevel.catalogingestion.dto.staged.StagedFamilyResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedProductPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedProductResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedVariationPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedVariationResponse;
import com.eyelevel.catalogingestion.dto.upload.SessionDeletionResult;
import com.eyelevel.catalogingestion.dto.upload.UploadAcceptedResponse;
import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import com.eyelevel.catalogingestion.exception.TransportException;
import com.eyelevel.catalogingestion.exception.apiclient.ApiException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed client for the catalog ingestion REST API. Every call unwraps the {@code ApiResponse}
 * envelope and returns its {@code response} payload.
 * <p>
 * Error statuses below 500 surface as the matching {@link ApiException} subtype (for example
 * {@code NotFoundException}); connection failures, timeouts and 5xx answers surface as
 * {@link TransportException}.
 */
@Slf4j
@Service("catalogIngestionApiClient")
@ConditionalOnProperty(prefix = "catalog-client", name = "base-url")
public class CatalogIngestionApiClient extends ApiClient {

    private static final String STATUS_PATH = "/uploads/{uploadId}/status";
    private static final String UPLOAD_PATH = "/uploads/{uploadId}";

    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;
    private final Duration requestTimeout;

    public CatalogIngestionApiClient(
            @Qualifier("catalogWebClient") final WebClient webClient,
            @Qualifier("catalogAuthentication") final Authentication authentication,
            @Qualifier("catalogClientHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Qualifier("jacksonJsonSerializer") final JsonSerializer jsonSerializer,
            final CatalogClientProperties properties
    ) {
        super(webClient, authentication, headerConfig);
        this.jsonParser = jsonParser;
        this.jsonSerializer = jsonSerializer;
        this.requestTimeout = properties.getRequestTimeout();
    }

    @Override
    protected Duration timeout() {
        return requestTimeout;
    }

    /**
     * Uploads a catalog and starts parsing it.
     *
     * @param catalog  The PDF to upload; its {@link Resource#getFilename()} is sent as the file name.
     * @param maxPages Optional cap on the pages to parse.
     */
    public UploadAcceptedResponse upload(final Resource catalog, final Integer maxPages) {
        final MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", catalog).filename(catalog.getFilename() == null ? "catalog.pdf" : catalog.getFilename());
        if (maxPages != null) {
            body.part("max_pages", String.valueOf(maxPages));
        }
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.POST)
                                 .path("/uploads")
                                 .body(body.build())
                                 .contentType(MediaType.MULTIPART_FORM_DATA)
                                 .build(), new TypeReference<UploadAcceptedResponse>() {
        });
    }

    public UploadSessionResponse getStatus(final String uploadId) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.GET)
                                 .path(STATUS_PATH)
                                 .pathVariables(Map.of("uploadId", uploadId))
                                 .build(), new TypeReference<UploadSessionResponse>() {
        });
    }

    public List<UploadSessionResponse> listRecent(final int limit) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.GET)
                                 .path("/uploads/recent")
                                 .queryParams(Map.of("limit", limit))
                                 .build(), new TypeReference<List<UploadSessionResponse>>() {
        });
    }

    /**
     * @param uploadId Explicit session, or {@code null} for the workspace's latest completed session.
     */
    public PageResult<StagedFamilyResponse> listFamilies(final String uploadId, final long offset, final int limit) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.GET)
                                 .path("/staged/families")
                                 .queryParams(pagingParams(uploadId, null, offset, limit))
                                 .build(), new TypeReference<PageResult<StagedFamilyResponse>>() {
        });
    }

    /**
     * @param uploadId Explicit session, or {@code null} for the workspace's latest completed session.
     * @param familyId Optional family filter.
     */
    public PageResult<StagedProductResponse> listProducts(final String uploadId, final Long familyId,
                                                          final long offset, final int limit) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.GET)
                                 .path("/staged/products")
                                 .queryParams(pagingParams(uploadId, familyId, offset, limit))
                                 .build(), new TypeReference<PageResult<StagedProductResponse>>() {
        });
    }

    public StagedProductResponse getProduct(final Long productId) {
        return execute(productRequest(HttpMethod.GET, productId, null), new TypeReference<StagedProductResponse>() {
        });
    }

    public StagedProductResponse updateProduct(final Long productId, final StagedProductPatch patch) {
        return execute(productRequest(HttpMethod.PATCH, productId, jsonSerializer.serialize(patch)),
                       new TypeReference<StagedProductResponse>() {
                       });
    }

    public StagedDeletionResult deleteProduct(final Long productId) {
        return execute(productRequest(HttpMethod.DELETE, productId, null), new TypeReference<StagedDeletionResult>() {
        });
    }

    public List<StagedVariationResponse> listVariations(final Long productId) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.GET)
                                 .path("/staged/products/{productId}/variations")
                                 .pathVariables(Map.of("productId", productId))
                                 .build(), new TypeReference<List<StagedVariationResponse>>() {
        });
    }

    public StagedVariationResponse updateVariation(final Long variationId, final StagedVariationPatch patch) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.PATCH)
                                 .path("/staged/variations/{variationId}")
                                 .pathVariables(Map.of("variationId", variationId))
                                 .body(jsonSerializer.serialize(patch))
                                 .contentType(MediaType.APPLICATION_JSON)
                                 .build(), new TypeReference<StagedVariationResponse>() {
        });
    }

    public ProductionImportResult importSession(final String uploadId) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.POST)
                                 .path(UPLOAD_PATH + "/import")
                                 .pathVariables(Map.of("uploadId", uploadId))
                                 .build(), new TypeReference<ProductionImportResult>() {
        });
    }

    public SessionDeletionResult deleteSession(final String uploadId) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.DELETE)
                                 .path(UPLOAD_PATH)
                                 .pathVariables(Map.of("uploadId", uploadId))
                                 .build(), new TypeReference<SessionDeletionResult>() {
        });
    }

    public CleanupReport cleanupExpired(final boolean includeOrphaned) {
        return execute(ApiRequest.builder()
                                 .method(HttpMethod.POST)
                                 .path("/maintenance/cleanup-expired")
                                 .queryParams(Map.of("include_orphaned", includeOrphaned))
                                 .build(), new TypeReference<CleanupReport>() {
        });
    }

    private <T> T execute(final ApiRequest apiRequest, final TypeReference<T> payloadType) {
        final ApiResponse apiResponse;
        try {
            apiResponse = call(apiRequest);
        } catch (final ApiException e) {
            if (e.getStatusCode() >= 500) {
                log.warn("Transport failure on {} {}: {}", apiRequest.getMethod(), apiRequest.getPath(),
                         e.getMessage());
                throw new TransportException(String.format("%s %s failed: %s", apiRequest.getMethod(),
                                                           apiRequest.getPath(), e.getMessage()), e);
            }
            throw e;
        }
        final JsonNode envelope = jsonParser.parseTree(apiResponse.getData());
        return jsonParser.convert(envelope.path("response"), payloadType);
    }

    private static ApiRequest productRequest(final HttpMethod method, final Long productId, final String body) {
        return ApiRequest.builder()
                         .method(method)
                         .path("/staged/products/{productId}")
                         .pathVariables(Map.of("productId", productId))
                         .body(body)
                         .contentType(body == null ? null : MediaType.APPLICATION_JSON)
                         .build();
    }

    private static Map<String, Object> pagingParams(final String uploadId, final Long familyId, final long offset,
                                                    final int limit) {
        final Map<String, Object> params = new HashMap<>();
        params.put("upload_id", uploadId);
        params.put("family_id", familyId);
        params.put("offset", offset);
        params.put("limit", limit);
        return params;
    }
}
