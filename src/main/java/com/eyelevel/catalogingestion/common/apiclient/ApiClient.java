package com.eyelevel.catalogingestion.common.apiclient;

import com.eyelevel.catalogingestion.common.apiclient.authentication.Authentication;
import com.eyelevel.catalogingestion.common.apiclient.model.ApiRequest;
import com.eyelevel.catalogingestion.common.apiclient.model.ApiResponse;
import com.eyelevel.catalogingestion.common.apiclient.model.HeaderConfig;
import com.eyelevel.catalogingestion.exception.apiclient.ApiException;
import com.eyelevel.catalogingestion.exception.apiclient.BadRequestException;
import com.eyelevel.catalogingestion.exception.apiclient.ConflictException;
import com.eyelevel.catalogingestion.exception.apiclient.ForbiddenException;
import com.eyelevel.catalogingestion.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.catalogingestion.exception.apiclient.InternalServerException;
import com.eyelevel.catalogingestion.exception.apiclient.NotFoundException;
import com.eyelevel.catalogingestion.exception.apiclient.ServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for API clients, providing common functionality for making API calls,
 * handling responses, and mapping exceptions. Subclasses configure the {@link WebClient},
 * {@link Authentication} and {@link HeaderConfig}.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;

    /**
     * Executes an API call based on the provided {@link ApiRequest}.
     *
     * @param apiRequest The API request to execute.
     *
     * @return The API response of a 2xx answer.
     *
     * @throws ApiException for error statuses and for transport failures, the latter mapped to
     *                      {@link ServiceUnavailableException} or {@link GatewayTimeoutException}.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());
        log.debug("ApiRequest details: {}", apiRequest);

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse).timeout(timeout())
                                                     .onErrorMap(this::mapException).block();
            log.debug("Received apiResponse with status: {}",
                      apiResponse == null ? null : apiResponse.getStatusCode());
            return apiResponse;

        } catch (ApiException e) {
            log.warn("API call {} {} failed with status {}: {}", apiRequest.getMethod(), apiRequest.getPath(),
                     e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call", e);
            throw mapException(e);
        }
    }

    /**
     * Per-request timeout; subclasses may override.
     */
    protected Duration timeout() {
        return DEFAULT_TIMEOUT;
    }

    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        log.warn("Mapping exception: {}", error.getMessage());
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());

        } else if (error instanceof WebClientRequestException || error instanceof ConnectException ||
                   error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to ingestion service: " + error.getMessage(),
                                                   error);

        } else if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage(), error);

        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(), error);

        } else {
            return new ApiException("Internal API client error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(), error);
        }
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());

            Optional.ofNullable(apiRequest.getQueryParams()).ifPresent(params -> params.forEach((name, value) -> {
                if (value != null) {
                    uriBuilder.queryParam(name, value);
                }
            }));

            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }

        Optional.ofNullable(apiRequest.getHeaders()).ifPresent(headers -> headers.forEach(requestBodySpec::header));
        requestBodySpec.accept(Optional.ofNullable(apiRequest.getAcceptMediaType()).orElse(MediaType.APPLICATION_JSON));
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }

        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        int statusCode = response.statusCode().value();

        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]).map(
                    data -> ApiResponse.builder().data(data).acceptType(headers.getContentType()).headers(headers)
                                       .statusCode(statusCode).timestamp(timestamp).build());
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class).defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    /**
     * Creates an appropriate {@link ApiException} based on the provided HTTP status code.
     */
    private ApiException createException(String body, int statusCode) {
        return switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 403 -> new ForbiddenException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            case 500 -> new InternalServerException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
    }
}
