package com.eyelevel.contentmoderation.common.apiclient;

import com.eyelevel.contentmoderation.common.apiclient.authentication.Authentication;
import com.eyelevel.contentmoderation.common.apiclient.model.ApiRequest;
import com.eyelevel.contentmoderation.common.apiclient.model.ApiResponse;
import com.eyelevel.contentmoderation.exception.apiclient.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for blocking calls to external HTTP APIs over a {@link WebClient}.
 * <p>
 * It applies authentication, enforces a per-request timeout and maps every failure (transport error,
 * timeout or non-2xx status) onto the {@link ApiException} hierarchy, so subclasses only deal with
 * building requests and parsing successful bodies.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;

    /**
     * @return The upper bound for a single call, including reading the body. Subclasses override it
     * with their configured value.
     */
    protected Duration requestTimeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Executes an API call and blocks until the response body has been read.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The successful API response.
     *
     * @throws ApiException If the call fails for any reason.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                     .timeout(requestTimeout())
                                                     .onErrorMap(this::mapException)
                                                     .block();
            log.debug("Received API response with status {}", apiResponse == null ? null : apiResponse.getStatusCode());
            return apiResponse;
        } catch (ApiException e) {
            log.warn("API call to {} failed: {}", apiRequest.getPath(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected exception during API call to {}", apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    /**
     * Maps transport and protocol errors onto the {@link ApiException} hierarchy.
     */
    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException
                || error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out after " + requestTimeout().toMillis() + " ms");
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build();
        });
    }

    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());
        apiRequest.getHeaders().forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            Instant timestamp = Instant.now();
            MediaType contentType = response.headers().contentType().orElse(null);
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder()
                                                   .data(data)
                                                   .contentType(contentType)
                                                   .statusCode(statusCode)
                                                   .timestamp(timestamp)
                                                   .build());
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    private ApiException createException(String body, int statusCode) {
        String message = body == null || body.isBlank() ? "HTTP " + statusCode : body;
        return switch (statusCode) {
            case 400 -> new BadRequestException(message);
            case 401, 403 -> new UnauthorizedException(message, statusCode);
            case 429 -> new TooManyRequestsException(message);
            case 503 -> new ServiceUnavailableException(message);
            case 504 -> new GatewayTimeoutException(message);
            default -> new ApiException(message, statusCode);
        };
    }
}
