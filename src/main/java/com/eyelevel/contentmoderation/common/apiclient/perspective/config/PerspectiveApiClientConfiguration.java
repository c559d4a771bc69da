package com.eyelevel.contentmoderation.common.apiclient.perspective.config;

import com.eyelevel.contentmoderation.common.apiclient.authentication.Authentication;
import com.eyelevel.contentmoderation.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.contentmoderation.config.ModerationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the beans for the Perspective comment analyzer client: the {@link WebClient} and the
 * API-key {@link Authentication}.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class PerspectiveApiClientConfiguration {

    private final ModerationProperties properties;

    @Bean("perspectiveWebClient")
    public WebClient perspectiveWebClient() {
        String baseUrl = properties.getScoring().getBaseUrl();
        log.info("Initializing Perspective WebClient with base URL: {}", baseUrl);
        return WebClient.builder()
                .baseUrl(baseUrl)
                .build();
    }

    @Bean("perspectiveAuthentication")
    public Authentication perspectiveAuthentication() {
        ModerationProperties.Scoring scoring = properties.getScoring();
        log.info("Initializing Perspective authentication with header name: '{}'", scoring.getApiKeyHeader());
        if (scoring.getApiKey() == null || scoring.getApiKey().isBlank()) {
            log.warn("Perspective API key is not configured. Every classification will fall back to human review.");
        }
        return new APIKeyAuthentication(scoring.getApiKeyHeader(), scoring.getApiKey());
    }
}
