package com.eyelevel.contentmoderation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Beans shared by the read-side components: the WebClient used for worker health probes and the
 * clock that every time-dependent calculation goes through.
 */
@Slf4j
@Configuration
public class LivenessConfig {

    /**
     * No base URL; each probe targets the absolute health URL configured for its worker.
     */
    @Bean("healthProbeWebClient")
    public WebClient healthProbeWebClient() {
        log.info("Initializing health probe WebClient");
        return WebClient.builder().build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
