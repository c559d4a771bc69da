package com.eyelevel.contentmoderation.config;

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
        String appName = buildProperties.map(BuildProperties::getName).orElse("Content Moderation API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Submits user content for automated moderation and reports on the results.
                                Submissions are persisted as jobs and handed to a pool of workers over a
                                durable queue. Each worker classifies the content as approved, rejected or
                                needing human review.

                                Key features include:
                                * **Asynchronous Moderation:** A submission returns immediately as `pending`.
                                * **Job Queries:** Filter jobs by status and period, or fetch one by id.
                                * **Reports:** Per-worker processing times, daily activity and category breakdowns.
                                * **System Status:** Queue connectivity and the liveness of every worker.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
