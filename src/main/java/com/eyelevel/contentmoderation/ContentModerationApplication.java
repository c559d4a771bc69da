package com.eyelevel.contentmoderation;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Content Moderation Spring Boot application.
 * <p>
 * Every process runs the ingestion, query and reporting APIs. Whether it also consumes work from the
 * queue is controlled by {@code app.moderation.worker.enabled}.
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.moderation" properties to
 *     {@link ModerationProperties}.</li>
 *     <li>{@link EnableScheduling}: Runs the queue reconnect loop, pending job replay and store backups.</li>
 *     <li>{@link EnableRetry}: Retries transient job store failures.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.contentmoderation.repository")
@EnableConfigurationProperties(value = ModerationProperties.class)
@EnableRetry
public class ContentModerationApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting ContentModerationApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(ContentModerationApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "ContentModeration"));
        log.info("  - Worker id:  {} (consuming: {})", env.getProperty("app.moderation.worker.id"),
                 env.getProperty("app.moderation.worker.enabled", "true"));
        log.info("  - Queue:      {}", env.getProperty("app.moderation.queue.name"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
