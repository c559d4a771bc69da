package com.eyelevel.contentmoderation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app.moderation" prefix to a strongly-typed configuration
 * object covering the queue, the worker identity, the classifier and the background schedulers.
 */
@Data
@ConfigurationProperties(prefix = "app.moderation")
public class ModerationProperties {

    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Ingestion ingestion = new Ingestion();
    private Classifier classifier = new Classifier();
    private Scoring scoring = new Scoring();
    private Store store = new Store();
    private Liveness liveness = new Liveness();
    private Replay replay = new Replay();
    private Backup backup = new Backup();

    @Data
    public static class RetryConfig {
        private int attempts = 2;
        private long delayMs = 500;
    }

    @Data
    public static class Queue {
        private String name = "moderation-queue";
        private long reconnectDelayMs = 5000;
        private long probeTimeoutMs = 3000;
        private int pollTimeoutSeconds = 10;
    }

    @Data
    public static class Worker {
        private boolean enabled = true;
        private String id = "worker-unknown";
    }

    @Data
    public static class Ingestion {
        private String serverTag = "server1";
        private String defaultCategory = "general";
    }

    @Data
    public static class Classifier {
        private List<String> blockedTerms = new ArrayList<>();
    }

    @Data
    public static class Scoring {
        private String baseUrl = "https://commentanalyzer.googleapis.com";
        private String analyzePath = "/v1alpha1/comments:analyze";
        private String apiKeyHeader = "X-Goog-Api-Key";
        private String apiKey;
        private long timeoutMs = 10_000;
        private List<String> attributes = new ArrayList<>(List.of("TOXICITY", "INSULT", "PROFANITY"));
        private List<String> languages = new ArrayList<>(List.of("en"));
    }

    @Data
    public static class Store {
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class Liveness {
        private long probeTimeoutMs = 1000;
        private List<WorkerEndpoint> workers = new ArrayList<>();
    }

    @Data
    public static class WorkerEndpoint {
        private String id;
        private String healthUrl;
    }

    @Data
    public static class Replay {
        private boolean enabled = true;
        private long gracePeriodSeconds = 30;
        private int batchSize = 100;
    }

    @Data
    public static class Backup {
        private boolean enabled = false;
        private String directory = "data/backups";
        private int retention = 24;
    }

    /**
     * @return The ids of every worker the fleet is expected to contain, in configuration order.
     */
    public List<String> workerIds() {
        return liveness.getWorkers().stream().map(WorkerEndpoint::getId).toList();
    }
}
