package com.eyelevel.contentmoderation.service.liveness;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.liveness.LivenessSnapshot;
import com.eyelevel.contentmoderation.dto.liveness.WorkerActivity;
import com.eyelevel.contentmoderation.dto.liveness.WorkerStatus;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.repository.ModerationJobRepository;
import com.eyelevel.contentmoderation.service.queue.QueueConnectionSupervisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Builds a {@link LivenessSnapshot} of the configured worker fleet.
 * <p>
 * Health endpoints are probed concurrently, each with its own timeout, so a slow or dead worker
 * delays the snapshot by at most one probe timeout and never affects another worker's result.
 * Busy or idle is read from the job store; a store failure marks only that worker as unknown.
 */
@Slf4j
@Service
public class LivenessMonitor {

    private final WebClient webClient;
    private final ModerationJobRepository jobRepository;
    private final QueueConnectionSupervisor connectionSupervisor;
    private final ModerationProperties.Liveness liveness;
    private final Clock clock;

    public LivenessMonitor(@Qualifier("healthProbeWebClient") final WebClient webClient,
                           final ModerationJobRepository jobRepository,
                           final QueueConnectionSupervisor connectionSupervisor,
                           final ModerationProperties properties,
                           final Clock clock) {
        this.webClient = webClient;
        this.jobRepository = jobRepository;
        this.connectionSupervisor = connectionSupervisor;
        this.liveness = properties.getLiveness();
        this.clock = clock;
    }

    public LivenessSnapshot snapshot() {
        final Duration probeTimeout = Duration.ofMillis(liveness.getProbeTimeoutMs());
        final List<ModerationProperties.WorkerEndpoint> endpoints = liveness.getWorkers();

        final List<ProbeResult> probes = Flux.fromIterable(endpoints)
                                             .flatMapSequential(endpoint -> probe(endpoint, probeTimeout))
                                             .collectList()
                                             .block(probeTimeout.multipliedBy(2));

        final List<WorkerStatus> workers = probes == null
                ? List.of()
                : probes.stream()
                        .map(probe -> new WorkerStatus(probe.workerId(), probe.reachable(),
                                                       activityOf(probe.workerId()), probe.error()))
                        .toList();

        return new LivenessSnapshot(Instant.now(clock), connectionSupervisor.getState(), workers);
    }

    private Mono<ProbeResult> probe(final ModerationProperties.WorkerEndpoint endpoint, final Duration timeout) {
        if (!StringUtils.hasText(endpoint.getHealthUrl())) {
            return Mono.just(new ProbeResult(endpoint.getId(), false, "no health URL configured"));
        }
        return Mono.defer(() -> webClient.get()
                                         .uri(endpoint.getHealthUrl())
                                         .retrieve()
                                         .toBodilessEntity())
                        .map(response -> new ProbeResult(endpoint.getId(), true, null))
                        .timeout(timeout)
                        .onErrorResume(error -> {
                            log.debug("Health probe for worker {} failed: {}", endpoint.getId(), error.toString());
                            return Mono.just(new ProbeResult(endpoint.getId(), false, describe(error, timeout)));
                        });
    }

    private WorkerActivity activityOf(final String workerId) {
        try {
            return jobRepository.existsByAssignedWorkerAndStatus(workerId, JobStatus.PROCESSING)
                    ? WorkerActivity.BUSY
                    : WorkerActivity.IDLE;
        } catch (final DataAccessException e) {
            log.warn("Could not read the activity of worker {} from the job store: {}", workerId, e.getMessage());
            return WorkerActivity.UNKNOWN;
        }
    }

    private static String describe(final Throwable error, final Duration timeout) {
        if (error instanceof TimeoutException) {
            return "no response within " + timeout.toMillis() + " ms";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private record ProbeResult(String workerId, boolean reachable, String error) {
    }
}
