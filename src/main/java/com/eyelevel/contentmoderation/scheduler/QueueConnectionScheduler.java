package com.eyelevel.contentmoderation.scheduler;

import com.eyelevel.contentmoderation.service.queue.QueueConnectionSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the work queue reconnect loop. The first check runs at startup; later checks run a fixed
 * delay after the previous one finished, so probes never overlap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueConnectionScheduler {

    private final QueueConnectionSupervisor connectionSupervisor;

    @Scheduled(fixedDelayString = "${app.moderation.queue.reconnect-delay-ms:5000}")
    public void checkQueueConnection() {
        log.trace("Checking work queue connection (state {}).", connectionSupervisor.getState());
        connectionSupervisor.checkConnection();
    }
}
