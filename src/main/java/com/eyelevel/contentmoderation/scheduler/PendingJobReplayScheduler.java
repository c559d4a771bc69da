package com.eyelevel.contentmoderation.scheduler;

import com.eyelevel.contentmoderation.service.job.PendingJobReplayService;
import com.eyelevel.contentmoderation.service.queue.QueueConnectionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers pending job replay periodically and immediately after the work queue (re)connects.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.moderation.replay", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PendingJobReplayScheduler {

    private final PendingJobReplayService replayService;

    @Scheduled(fixedDelayString = "${app.moderation.replay.interval-ms:60000}",
            initialDelayString = "${app.moderation.replay.interval-ms:60000}")
    public void replayPeriodically() {
        replayService.replayPendingJobs();
    }

    @Order(Ordered.LOWEST_PRECEDENCE)
    @EventListener(condition = "#event.ready")
    public void onQueueReady(final QueueConnectionEvent event) {
        log.info("Work queue is ready. Replaying pending jobs.");
        replayService.replayPendingJobs();
    }
}
