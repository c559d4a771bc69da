package com.eyelevel.contentmoderation.service.queue;

import io.awspring.cloud.sqs.listener.MessageListenerContainer;
import io.awspring.cloud.sqs.listener.MessageListenerContainerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the moderation worker's listener container when the queue becomes reachable and stops it
 * when the connection is lost, so the worker does not poll a queue it cannot reach. Runs before any
 * other listener of the same event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.moderation.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerContainerController {

    public static final String WORKER_CONTAINER_ID = "moderation-worker";

    private final MessageListenerContainerRegistry containerRegistry;

    @Order(Ordered.HIGHEST_PRECEDENCE)
    @EventListener
    public void onQueueConnectionChanged(final QueueConnectionEvent event) {
        final MessageListenerContainer<?> container = containerRegistry.getContainerById(WORKER_CONTAINER_ID);
        if (container == null) {
            log.warn("No listener container registered with id '{}'.", WORKER_CONTAINER_ID);
            return;
        }

        if (event.isReady() && !container.isRunning()) {
            log.info("Work queue ready. Starting listener container '{}'.", WORKER_CONTAINER_ID);
            container.start();
        } else if (!event.isReady() && container.isRunning()) {
            log.warn("Work queue {}. Stopping listener container '{}'.", event.current(), WORKER_CONTAINER_ID);
            container.stop();
        }
    }
}
