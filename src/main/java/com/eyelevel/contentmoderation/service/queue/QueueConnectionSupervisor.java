package com.eyelevel.contentmoderation.service.queue;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the lifecycle of the process-wide work queue handle.
 * <p>
 * {@link #checkConnection()} is driven by the
 * {@link com.eyelevel.contentmoderation.scheduler.QueueConnectionScheduler} at a fixed delay. Each check
 * creates the queue if it does not exist (a no-op when it does) and moves the state to
 * {@link ConnectionState#READY} or back to {@link ConnectionState#CONNECTING}. Every transition is
 * published as a {@link QueueConnectionEvent}.
 */
@Slf4j
@Component
public class QueueConnectionSupervisor {

    private final SqsAsyncClient sqsAsyncClient;
    private final ApplicationEventPublisher eventPublisher;
    private final String queueName;
    private final long probeTimeoutMs;
    private final long reconnectDelayMs;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile String queueUrl;

    public QueueConnectionSupervisor(final SqsAsyncClient sqsAsyncClient,
                                     final ApplicationEventPublisher eventPublisher,
                                     final ModerationProperties properties) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.eventPublisher = eventPublisher;
        this.queueName = properties.getQueue().getName();
        this.probeTimeoutMs = properties.getQueue().getProbeTimeoutMs();
        this.reconnectDelayMs = properties.getQueue().getReconnectDelayMs();
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isReady() {
        return state.get() == ConnectionState.READY;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getQueueUrl() {
        return queueUrl;
    }

    /**
     * Probes the queue once and applies the resulting state transition.
     */
    public void checkConnection() {
        final ConnectionState previous = state.get();
        if (previous == ConnectionState.CLOSED) {
            return;
        }

        if (probe()) {
            if (previous != ConnectionState.READY && state.compareAndSet(previous, ConnectionState.READY)) {
                log.info("Work queue '{}' is ready at {}.", queueName, queueUrl);
                publish(new QueueConnectionEvent(previous, ConnectionState.READY));
            }
            return;
        }

        if (previous == ConnectionState.READY) {
            transitionToConnecting("probe failed");
        } else {
            log.warn("Work queue '{}' is still unreachable. Retrying in {} ms.", queueName, reconnectDelayMs);
        }
    }

    /**
     * Called by the publisher when a send fails on a connection that was believed to be ready.
     */
    public void markConnectionLost(final Throwable cause) {
        transitionToConnecting(cause == null ? "unknown cause" : cause.getMessage());
    }

    /**
     * Stops the reconnect loop. No event is published: the listener container is stopped by the
     * context's own lifecycle before singletons are destroyed.
     */
    @PreDestroy
    public void close() {
        if (state.getAndSet(ConnectionState.CLOSED) != ConnectionState.CLOSED) {
            log.info("Closing work queue handle for '{}'.", queueName);
        }
    }

    private void transitionToConnecting(final String reason) {
        if (state.compareAndSet(ConnectionState.READY, ConnectionState.CONNECTING)) {
            log.warn("Lost connection to work queue '{}' ({}). Reconnecting every {} ms.", queueName, reason,
                     reconnectDelayMs);
            publish(new QueueConnectionEvent(ConnectionState.READY, ConnectionState.CONNECTING));
        }
    }

    /**
     * A failing listener is logged; the transition itself has already happened and is not undone.
     */
    private void publish(final QueueConnectionEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (final RuntimeException e) {
            log.error("A listener failed while handling work queue transition {} -> {}.", event.previous(),
                      event.current(), e);
        }
    }

    private boolean probe() {
        try {
            queueUrl = sqsAsyncClient.createQueue(CreateQueueRequest.builder().queueName(queueName).build())
                                     .get(probeTimeoutMs, TimeUnit.MILLISECONDS)
                                     .queueUrl();
            return true;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while probing work queue '{}'.", queueName);
            return false;
        } catch (final ExecutionException e) {
            log.debug("Work queue probe for '{}' failed.", queueName, e.getCause());
            return false;
        } catch (final TimeoutException e) {
            log.debug("Work queue probe for '{}' timed out after {} ms.", queueName, probeTimeoutMs);
            return false;
        } catch (final RuntimeException e) {
            log.debug("Work queue probe for '{}' could not be sent.", queueName, e);
            return false;
        }
    }
}
