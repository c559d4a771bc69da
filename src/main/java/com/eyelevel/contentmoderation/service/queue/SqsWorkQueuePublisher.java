package com.eyelevel.contentmoderation.service.queue;

import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.QueueUnavailableException;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Publishes work items to SQS through the {@link SqsTemplate}. SQS stores every accepted message
 * durably, so a successful send means the work item survives a broker restart.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SqsWorkQueuePublisher implements WorkQueuePublisher {

    private final SqsTemplate sqsTemplate;
    private final QueueConnectionSupervisor connectionSupervisor;

    @Override
    public void publish(final WorkItem workItem) {
        if (!connectionSupervisor.isReady()) {
            throw new QueueUnavailableException(
                    "Work queue is not connected (state " + connectionSupervisor.getState() + ")");
        }

        final String queueName = connectionSupervisor.getQueueName();
        try {
            sqsTemplate.send(to -> to.queue(queueName).payload(workItem));
            log.debug("Published job {} to queue '{}'.", workItem.id(), queueName);
        } catch (final RuntimeException e) {
            connectionSupervisor.markConnectionLost(e);
            throw new QueueUnavailableException("Failed to publish job " + workItem.id() + " to queue " + queueName, e);
        }
    }
}
