package com.eyelevel.contentmoderation.service.queue;

import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.QueueUnavailableException;

/**
 * Hands work items to the durable work queue.
 */
public interface WorkQueuePublisher {

    /**
     * Enqueues a work item. Returns only once the broker has accepted the message.
     *
     * @throws QueueUnavailableException If the queue is not connected or rejected the message.
     */
    void publish(WorkItem workItem);
}
