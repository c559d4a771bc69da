package com.eyelevel.contentmoderation.consumer;

import com.eyelevel.contentmoderation.common.json.JsonParser;
import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.json.JsonParsingException;
import com.eyelevel.contentmoderation.service.job.JobProcessingService;
import com.eyelevel.contentmoderation.service.queue.WorkerContainerController;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * An SQS message consumer that takes moderation work items off the work queue, one at a time.
 * <p>
 * The message is deleted from the queue only when this method returns normally. A
 * {@link com.eyelevel.contentmoderation.exception.MessageProcessingFailedException} thrown by the
 * processing service leaves it in flight, and SQS redelivers it after the visibility timeout.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.moderation.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ModerationWorker {

    private final JobProcessingService jobProcessingService;
    private final JsonParser jsonParser;

    public ModerationWorker(final JobProcessingService jobProcessingService,
                            @Qualifier("jacksonJsonParser") final JsonParser jsonParser) {
        this.jobProcessingService = jobProcessingService;
        this.jsonParser = jsonParser;
    }

    @SqsListener(value = "${app.moderation.queue.name}", factory = "moderationContainerFactory",
            id = WorkerContainerController.WORKER_CONTAINER_ID)
    public void onWorkItem(@Payload final String message) {
        final WorkItem workItem;
        try {
            workItem = jsonParser.parseObject(message == null ? null : message.getBytes(StandardCharsets.UTF_8),
                                              WorkItem.class);
        } catch (final JsonParsingException e) {
            log.error("[FATAL] Unreadable work item. Message will be dropped. Payload: {}", message);
            return;
        }
        jobProcessingService.process(workItem);
    }
}
