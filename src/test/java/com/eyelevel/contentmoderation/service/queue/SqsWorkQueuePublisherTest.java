package com.eyelevel.contentmoderation.service.queue;

import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.QueueUnavailableException;
import io.awspring.cloud.sqs.operations.SqsSendOptions;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SqsWorkQueuePublisherTest {

    @Mock
    private SqsTemplate sqsTemplate;

    @Mock
    private QueueConnectionSupervisor connectionSupervisor;

    @InjectMocks
    private SqsWorkQueuePublisher publisher;

    private final WorkItem workItem = new WorkItem("job-1", "t", "content", "a", "general", "server1");

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Sends the work item as the payload to the configured queue")
    void publishes() {
        // given
        when(connectionSupervisor.isReady()).thenReturn(true);
        when(connectionSupervisor.getQueueName()).thenReturn("moderation-queue");

        // when
        publisher.publish(workItem);

        // then
        ArgumentCaptor<Consumer> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(sqsTemplate).send(captor.capture());
        SqsSendOptions<Object> options = mock(SqsSendOptions.class, RETURNS_SELF);
        captor.getValue().accept(options);
        verify(options).queue("moderation-queue");
        verify(options).payload(workItem);
    }

    @Test
    @DisplayName("Fails fast without sending while the queue is not connected")
    void failsWhenNotReady() {
        // given
        when(connectionSupervisor.isReady()).thenReturn(false);
        when(connectionSupervisor.getState()).thenReturn(ConnectionState.CONNECTING);

        // when / then
        assertThatThrownBy(() -> publisher.publish(workItem))
                .isInstanceOf(QueueUnavailableException.class)
                .hasMessageContaining("CONNECTING");
        verifyNoInteractions(sqsTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("A failed send marks the connection as lost and surfaces as unavailable")
    void sendFailure() {
        // given
        RuntimeException failure = new RuntimeException("connection reset");
        when(connectionSupervisor.isReady()).thenReturn(true);
        when(connectionSupervisor.getQueueName()).thenReturn("moderation-queue");
        when(sqsTemplate.send(any(Consumer.class))).thenThrow(failure);

        // when / then
        assertThatThrownBy(() -> publisher.publish(workItem))
                .isInstanceOf(QueueUnavailableException.class)
                .hasCause(failure);
        verify(connectionSupervisor).markConnectionLost(failure);
    }
}
