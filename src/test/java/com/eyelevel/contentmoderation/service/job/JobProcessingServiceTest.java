package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.MessageProcessingFailedException;
import com.eyelevel.contentmoderation.model.Decision;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.service.classifier.ContentClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobProcessingServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-04T10:15:30Z");

    @Mock
    private JobStateManager jobStateManager;

    @Mock
    private ContentClassifier contentClassifier;

    private JobProcessingService service;

    private final WorkItem workItem = new WorkItem("job-1", "t", "this is great", "a", "general", "server1");

    @BeforeEach
    void setUp() {
        ModerationProperties properties = new ModerationProperties();
        properties.getWorker().setId("worker-1");
        service = new JobProcessingService(jobStateManager, contentClassifier, Clock.fixed(NOW, ZoneOffset.UTC),
                                           properties);
    }

    @Test
    @DisplayName("Marks the job as processing before classifying, then records the decision")
    void processesInOrder() {
        // given
        Decision decision = Decision.approved("Content approved", 0.2);
        when(jobStateManager.markProcessing("job-1", "worker-1")).thenReturn(true);
        when(contentClassifier.classify("this is great")).thenReturn(decision);
        when(jobStateManager.recordDecision(eq("job-1"), eq("worker-1"), eq(decision), anyLong(), eq(NOW)))
                .thenReturn(true);

        // when
        service.process(workItem);

        // then
        InOrder inOrder = inOrder(jobStateManager, contentClassifier);
        inOrder.verify(jobStateManager).markProcessing("job-1", "worker-1");
        inOrder.verify(contentClassifier).classify("this is great");
        inOrder.verify(jobStateManager).recordDecision(eq("job-1"), eq("worker-1"), eq(decision), anyLong(), eq(NOW));
    }

    @Test
    @DisplayName("A redelivered work item runs the full cycle again and overwrites the earlier result")
    void redeliveryOverwrites() {
        // given
        Decision first = Decision.needsReview("Failed", null, "scoring unavailable, requires human review");
        Decision second = Decision.approved("Content approved", 0.1);
        when(jobStateManager.markProcessing("job-1", "worker-1")).thenReturn(true);
        when(contentClassifier.classify("this is great")).thenReturn(first, second);
        when(jobStateManager.recordDecision(eq("job-1"), eq("worker-1"), any(Decision.class), anyLong(), eq(NOW)))
                .thenReturn(true);

        // when
        service.process(workItem);
        service.process(workItem);

        // then
        verify(jobStateManager, times(2)).markProcessing("job-1", "worker-1");
        InOrder inOrder = inOrder(jobStateManager);
        inOrder.verify(jobStateManager).recordDecision(eq("job-1"), eq("worker-1"), eq(first), anyLong(), eq(NOW));
        inOrder.verify(jobStateManager).recordDecision(eq("job-1"), eq("worker-1"), eq(second), anyLong(), eq(NOW));
    }

    @Test
    @DisplayName("An unknown job id is acknowledged without classifying")
    void unknownJob() {
        // given
        when(jobStateManager.markProcessing("job-1", "worker-1")).thenReturn(false);

        // when
        service.process(workItem);

        // then
        verifyNoInteractions(contentClassifier);
        verify(jobStateManager, never()).recordDecision(any(), any(), any(), anyLong(), any());
    }

    @Test
    @DisplayName("A malformed work item is dropped without touching the store")
    void malformedItem() {
        // when
        service.process(new WorkItem(null, "t", "content", "a", null, null));
        service.process(new WorkItem("job-2", "t", null, "a", null, null));
        service.process(null);

        // then
        verifyNoInteractions(jobStateManager, contentClassifier);
    }

    @Test
    @DisplayName("A store failure on the decision write escapes so the message is not acknowledged")
    void decisionWriteFailure() {
        // given
        when(jobStateManager.markProcessing("job-1", "worker-1")).thenReturn(true);
        when(contentClassifier.classify(anyString())).thenReturn(Decision.rejected("bad", 0.95));
        when(jobStateManager.recordDecision(any(), any(), any(), anyLong(), any()))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        // when / then
        assertThatThrownBy(() -> service.process(workItem))
                .isInstanceOf(MessageProcessingFailedException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @DisplayName("A store failure on the processing write escapes before classification")
    void processingWriteFailure() {
        // given
        when(jobStateManager.markProcessing("job-1", "worker-1"))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        // when / then
        assertThatThrownBy(() -> service.process(workItem)).isInstanceOf(MessageProcessingFailedException.class);
        verifyNoInteractions(contentClassifier);
    }

    @Test
    @DisplayName("A classifier fault flags the job for review and lets the message be acknowledged")
    void classifierFaultDegradesToReview() {
        // given
        when(jobStateManager.markProcessing("job-1", "worker-1")).thenReturn(true);
        when(contentClassifier.classify("this is great"))
                .thenThrow(new IllegalArgumentException("At least one attribute score is required"));
        when(jobStateManager.recordDecision(eq("job-1"), eq("worker-1"), any(Decision.class), anyLong(), eq(NOW)))
                .thenReturn(true);

        // when
        service.process(workItem);

        // then
        ArgumentCaptor<Decision> captor = ArgumentCaptor.forClass(Decision.class);
        verify(jobStateManager).recordDecision(eq("job-1"), eq("worker-1"), captor.capture(), anyLong(), eq(NOW));
        assertThat(captor.getValue().status()).isEqualTo(JobStatus.NEEDS_REVIEW);
        assertThat(captor.getValue().score()).isNull();
        assertThat(captor.getValue().reviewReason()).isEqualTo("scoring unavailable, requires human review");
    }
}
