package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.job.request.CreateJobRequest;
import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.JobValidationException;
import com.eyelevel.contentmoderation.exception.QueueUnavailableException;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.model.ModerationJob;
import com.eyelevel.contentmoderation.service.queue.WorkQueuePublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-04T10:15:30Z");

    @Mock
    private JobStateManager jobStateManager;

    @Mock
    private WorkQueuePublisher workQueuePublisher;

    private JobIngestionService service;

    @BeforeEach
    void setUp() {
        service = new JobIngestionService(jobStateManager, workQueuePublisher, new ModerationProperties(),
                                          Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("A valid submission is persisted as pending with defaults, published and stamped as enqueued")
    void submitsJob() {
        // given
        when(jobStateManager.create(any(ModerationJob.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // when
        ModerationJob job = service.submit(new CreateJobRequest("t", "this is great", "a", null, " "));

        // then
        assertThat(job.getId()).isNotBlank();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getCategory()).isEqualTo("general");
        assertThat(job.getServerTag()).isEqualTo("server1");
        assertThat(job.getCreatedAt()).isEqualTo(NOW);
        assertThat(job.getEnqueuedAt()).isEqualTo(NOW);
        assertThat(job.getAssignedWorker()).isNull();
        assertThat(job.getCompletedAt()).isNull();

        ArgumentCaptor<WorkItem> captor = ArgumentCaptor.forClass(WorkItem.class);
        verify(workQueuePublisher).publish(captor.capture());
        assertThat(captor.getValue().id()).isEqualTo(job.getId());
        assertThat(captor.getValue().content()).isEqualTo("this is great");
        verify(jobStateManager).markEnqueued(job.getId(), NOW);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("A blank title is rejected and nothing is persisted")
    void rejectsBlankTitle(String title) {
        // when / then
        assertThatThrownBy(() -> service.submit(new CreateJobRequest(title, "content", "a", null, null)))
                .isInstanceOf(JobValidationException.class)
                .hasMessageContaining("title");
        verifyNoInteractions(jobStateManager, workQueuePublisher);
    }

    @Test
    @DisplayName("Missing content or author is rejected")
    void rejectsMissingFields() {
        // when / then
        assertThatThrownBy(() -> service.submit(new CreateJobRequest("t", null, "a", null, null)))
                .isInstanceOf(JobValidationException.class)
                .hasMessageContaining("content");
        assertThatThrownBy(() -> service.submit(new CreateJobRequest("t", "c", "", null, null)))
                .isInstanceOf(JobValidationException.class)
                .hasMessageContaining("author");
        assertThatThrownBy(() -> service.submit(null)).isInstanceOf(JobValidationException.class);
        verifyNoInteractions(jobStateManager, workQueuePublisher);
    }

    @Test
    @DisplayName("A queue outage leaves the job persisted and pending without an enqueue time")
    void toleratesQueueOutage() {
        // given
        when(jobStateManager.create(any(ModerationJob.class))).thenAnswer(invocation -> invocation.getArgument(0));
        doThrow(new QueueUnavailableException("not connected")).when(workQueuePublisher).publish(any());

        // when
        ModerationJob job = service.submit(new CreateJobRequest("t", "content", "a", "sports", "server2"));

        // then
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getEnqueuedAt()).isNull();
        assertThat(job.getCategory()).isEqualTo("sports");
        assertThat(job.getServerTag()).isEqualTo("server2");
        verify(jobStateManager).create(any(ModerationJob.class));
        verify(jobStateManager, never()).markEnqueued(any(), any());
    }
}
