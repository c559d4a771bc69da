package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.model.Decision;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.repository.ModerationJobRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringJUnitConfig(JobStateManagerTest.RetryTestConfig.class)
@TestPropertySource(properties = {
        "app.moderation.store.retry.attempts=2",
        "app.moderation.store.retry.delay-ms=1"
})
class JobStateManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-04T10:15:30Z");

    @Configuration
    @EnableRetry
    @Import({JobStateManager.class, JobStoreRetryListener.class})
    static class RetryTestConfig {
    }

    @MockBean
    private ModerationJobRepository jobRepository;

    @Autowired
    private JobStateManager jobStateManager;

    @Test
    @DisplayName("Retries a transient store failure and succeeds on a later attempt")
    void retriesTransientFailure() {
        // given
        when(jobRepository.updateToInProgress("job-1", JobStatus.PROCESSING, "worker-1"))
                .thenThrow(new DataAccessResourceFailureException("connection reset"))
                .thenReturn(1);

        // when
        boolean claimed = jobStateManager.markProcessing("job-1", "worker-1");

        // then
        assertThat(claimed).isTrue();
        verify(jobRepository, times(2)).updateToInProgress("job-1", JobStatus.PROCESSING, "worker-1");
    }

    @Test
    @DisplayName("Gives up after the configured number of retries and propagates the failure")
    void exhaustsRetries() {
        // given
        when(jobRepository.updateDecision(anyString(), any(), anyString(), anyString(), any(), any(), anyLong(), any()))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        // when / then
        assertThatThrownBy(() -> jobStateManager.recordDecision("job-1", "worker-1",
                                                                Decision.approved("Content approved", 0.1), 10L, NOW))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verify(jobRepository, times(3)).updateDecision(anyString(), any(), anyString(), anyString(), any(), any(),
                                                       anyLong(), any());
    }

    @Test
    @DisplayName("Does not retry permanent store errors")
    void noRetryOnPermanentError() {
        // given
        when(jobRepository.updateEnqueuedAt("job-1", NOW)).thenThrow(new DataIntegrityViolationException("bad"));

        // when / then
        assertThatThrownBy(() -> jobStateManager.markEnqueued("job-1", NOW))
                .isInstanceOf(DataIntegrityViolationException.class);
        verify(jobRepository, times(1)).updateEnqueuedAt("job-1", NOW);
    }

    @Test
    @DisplayName("Stamps completedAt only for approved and rejected decisions")
    void completedAtOnlyForTerminalDecisions() {
        // given
        when(jobRepository.updateDecision(anyString(), any(), anyString(), anyString(), any(), any(), anyLong(), any()))
                .thenReturn(1);

        // when
        jobStateManager.recordDecision("job-1", "worker-1", Decision.rejected("Content rejected", 0.9), 5L, NOW);
        jobStateManager.recordDecision("job-2", "worker-1",
                                       Decision.needsReview("Content flagged", 0.6, "borderline"), 5L, NOW);

        // then
        verify(jobRepository).updateDecision(eq("job-1"), eq(JobStatus.REJECTED), eq("worker-1"), anyString(),
                                             eq(0.9), isNull(), eq(5L), eq(NOW));
        verify(jobRepository).updateDecision(eq("job-2"), eq(JobStatus.NEEDS_REVIEW), eq("worker-1"), anyString(),
                                             eq(0.6), eq("borderline"), eq(5L), isNull());
    }
}
