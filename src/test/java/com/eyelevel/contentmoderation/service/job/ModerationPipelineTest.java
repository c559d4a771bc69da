package com.eyelevel.contentmoderation.service.job;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.queue.WorkItem;
import com.eyelevel.contentmoderation.exception.ScoringUnavailableException;
import com.eyelevel.contentmoderation.model.Decision;
import com.eyelevel.contentmoderation.model.JobStatus;
import com.eyelevel.contentmoderation.service.classifier.AttributeScores;
import com.eyelevel.contentmoderation.service.classifier.ThresholdContentClassifier;
import com.eyelevel.contentmoderation.service.classifier.ToxicityScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs work items through the processing service with the real threshold classifier.
 */
@ExtendWith(MockitoExtension.class)
class ModerationPipelineTest {

    private static final Instant NOW = Instant.parse("2024-05-04T10:15:30Z");

    @Mock
    private JobStateManager jobStateManager;

    @Mock
    private ToxicityScorer toxicityScorer;

    private JobProcessingService processingService;

    @BeforeEach
    void setUp() {
        ModerationProperties properties = new ModerationProperties();
        properties.getWorker().setId("worker-2");
        properties.getClassifier().setBlockedTerms(List.of("badword"));
        processingService = new JobProcessingService(jobStateManager,
                                                     new ThresholdContentClassifier(toxicityScorer, properties),
                                                     Clock.fixed(NOW, ZoneOffset.UTC), properties);
        when(jobStateManager.markProcessing(anyString(), eq("worker-2"))).thenReturn(true);
        when(jobStateManager.recordDecision(anyString(), eq("worker-2"), any(Decision.class), anyLong(), eq(NOW)))
                .thenReturn(true);
    }

    private Decision recordedDecision(String jobId) {
        ArgumentCaptor<Decision> captor = ArgumentCaptor.forClass(Decision.class);
        verify(jobStateManager).recordDecision(eq(jobId), eq("worker-2"), captor.capture(), anyLong(), eq(NOW));
        return captor.getValue();
    }

    @Test
    @DisplayName("Low scores approve the job and keep the highest sub-score")
    void approves() {
        // given
        when(toxicityScorer.score("this is great"))
                .thenReturn(new AttributeScores(Map.of("TOXICITY", 0.2, "INSULT", 0.05, "PROFANITY", 0.01)));

        // when
        processingService.process(new WorkItem("job-1", "t", "this is great", "a", "general", "server1"));

        // then
        Decision decision = recordedDecision("job-1");
        assertThat(decision.status()).isEqualTo(JobStatus.APPROVED);
        assertThat(decision.score()).isEqualTo(0.2);
        assertThat(decision.reviewReason()).isNull();
    }

    @Test
    @DisplayName("Deny-listed content is rejected without calling the scoring service")
    void rejectsBlockedTerm() {
        // when
        processingService.process(new WorkItem("job-2", "t", "this has BADWORD inside", "a", "general", "server1"));

        // then
        Decision decision = recordedDecision("job-2");
        assertThat(decision.status()).isEqualTo(JobStatus.REJECTED);
        assertThat(decision.detail()).isEqualTo("Content rejected due to egregious keyword: badword");
        assertThat(decision.score()).isNull();
        verifyNoInteractions(toxicityScorer);
    }

    @Test
    @DisplayName("An unreachable scoring service sends the job to human review instead of failing")
    void degradesToReview() {
        // given
        when(toxicityScorer.score(anyString())).thenThrow(new ScoringUnavailableException("timed out"));

        // when
        processingService.process(new WorkItem("job-3", "t", "hello there", "a", "general", "server1"));

        // then
        Decision decision = recordedDecision("job-3");
        assertThat(decision.status()).isEqualTo(JobStatus.NEEDS_REVIEW);
        assertThat(decision.reviewReason()).isEqualTo("scoring unavailable, requires human review");
    }
}
