package com.eyelevel.contentmoderation.service.classifier;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.exception.ScoringUnavailableException;
import com.eyelevel.contentmoderation.model.Decision;
import com.eyelevel.contentmoderation.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ThresholdContentClassifierTest {

    @Mock
    private ToxicityScorer toxicityScorer;

    private ThresholdContentClassifier classifier;

    @BeforeEach
    void setUp() {
        ModerationProperties properties = new ModerationProperties();
        properties.getClassifier().setBlockedTerms(List.of("forbiddenword", "  ", "Spam Link"));
        classifier = new ThresholdContentClassifier(toxicityScorer, properties);
    }

    private static AttributeScores scores(double toxicity, double insult, double profanity) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("TOXICITY", toxicity);
        values.put("INSULT", insult);
        values.put("PROFANITY", profanity);
        return new AttributeScores(values);
    }

    @Nested
    @DisplayName("Blocked terms")
    class BlockedTerms {

        @Test
        @DisplayName("Content containing a blocked term is rejected without calling the scorer")
        void rejectsWithoutScoring() {
            // when
            Decision decision = classifier.classify("this has a FORBIDDENWORD inside");

            // then
            assertThat(decision.status()).isEqualTo(JobStatus.REJECTED);
            assertThat(decision.score()).isNull();
            assertThat(decision.reviewReason()).isNull();
            assertThat(decision.detail()).isEqualTo("Content rejected due to egregious keyword: forbiddenword");
            verifyNoInteractions(toxicityScorer);
        }

        @Test
        @DisplayName("Blocked terms match as case-insensitive substrings, including multi-word terms")
        void matchesSubstrings() {
            // when
            Decision decision = classifier.classify("click this spam link now");

            // then
            assertThat(decision.status()).isEqualTo(JobStatus.REJECTED);
            assertThat(decision.detail()).endsWith("Spam Link");
            verifyNoInteractions(toxicityScorer);
        }

        @Test
        @DisplayName("Blank configured terms are ignored")
        void ignoresBlankTerms() {
            // given
            when(toxicityScorer.score(anyString())).thenReturn(scores(0.1, 0.1, 0.1));

            // when
            Decision decision = classifier.classify("a perfectly normal sentence");

            // then
            assertThat(decision.status()).isEqualTo(JobStatus.APPROVED);
        }
    }

    @Nested
    @DisplayName("Score thresholds")
    class Thresholds {

        @ParameterizedTest(name = "max score {0} -> {1}")
        @CsvSource({
                "0.0, APPROVED",
                "0.4999, APPROVED",
                "0.5, NEEDS_REVIEW",
                "0.65, NEEDS_REVIEW",
                "0.8, NEEDS_REVIEW",
                "0.8000001, REJECTED",
                "0.99, REJECTED"
        })
        @DisplayName("The highest attribute score decides the outcome")
        void appliesThresholds(double maxScore, JobStatus expected) {
            // given
            when(toxicityScorer.score("text")).thenReturn(scores(0.01, maxScore, 0.02));

            // when
            Decision decision = classifier.classify("text");

            // then
            assertThat(decision.status()).isEqualTo(expected);
            assertThat(decision.score()).isEqualTo(maxScore);
        }

        @Test
        @DisplayName("A rejection lists every attribute score in its detail")
        void rejectionDetail() {
            // given
            when(toxicityScorer.score("nasty")).thenReturn(scores(0.91, 0.2, 0.05));

            // when
            Decision decision = classifier.classify("nasty");

            // then
            assertThat(decision.detail())
                    .isEqualTo("Content rejected due to high scores: toxicity=0.91, insult=0.20, profanity=0.05");
            assertThat(decision.reviewReason()).isNull();
        }

        @Test
        @DisplayName("Borderline content carries the borderline review reason")
        void borderlineReason() {
            // given
            when(toxicityScorer.score("hmm")).thenReturn(scores(0.6, 0.1, 0.1));

            // when
            Decision decision = classifier.classify("hmm");

            // then
            assertThat(decision.status()).isEqualTo(JobStatus.NEEDS_REVIEW);
            assertThat(decision.reviewReason()).isEqualTo("borderline content requiring human evaluation");
        }

        @Test
        @DisplayName("Approved content has no review reason")
        void approvedHasNoReason() {
            // given
            when(toxicityScorer.score("this is great")).thenReturn(scores(0.2, 0.1, 0.05));

            // when
            Decision decision = classifier.classify("this is great");

            // then
            assertThat(decision.status()).isEqualTo(JobStatus.APPROVED);
            assertThat(decision.score()).isEqualTo(0.2);
            assertThat(decision.reviewReason()).isNull();
        }
    }

    @Test
    @DisplayName("An unavailable scorer degrades to needs_review with no score")
    void degradesWhenScoringUnavailable() {
        // given
        when(toxicityScorer.score(anyString())).thenThrow(new ScoringUnavailableException("timeout"));

        // when
        Decision decision = classifier.classify("anything");

        // then
        assertThat(decision.status()).isEqualTo(JobStatus.NEEDS_REVIEW);
        assertThat(decision.score()).isNull();
        assertThat(decision.reviewReason()).isEqualTo("scoring unavailable, requires human review");
        assertThat(decision.detail()).isEqualTo("Failed to analyze content with the scoring service");
    }

    @Test
    @DisplayName("Null content is scored as an empty string")
    void nullContent() {
        // given
        when(toxicityScorer.score("")).thenReturn(scores(0.0, 0.0, 0.0));

        // when
        Decision decision = classifier.classify(null);

        // then
        assertThat(decision.status()).isEqualTo(JobStatus.APPROVED);
        verify(toxicityScorer).score("");
    }
}
