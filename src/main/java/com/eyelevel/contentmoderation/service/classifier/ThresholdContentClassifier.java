package com.eyelevel.contentmoderation.service.classifier;

import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.exception.ScoringUnavailableException;
import com.eyelevel.contentmoderation.model.Decision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies content in two steps.
 * <ol>
 *     <li>A case-insensitive substring match against the configured blocked terms rejects the content
 *     outright. The scorer is not called.</li>
 *     <li>Otherwise the highest attribute score decides: above {@value #REJECT_THRESHOLD} is rejected,
 *     from {@value #REVIEW_THRESHOLD} up to and including {@value #REJECT_THRESHOLD} needs review, anything
 *     lower is approved.</li>
 * </ol>
 * If the scorer is unavailable the content is flagged for review with no score.
 */
@Slf4j
@Service
public class ThresholdContentClassifier implements ContentClassifier {

    static final double REJECT_THRESHOLD = 0.8;
    static final double REVIEW_THRESHOLD = 0.5;

    static final String BORDERLINE_REASON = "borderline content requiring human evaluation";

    private final ToxicityScorer toxicityScorer;
    private final List<String> blockedTerms;

    public ThresholdContentClassifier(final ToxicityScorer toxicityScorer, final ModerationProperties properties) {
        this.toxicityScorer = toxicityScorer;
        this.blockedTerms = properties.getClassifier()
                                      .getBlockedTerms()
                                      .stream()
                                      .filter(Objects::nonNull)
                                      .map(String::trim)
                                      .filter(term -> !term.isEmpty())
                                      .toList();
        log.info("Content classifier initialized with {} blocked term(s).", blockedTerms.size());
    }

    @Override
    public Decision classify(final String content) {
        final String text = content == null ? "" : content;

        final Optional<String> blockedTerm = findBlockedTerm(text);
        if (blockedTerm.isPresent()) {
            log.info("Content matched blocked term. Rejecting without scoring.");
            return Decision.rejected("Content rejected due to egregious keyword: " + blockedTerm.get(), null);
        }

        final AttributeScores scores;
        try {
            scores = toxicityScorer.score(text);
        } catch (final ScoringUnavailableException e) {
            log.warn("Scoring unavailable, flagging content for human review: {}", e.getMessage());
            return ContentClassifier.scoringUnavailable();
        }

        final double maxScore = scores.max();
        if (maxScore > REJECT_THRESHOLD) {
            return Decision.rejected("Content rejected due to high scores: " + scores.describe(), maxScore);
        }
        if (maxScore >= REVIEW_THRESHOLD) {
            return Decision.needsReview("Content flagged for human review: " + scores.describe(), maxScore,
                                        BORDERLINE_REASON);
        }
        return Decision.approved("Content approved: " + scores.describe(), maxScore);
    }

    private Optional<String> findBlockedTerm(final String text) {
        final String normalized = text.toLowerCase(Locale.ROOT);
        return blockedTerms.stream()
                           .filter(term -> normalized.contains(term.toLowerCase(Locale.ROOT)))
                           .findFirst();
    }
}
