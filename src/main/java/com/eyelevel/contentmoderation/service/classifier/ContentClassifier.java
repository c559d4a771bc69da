package com.eyelevel.contentmoderation.service.classifier;

import com.eyelevel.contentmoderation.model.Decision;

/**
 * Turns a piece of content into a moderation {@link Decision}.
 * Implementations never touch pipeline state and never throw for a degraded scoring service.
 */
public interface ContentClassifier {

    String SCORING_UNAVAILABLE_REASON = "scoring unavailable, requires human review";
    String SCORING_FAILED_DETAIL = "Failed to analyze content with the scoring service";

    Decision classify(String content);

    /**
     * The decision recorded when content could not be scored: flagged for human review, no score.
     */
    static Decision scoringUnavailable() {
        return Decision.needsReview(SCORING_FAILED_DETAIL, null, SCORING_UNAVAILABLE_REASON);
    }
}
