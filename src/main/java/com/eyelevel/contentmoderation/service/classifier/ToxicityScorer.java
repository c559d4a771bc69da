package com.eyelevel.contentmoderation.service.classifier;

import com.eyelevel.contentmoderation.exception.ScoringUnavailableException;

/**
 * Scores a piece of text against a fixed set of toxicity attributes.
 */
public interface ToxicityScorer {

    /**
     * @param text The content to score.
     *
     * @return A score for every configured attribute.
     *
     * @throws ScoringUnavailableException If the service could not be reached, answered with an error,
     *                                     timed out or returned an incomplete response.
     */
    AttributeScores score(String text);
}
