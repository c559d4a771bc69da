package com.eyelevel.contentmoderation.service.classifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-attribute probabilities returned by a {@link ToxicityScorer}, in the order they were requested.
 *
 * @param values Attribute name (for example {@code TOXICITY}) to a probability in {@code [0, 1]}.
 */
public record AttributeScores(Map<String, Double> values) {

    public AttributeScores {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("At least one attribute score is required");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public double max() {
        return values.values().stream().mapToDouble(Double::doubleValue).max().orElseThrow();
    }

    /**
     * Renders the scores as {@code toxicity=0.91, insult=0.20, profanity=0.05}.
     */
    public String describe() {
        return values.entrySet()
                     .stream()
                     .map(entry -> String.format(Locale.ROOT, "%s=%.2f", entry.getKey().toLowerCase(Locale.ROOT),
                                                 entry.getValue()))
                     .collect(Collectors.joining(", "));
    }
}
