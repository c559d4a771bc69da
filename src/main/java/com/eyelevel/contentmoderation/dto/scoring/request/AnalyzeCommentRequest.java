package com.eyelevel.contentmoderation.dto.scoring.request;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body for the Perspective {@code comments:analyze} operation.
 * Each requested attribute maps to an empty options object.
 */
public record AnalyzeCommentRequest(Comment comment,
                                    Map<String, Map<String, Object>> requestedAttributes,
                                    List<String> languages) {

    public static AnalyzeCommentRequest of(final String text, final List<String> attributes,
                                           final List<String> languages) {
        final Map<String, Map<String, Object>> requested = new LinkedHashMap<>();
        attributes.forEach(attribute -> requested.put(attribute, Map.of()));
        return new AnalyzeCommentRequest(new Comment(text), requested, List.copyOf(languages));
    }

    public record Comment(String text) {
    }
}
