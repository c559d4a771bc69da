package com.eyelevel.contentmoderation.dto.scoring.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzeCommentResponse(Map<String, AttributeScore> attributeScores, List<String> languages) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AttributeScore(SummaryScore summaryScore) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SummaryScore(Double value, String type) {
    }
}
