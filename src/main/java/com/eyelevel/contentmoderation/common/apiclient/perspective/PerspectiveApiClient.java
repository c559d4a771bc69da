package com.eyelevel.contentmoderation.common.apiclient.perspective;

import com.eyelevel.contentmoderation.common.apiclient.ApiClient;
import com.eyelevel.contentmoderation.common.apiclient.authentication.Authentication;
import com.eyelevel.contentmoderation.common.apiclient.model.ApiRequest;
import com.eyelevel.contentmoderation.common.apiclient.model.ApiResponse;
import com.eyelevel.contentmoderation.common.json.JsonParser;
import com.eyelevel.contentmoderation.config.ModerationProperties;
import com.eyelevel.contentmoderation.dto.scoring.request.AnalyzeCommentRequest;
import com.eyelevel.contentmoderation.dto.scoring.response.AnalyzeCommentResponse;
import com.eyelevel.contentmoderation.exception.ScoringUnavailableException;
import com.eyelevel.contentmoderation.exception.apiclient.ApiException;
import com.eyelevel.contentmoderation.exception.json.JsonParsingException;
import com.eyelevel.contentmoderation.service.classifier.AttributeScores;
import com.eyelevel.contentmoderation.service.classifier.ToxicityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ToxicityScorer} backed by the Perspective comment analyzer API.
 * <p>
 * Every failure mode (transport error, timeout, error status, unreadable body or a requested attribute
 * missing from the response) surfaces as a {@link ScoringUnavailableException}.
 */
@Slf4j
@Service("perspectiveApiClient")
public class PerspectiveApiClient extends ApiClient implements ToxicityScorer {

    private final JsonParser jsonParser;
    private final ModerationProperties.Scoring scoring;

    public PerspectiveApiClient(@Qualifier("perspectiveWebClient") final WebClient webClient,
                                @Qualifier("perspectiveAuthentication") final Authentication authentication,
                                @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                                final ModerationProperties properties) {
        super(webClient, authentication);
        this.jsonParser = jsonParser;
        this.scoring = properties.getScoring();
    }

    @Override
    protected Duration requestTimeout() {
        return Duration.ofMillis(scoring.getTimeoutMs());
    }

    @Override
    public AttributeScores score(final String text) {
        final AnalyzeCommentResponse response;
        try {
            final ApiResponse apiResponse = call(prepareAnalyzeRequest(text));
            response = jsonParser.parseObject(apiResponse.getData(), AnalyzeCommentResponse.class);
        } catch (final ApiException e) {
            log.warn("Perspective API call failed with status {}: {}", e.getStatusCode(), e.getMessage());
            throw new ScoringUnavailableException("Scoring service call failed: " + e.getMessage(), e);
        } catch (final JsonParsingException e) {
            log.warn("Perspective API returned an unreadable response: {}", e.getMessage());
            throw new ScoringUnavailableException("Scoring service returned an unreadable response", e);
        }
        return extractScores(response);
    }

    private ApiRequest prepareAnalyzeRequest(final String text) {
        return ApiRequest.builder()
                         .method(HttpMethod.POST)
                         .path(scoring.getAnalyzePath())
                         .acceptMediaType(MediaType.APPLICATION_JSON)
                         .contentType(MediaType.APPLICATION_JSON)
                         .body(AnalyzeCommentRequest.of(text, scoring.getAttributes(), scoring.getLanguages()))
                         .build();
    }

    private AttributeScores extractScores(final AnalyzeCommentResponse response) {
        if (response == null || response.attributeScores() == null) {
            throw new ScoringUnavailableException("Scoring service response has no attribute scores");
        }
        final Map<String, Double> values = new LinkedHashMap<>();
        for (final String attribute : scoring.getAttributes()) {
            final AnalyzeCommentResponse.AttributeScore attributeScore = response.attributeScores().get(attribute);
            final Double value = attributeScore == null || attributeScore.summaryScore() == null
                    ? null
                    : attributeScore.summaryScore().value();
            if (value == null || value.isNaN() || value < 0.0 || value > 1.0) {
                throw new ScoringUnavailableException(
                        "Scoring service response is missing a valid summary score for " + attribute);
            }
            values.put(attribute, value);
        }
        if (values.isEmpty()) {
            throw new ScoringUnavailableException("No scoring attributes are configured");
        }
        log.debug("Perspective scores: {}", values);
        return new AttributeScores(values);
    }
}
