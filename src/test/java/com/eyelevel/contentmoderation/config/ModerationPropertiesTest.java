package com.eyelevel.contentmoderation.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ModerationPropertiesTest {

    private static ModerationProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bind("app.moderation", ModerationProperties.class)
                .orElseGet(ModerationProperties::new);
    }

    @Test
    @DisplayName("A comma-separated blocked term list binds every term in order")
    void bindsEveryBlockedTerm() {
        // when
        ModerationProperties properties = bind(Map.of("app.moderation.classifier.blocked-terms",
                                                      "first-term,second-term"));

        // then
        assertThat(properties.getClassifier().getBlockedTerms()).containsExactly("first-term", "second-term");
    }

    @Test
    @DisplayName("Without configuration the blocked term list is empty")
    void emptyByDefault() {
        // when
        ModerationProperties properties = bind(Map.of());

        // then
        assertThat(properties.getClassifier().getBlockedTerms()).isEmpty();
    }
}
