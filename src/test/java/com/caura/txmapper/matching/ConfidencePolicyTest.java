package com.caura.txmapper.matching;

import com.caura.txmapper.config.MatchingProperties;
import com.caura.txmapper.domain.ConfidenceBand;
import com.caura.txmapper.domain.MatchMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConfidencePolicy Unit Tests")
class ConfidencePolicyTest {

    private ConfidencePolicy policy;

    @BeforeEach
    void setUp() {
        policy = new ConfidencePolicy(new MatchingProperties());
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, HIGH",
            "0.85, HIGH",
            "0.8499, MEDIUM",
            "0.60, MEDIUM",
            "0.5999, LOW",
            "0.0, LOW"
    })
    @DisplayName("Should band scores on the default thresholds")
    void shouldBandScores(double score, ConfidenceBand expected) {
        assertThat(policy.band(score)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should be monotonic in score")
    void shouldBeMonotonic() {
        ConfidenceBand previous = policy.band(0.0);
        for (int i = 1; i <= 100; i++) {
            ConfidenceBand current = policy.band(i / 100.0);
            // Enum order is HIGH, MEDIUM, LOW, so a higher score never moves to a later constant
            assertThat(current.ordinal()).isLessThanOrEqualTo(previous.ordinal());
            previous = current;
        }
    }

    @ParameterizedTest
    @EnumSource(value = MatchMethod.class, names = {"EXACT_CLIENT_ID", "EXACT_EMAIL", "EXTRACTED_EMAIL",
            "EXTRACTED_BUSINESS_NUMBER", "EXTRACTED_PHONE", "EMAIL_PROPAGATED", "PREVIOUSLY_MATCHED"})
    @DisplayName("Should never require review for exact identifier methods")
    void shouldNotRequireReviewForExactMethods(MatchMethod method) {
        assertThat(policy.requiresReview(method, 0.5)).isFalse();
    }

    @Test
    @DisplayName("Should require review for fuzzy methods below the high band")
    void shouldRequireReviewBelowHighBand() {
        assertThat(policy.requiresReview(MatchMethod.ADDRESS_MATCH, 0.83)).isTrue();
        assertThat(policy.requiresReview(MatchMethod.ADDRESS_MATCH, 0.85)).isFalse();
        assertThat(policy.requiresReview(MatchMethod.NO_MATCH, 0.0)).isTrue();
    }

    @Test
    @DisplayName("Should read thresholds from configuration")
    void shouldReadConfiguredThresholds() {
        // Given
        MatchingProperties properties = new MatchingProperties();
        properties.getConfidenceThresholds().setHigh(0.95);
        properties.getConfidenceThresholds().setMedium(0.50);

        // When
        ConfidencePolicy strict = new ConfidencePolicy(properties);

        // Then
        assertThat(strict.band(0.90)).isEqualTo(ConfidenceBand.MEDIUM);
        assertThat(strict.band(0.55)).isEqualTo(ConfidenceBand.MEDIUM);
        assertThat(strict.requiresReview(MatchMethod.FUZZY_NAME, 0.90)).isTrue();
        assertThat(strict.highThreshold()).isEqualTo(0.95);
    }

    @Test
    @DisplayName("Should reject a medium threshold above the high threshold")
    void shouldRejectInvertedThresholds() {
        MatchingProperties properties = new MatchingProperties();
        properties.getConfidenceThresholds().setMedium(0.90);

        assertThatThrownBy(() -> new ConfidencePolicy(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds high threshold");
    }
}
