package com.caura.txmapper.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StringSimilarity Unit Tests")
class StringSimilarityTest {

    @Test
    @DisplayName("Should score identical strings 1.0")
    void shouldScoreIdenticalStringsAsOne() {
        assertThat(StringSimilarity.ratio("robert brown", "robert brown")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should compute indel ratio rounded to two decimals")
    void shouldComputeRoundedRatio() {
        // LCS("kitten", "sitting") = 4, 2 * 4 / 13 = 0.615...
        assertThat(StringSimilarity.ratio("kitten", "sitting")).isEqualTo(0.62);
        assertThat(StringSimilarity.ratio("robert brown", "rob brown")).isEqualTo(0.86);
    }

    @Test
    @DisplayName("Should treat two empty strings as identical and one empty string as dissimilar")
    void shouldHandleEmptyStrings() {
        assertThat(StringSimilarity.ratio("", "")).isEqualTo(1.0);
        assertThat(StringSimilarity.ratio(null, null)).isEqualTo(1.0);
        assertThat(StringSimilarity.ratio("abc", "")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should be symmetric")
    void shouldBeSymmetric() {
        assertThat(StringSimilarity.ratio("catherine lee", "cate lee"))
                .isEqualTo(StringSimilarity.ratio("cate lee", "catherine lee"));
        assertThat(StringSimilarity.partialRatio("smith", "12 smyth street"))
                .isEqualTo(StringSimilarity.partialRatio("12 smyth street", "smith"));
    }

    @Test
    @DisplayName("Should score a contained substring 1.0 in partial ratio")
    void shouldScoreContainedSubstringAsOne() {
        assertThat(StringSimilarity.partialRatio("12 smith street", "payment 12 smith street parkville"))
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should find the best window for a misspelled name")
    void shouldFindBestWindow() {
        assertThat(StringSimilarity.partialRatio("alice nguyen", "from alice nguyan rent")).isEqualTo(0.92);
    }

    @Test
    @DisplayName("Should score empty partial ratio arguments 0.0")
    void shouldScoreEmptyPartialArgumentsAsZero() {
        assertThat(StringSimilarity.partialRatio("", "anything")).isEqualTo(0.0);
        assertThat(StringSimilarity.partialRatio("anything", null)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should keep partial ratio at least as high as ratio")
    void shouldKeepPartialRatioAtLeastRatio() {
        String a = "45 king road";
        String b = "paid 45 kin rod";
        assertThat(StringSimilarity.partialRatio(a, b)).isGreaterThanOrEqualTo(StringSimilarity.ratio(a, b));
    }
}
