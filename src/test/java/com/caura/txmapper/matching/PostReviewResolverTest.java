package com.caura.txmapper.matching;

import com.caura.txmapper.TestFixtures;
import com.caura.txmapper.config.MatchingProperties;
import com.caura.txmapper.domain.ExtractedPii;
import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.MatchResult;
import com.caura.txmapper.domain.ReviewedTransaction;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.RegistrySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PostReviewResolver Unit Tests")
class PostReviewResolverTest {

    private PostReviewResolver resolver;
    private RegistrySnapshot snapshot;

    @BeforeEach
    void setUp() {
        MatchingProperties properties = TestFixtures.defaultProperties();
        resolver = new PostReviewResolver(TestFixtures.testRegistry(), new ConfidencePolicy(properties), properties);
        snapshot = TestFixtures.testSnapshot();
    }

    @Test
    @DisplayName("Should match extracted email exactly")
    void shouldMatchExtractedEmail() {
        MatchResult result = resolver.resolveExtracted(stripe("T1", null), pii(null, null, null, null, "A@x.com"), snapshot);

        assertThat(result.clientId()).isEqualTo("CL00001");
        assertThat(result.method()).isEqualTo(MatchMethod.EXTRACTED_EMAIL);
        assertThat(result.confidenceScore()).isEqualTo(1.0);
        assertThat(result.requiresReview()).isFalse();
    }

    @Test
    @DisplayName("Should match extracted business number against aged care identifiers")
    void shouldMatchBusinessNumber() {
        MatchResult result = resolver.resolveExtracted(stripe("T1", null), pii(null, null, "123456789", null, null), snapshot);

        assertThat(result.clientId()).isEqualTo("CL00002");
        assertThat(result.method()).isEqualTo(MatchMethod.EXTRACTED_BUSINESS_NUMBER);
        assertThat(result.confidenceScore()).isEqualTo(1.0);
        assertThat(result.explanation()).isEqualTo(new MatchExplanation.BusinessNumber("123456789"));
    }

    @Test
    @DisplayName("Should match extracted phone on digits only")
    void shouldMatchPhone() {
        MatchResult result = resolver.resolveExtracted(stripe("T1", null), pii(null, null, null, "03-9876-5432", null), snapshot);

        assertThat(result.clientId()).isEqualTo("CL00003");
        assertThat(result.method()).isEqualTo(MatchMethod.EXTRACTED_PHONE);
        assertThat(result.confidenceScore()).isEqualTo(0.95);
        assertThat(result.requiresReview()).isFalse();
        assertThat(result.explanation()).isEqualTo(new MatchExplanation.Phone("03-9876-5432", "0398765432"));
    }

    @Test
    @DisplayName("Should match extracted address with the lower post-review minimum")
    void shouldMatchAddressWithLowerMinimum() {
        // "45 Kn Rdd" scores 0.78: below the primary 0.80 minimum, above the post-review 0.70
        MatchResult result = resolver.resolveExtracted(stripe("T1", null), pii(null, "45 Kn Rdd", null, null, null), snapshot);

        assertThat(result.clientId()).isEqualTo("CL00002");
        assertThat(result.method()).isEqualTo(MatchMethod.EXTRACTED_ADDRESS_FUZZY);
        assertThat(result.confidenceScore()).isEqualTo(0.78);
        assertThat(result.requiresReview()).isTrue();
    }

    @Test
    @DisplayName("Should match extracted name with the lower post-review threshold")
    void shouldMatchNameWithLowerThreshold() {
        MatchResult strong = resolver.resolveExtracted(stripe("T1", null), pii("Cathrine Lee", null, null, null, null), snapshot);
        MatchResult weak = resolver.resolveExtracted(stripe("T2", null), pii("Cate Lee", null, null, null, null), snapshot);

        assertThat(strong.method()).isEqualTo(MatchMethod.EXTRACTED_NAME_FUZZY);
        assertThat(strong.clientId()).isEqualTo("CL00003");
        assertThat(strong.confidenceScore()).isEqualTo(0.96);
        assertThat(strong.requiresReview()).isFalse();

        assertThat(weak.clientId()).isEqualTo("CL00003");
        assertThat(weak.confidenceScore()).isEqualTo(0.76);
        assertThat(weak.requiresReview()).isTrue();
    }

    @Test
    @DisplayName("Should skip address and name inputs that are too short")
    void shouldSkipShortInputs() {
        MatchResult result = resolver.resolveExtracted(stripe("T1", null), pii("J", "3052", null, null, null), snapshot);

        assertThat(result.method()).isEqualTo(MatchMethod.NO_MATCH_POST_REVIEW);
        assertThat(result.matchMethod()).isEqualTo("no_match_post_review");
        assertThat(result.matched()).isFalse();
        assertThat(result.requiresReview()).isTrue();
    }

    @Test
    @DisplayName("Should prefer email over phone when both resolve")
    void shouldPreferEmailOverPhone() {
        // Email points at CL00001, phone at CL00003
        MatchResult result = resolver.resolveExtracted(stripe("T1", null),
                pii(null, null, null, "(03) 9876 5432", "a@x.com"), snapshot);

        assertThat(result.method()).isEqualTo(MatchMethod.EXTRACTED_EMAIL);
        assertThat(result.clientId()).isEqualTo("CL00001");
    }

    @Test
    @DisplayName("Should propagate a phone match to another transaction with the same email")
    void shouldPropagateEmailMapping() {
        // Given - T2 comes first; propagation still sees T1's mapping
        ReviewedTransaction t2 = new ReviewedTransaction(stripe("T2", "C3@Y.com"), ExtractedPii.NONE, false, null);
        ReviewedTransaction t1 = new ReviewedTransaction(stripe("T1", "c3@y.com"),
                pii(null, null, null, "(03) 9876 5432", null), false, null);

        // When
        List<MatchResult> results = resolver.resolve(List.of(t2, t1));

        // Then
        MatchResult propagated = results.get(0);
        assertThat(propagated.transactionId()).isEqualTo("T2");
        assertThat(propagated.clientId()).isEqualTo("CL00003");
        assertThat(propagated.matchMethod()).isEqualTo("email_propagated_from_extracted_phone");
        assertThat(propagated.propagatedFrom()).isEqualTo(MatchMethod.EXTRACTED_PHONE);
        assertThat(propagated.confidenceScore()).isEqualTo(0.90);
        assertThat(propagated.requiresReview()).isFalse();
        assertThat(propagated.explanation()).isInstanceOfSatisfying(MatchExplanation.Propagated.class, explanation -> {
            assertThat(explanation.sourceTransactionId()).isEqualTo("T1");
            assertThat(explanation.originalMethod()).isEqualTo(MatchMethod.EXTRACTED_PHONE);
            assertThat(explanation.propagatedFromEmail()).isEqualTo("C3@Y.com");
        });

        assertThat(results.get(1).method()).isEqualTo(MatchMethod.EXTRACTED_PHONE);
    }

    @Test
    @DisplayName("Should keep the first mapping for an email and leave matched rows alone")
    void shouldKeepFirstMappingPerEmail() {
        // Given - T1 and T3 share an email but resolve to different clients
        ReviewedTransaction t1 = new ReviewedTransaction(stripe("T1", "shared@y.com"),
                pii(null, null, null, "0412 345 678", null), false, null);
        ReviewedTransaction t2 = new ReviewedTransaction(stripe("T2", "shared@y.com"), ExtractedPii.NONE, false, null);
        ReviewedTransaction t3 = new ReviewedTransaction(stripe("T3", "shared@y.com"),
                pii(null, null, "123456789", null, null), false, null);

        // When
        List<MatchResult> results = resolver.resolve(List.of(t1, t2, t3));

        // Then
        assertThat(results).extracting(MatchResult::clientId).containsExactly("CL00001", "CL00001", "CL00002");
        assertThat(results.get(2).method()).isEqualTo(MatchMethod.EXTRACTED_BUSINESS_NUMBER);
    }

    @Test
    @DisplayName("Should report previously matched rows and not propagate from them")
    void shouldReportPreviouslyMatched() {
        // Given
        ReviewedTransaction previous = new ReviewedTransaction(stripe("T1", "old@y.com"), ExtractedPii.NONE, true, "CL00005");
        ReviewedTransaction unresolved = new ReviewedTransaction(stripe("T2", "old@y.com"), ExtractedPii.NONE, false, null);
        ReviewedTransaction noEmail = new ReviewedTransaction(stripe("T3", null), ExtractedPii.NONE, false, null);

        // When
        List<MatchResult> results = resolver.resolve(List.of(previous, unresolved, noEmail));

        // Then
        assertThat(results.get(0).method()).isEqualTo(MatchMethod.PREVIOUSLY_MATCHED);
        assertThat(results.get(0).clientId()).isEqualTo("CL00005");
        assertThat(results.get(0).confidenceScore()).isEqualTo(1.0);
        assertThat(results.get(0).requiresReview()).isFalse();
        assertThat(results.get(1).method()).isEqualTo(MatchMethod.NO_MATCH_POST_REVIEW);
        assertThat(results.get(2).method()).isEqualTo(MatchMethod.NO_MATCH_POST_REVIEW);
    }

    @Test
    @DisplayName("Should resolve previously matched rows without a client id from extracted PII")
    void shouldResolvePreviouslyMatchedWithoutClientId() {
        // Given
        ReviewedTransaction withPii = new ReviewedTransaction(stripe("T1", null), pii(null, null, null, null, "a@x.com"), true, null);
        ReviewedTransaction blankId = new ReviewedTransaction(stripe("T2", null), ExtractedPii.NONE, true, "  ");

        // When
        List<MatchResult> results = resolver.resolve(List.of(withPii, blankId));

        // Then
        assertThat(results.get(0).method()).isEqualTo(MatchMethod.EXTRACTED_EMAIL);
        assertThat(results.get(0).clientId()).isEqualTo("CL00001");
        assertThat(results.get(1).method()).isEqualTo(MatchMethod.NO_MATCH_POST_REVIEW);
        assertThat(results.get(1).matched()).isFalse();
        assertThat(results.get(1).clientId()).isNull();
    }

    private static Transaction stripe(String id, String email) {
        return TestFixtures.transaction(id, "stripe", "Payment received thank you", email, null, Map.of());
    }

    private static ExtractedPii pii(String name, String address, String businessNumber, String phone, String email) {
        return new ExtractedPii(name, address, businessNumber, null, phone, email);
    }
}
