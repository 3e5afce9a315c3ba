package com.caura.txmapper.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Objects;

/**
 * Outcome of resolving one transaction. Immutable; created once per transaction.
 * The confidence band is not part of the result: it is always recomputed from
 * {@link #confidenceScore()} by {@code ConfidencePolicy}.
 */
@Schema(description = "Match decision for a single transaction")
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record MatchResult(

    @Schema(description = "Transaction identifier", example = "ch_3PbX9s")
    String transactionId,

    @Schema(description = "Matched registry client, null when nothing matched", example = "CL00042")
    String clientId,

    @Schema(description = "Similarity score in [0.0, 1.0]", example = "0.92")
    double confidenceScore,

    @Schema(description = "Strategy that produced the result")
    MatchMethod method,

    @Schema(description = "Originating method for propagated matches")
    MatchMethod propagatedFrom,

    @Schema(description = "Strategy-specific audit details")
    MatchExplanation explanation,

    @Schema(description = "Whether a client was matched")
    boolean matched,

    @Schema(description = "Whether a human should verify the match")
    boolean requiresReview
) {

    public MatchResult {
        Objects.requireNonNull(method, "method");
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("Confidence score out of range: " + confidenceScore);
        }
        explanation = explanation != null ? explanation : MatchExplanation.None.NO_STRATEGY_MATCHED;
    }

    /**
     * Unmatched result: score 0.0, review required.
     */
    public static MatchResult noMatch(String transactionId, MatchMethod method) {
        return new MatchResult(transactionId, null, 0.0, method, null,
                MatchExplanation.None.NO_STRATEGY_MATCHED, false, true);
    }

    public static MatchResult noMatch(String transactionId) {
        return noMatch(transactionId, MatchMethod.NO_MATCH);
    }

    /**
     * Method name as reported to consumers, e.g. {@code exact_email} or
     * {@code email_propagated_from_extracted_phone}.
     */
    @JsonProperty("matchMethod")
    @Schema(description = "Method name as reported", example = "exact_email")
    public String matchMethod() {
        return method.wireName(propagatedFrom);
    }
}
