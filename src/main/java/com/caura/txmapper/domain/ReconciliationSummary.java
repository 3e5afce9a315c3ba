package com.caura.txmapper.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleFunction;

/**
 * Aggregated view of one reconciliation run: counts, confidence distribution and
 * method breakdown over the run's match results.
 */
@Schema(description = "Reconciliation run statistics and match results")
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReconciliationSummary(

    @Schema(description = "Run identifier", example = "stripe_20250728_123013_3f9a1c2e")
    String runId,

    @Schema(description = "Source platform", example = "stripe")
    String platform,

    @Schema(description = "File path or endpoint the transactions came from")
    String sourceIdentifier,

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX")
    OffsetDateTime runDate,

    int totalTransactions,

    int matchedTransactions,

    int unmatchedTransactions,

    int requiresReview,

    @Schema(description = "Result counts per confidence band")
    Map<ConfidenceBand, Integer> confidenceDistribution,

    @Schema(description = "Result counts per match method")
    Map<String, Integer> matchMethodBreakdown,

    @Schema(description = "Processing time in seconds", example = "1.84")
    double processingTime,

    List<MatchResult> matchResults
) {

    /**
     * Builds a summary from resolver output.
     *
     * @param banding band of a score; the same function that drove review decisions
     */
    public static ReconciliationSummary from(String runId,
                                             String platform,
                                             String sourceIdentifier,
                                             List<MatchResult> results,
                                             double processingTime,
                                             DoubleFunction<ConfidenceBand> banding) {
        int matched = 0;
        int review = 0;
        Map<ConfidenceBand, Integer> distribution = new EnumMap<>(ConfidenceBand.class);
        for (ConfidenceBand band : ConfidenceBand.values()) {
            distribution.put(band, 0);
        }
        Map<String, Integer> methods = new LinkedHashMap<>();

        for (MatchResult result : results) {
            if (result.matched()) {
                matched++;
            }
            if (result.requiresReview()) {
                review++;
            }
            distribution.merge(banding.apply(result.confidenceScore()), 1, Integer::sum);
            methods.merge(result.matchMethod(), 1, Integer::sum);
        }

        return new ReconciliationSummary(
                runId,
                platform,
                sourceIdentifier,
                OffsetDateTime.now(),
                results.size(),
                matched,
                results.size() - matched,
                review,
                Collections.unmodifiableMap(distribution),
                Collections.unmodifiableMap(methods),
                processingTime,
                List.copyOf(results)
        );
    }

    /**
     * Matched share of all transactions, 0.0 for an empty run.
     */
    public double matchRate() {
        return totalTransactions > 0 ? (double) matchedTransactions / totalTransactions : 0.0;
    }
}
