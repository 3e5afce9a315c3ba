package com.caura.txmapper.domain;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Single-transaction resolution with its confidence band.
 */
@Schema(description = "Match decision for one transaction")
public record ResolveResponse(

    MatchResult result,

    @Schema(description = "Band derived from the confidence score", example = "high")
    ConfidenceBand confidenceBand
) {}
