package com.caura.txmapper.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Reviewed report to re-resolve with manually extracted PII.
 */
@Schema(description = "Request to re-resolve a reviewed batch using extracted PII")
public record PostReviewRequest(

    @Schema(description = "Platform of the original run", example = "stripe")
    @NotBlank(message = "Platform is required")
    String platform,

    @Schema(description = "Reviewed report the batch came from", example = "stripe_20250728_123013_stripe_reconciliation.xlsx")
    String sourceIdentifier,

    @NotEmpty(message = "At least one transaction is required")
    @Valid
    List<ReviewedTransaction> transactions
) {}
