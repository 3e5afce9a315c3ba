package com.caura.txmapper.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Batch of imported transactions from one source to reconcile against the registry.
 */
@Schema(description = "Request to reconcile a batch of transactions")
public record ReconciliationRequest(

    @Schema(description = "Source platform", example = "stripe")
    @NotBlank(message = "Platform is required")
    String platform,

    @Schema(description = "File path or endpoint the batch came from", example = "exports/stripe_2025_07.csv")
    String sourceIdentifier,

    @NotEmpty(message = "At least one transaction is required")
    @Valid
    List<Transaction> transactions
) {}
