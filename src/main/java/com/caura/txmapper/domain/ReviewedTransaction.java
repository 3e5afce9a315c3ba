package com.caura.txmapper.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Transaction from a reviewed reconciliation report, with the reviewer's extracted PII.
 */
@Schema(description = "Transaction with reviewer-extracted PII")
public record ReviewedTransaction(

    @NotNull(message = "Transaction is required")
    @Valid
    Transaction transaction,

    ExtractedPii pii,

    @Schema(description = "Whether the original run already matched this transaction")
    boolean previouslyMatched,

    @Schema(description = "Client matched in the original run, if known", example = "CL00042")
    String previousClientId
) {

    public ReviewedTransaction {
        pii = pii != null ? pii : ExtractedPii.NONE;
    }
}
