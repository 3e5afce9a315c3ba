package com.caura.txmapper.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;

/**
 * Reconciliation run as returned to API clients.
 */
@Schema(description = "Reconciliation run status and summary")
public record ReconciliationRunResponse(

    @Schema(description = "Run identifier", example = "stripe_20250728_123013_3f9a1c2e")
    String runId,

    @Schema(description = "Processing status", example = "SUCCESS")
    String status,

    @Schema(description = "Timestamp when the run was processed")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX")
    OffsetDateTime processedAt,

    @Schema(description = "Run statistics and results; absent unless status is SUCCESS")
    ReconciliationSummary summary,

    @Schema(description = "Error message if status is FAILED")
    String errorMessage
) {

    public static ReconciliationRunResponse success(ReconciliationSummary summary) {
        return new ReconciliationRunResponse(summary.runId(), RunStatus.SUCCESS.name(),
                summary.runDate(), summary, null);
    }

    public static ReconciliationRunResponse failed(String runId, OffsetDateTime processedAt, String errorMessage) {
        return new ReconciliationRunResponse(runId, RunStatus.FAILED.name(), processedAt, null, errorMessage);
    }
}
