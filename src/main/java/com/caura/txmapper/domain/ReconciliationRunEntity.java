package com.caura.txmapper.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Persisted reconciliation run. The full summary, results included, is kept as JSON.
 */
@Entity
@Table(name = "reconciliation_runs")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationRunEntity {

    @Id
    @Column(name = "run_id", length = 128)
    private String runId;

    @Column(name = "platform", nullable = false, length = 64)
    private String platform;

    @Column(name = "source_identifier", length = 512)
    private String sourceIdentifier;

    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "total_transactions")
    private Integer totalTransactions;

    @Column(name = "matched_transactions")
    private Integer matchedTransactions;

    @Column(name = "requires_review")
    private Integer requiresReview;

    @Column(name = "processing_time")
    private Double processingTime;

    @Lob
    @Column(name = "summary_json")
    private String summaryJson;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
