package com.caura.txmapper.controller;

import com.caura.txmapper.domain.PostReviewRequest;
import com.caura.txmapper.domain.ReconciliationRequest;
import com.caura.txmapper.domain.ReconciliationRunResponse;
import com.caura.txmapper.domain.ResolveResponse;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.service.ReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for reconciliation endpoints.
 * Provides APIs for batch reconciliation, single-transaction resolution,
 * post-review reconciliation and retrieval of past runs.
 */
@RestController
@RequestMapping("/api/v1/reconcile")
@Tag(name = "Reconciliation", description = "Transaction to client reconciliation APIs")
@Slf4j
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    /**
     * Reconciles a batch of imported transactions.
     */
    @PostMapping
    @Operation(
            summary = "Reconcile transactions",
            description = "Resolves each transaction to a registry client through the matching cascade. " +
                         "The run is recorded under a generated run id together with its summary."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Run processed; see status for the outcome",
                    content = @Content(schema = @Schema(implementation = ReconciliationRunResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid request payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Client registry unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<ReconciliationRunResponse> reconcile(
            @Parameter(description = "Platform, source and transactions to reconcile", required = true)
            @Valid @RequestBody ReconciliationRequest request) {

        log.info("Received reconciliation request: platform={}, transactions={}",
                request.platform(), request.transactions().size());

        return ResponseEntity.ok(reconciliationService.reconcile(request));
    }

    /**
     * Resolves a single transaction without recording a run.
     */
    @PostMapping("/resolve")
    @Operation(
            summary = "Resolve one transaction",
            description = "Runs the matching cascade for one transaction and returns the decision with its confidence band"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Match decision, including unmatched results",
                    content = @Content(schema = @Schema(implementation = ResolveResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid transaction",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<ResolveResponse> resolve(
            @Parameter(description = "Transaction to resolve", required = true)
            @Valid @RequestBody Transaction transaction) {

        log.debug("Resolving transaction {}", transaction.transactionId());

        return ResponseEntity.ok(reconciliationService.resolve(transaction));
    }

    /**
     * Re-resolves reviewed transactions using reviewer-extracted PII.
     */
    @PostMapping("/post-review")
    @Operation(
            summary = "Post-review reconciliation",
            description = "Resolves reviewed transactions from extracted email, business number, phone, " +
                         "address and name, then propagates email mappings to unresolved transactions."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Run processed; see status for the outcome",
                    content = @Content(schema = @Schema(implementation = ReconciliationRunResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid request payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<ReconciliationRunResponse> reconcilePostReview(
            @Parameter(description = "Reviewed transactions with extracted PII", required = true)
            @Valid @RequestBody PostReviewRequest request) {

        log.info("Received post-review request: platform={}, transactions={}",
                request.platform(), request.transactions().size());

        return ResponseEntity.ok(reconciliationService.reconcilePostReview(request));
    }

    /**
     * Retrieves a reconciliation run by id.
     */
    @GetMapping("/{runId}")
    @Operation(
            summary = "Get run by ID",
            description = "Retrieves a previously processed reconciliation run"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Run found",
                    content = @Content(schema = @Schema(implementation = ReconciliationRunResponse.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Run not found"
            )
    })
    public ResponseEntity<ReconciliationRunResponse> getRunById(
            @Parameter(description = "Run id", example = "stripe_20250728_123013_3f9a1c2e")
            @PathVariable String runId) {

        log.debug("Retrieving reconciliation run: {}", runId);

        return reconciliationService.getRunById(runId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Lists the runs of a platform.
     */
    @GetMapping
    @Operation(
            summary = "List runs",
            description = "Lists the runs of one platform, newest first, without per-transaction results"
    )
    @ApiResponse(
            responseCode = "200",
            description = "Runs of the platform"
    )
    public ResponseEntity<List<ReconciliationRunResponse>> listRuns(
            @Parameter(description = "Source platform", example = "stripe")
            @RequestParam String platform) {

        return ResponseEntity.ok(reconciliationService.listRuns(platform));
    }
}
