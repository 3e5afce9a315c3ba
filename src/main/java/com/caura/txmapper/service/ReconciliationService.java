package com.caura.txmapper.service;

import com.caura.txmapper.domain.MatchResult;
import com.caura.txmapper.domain.PostReviewRequest;
import com.caura.txmapper.domain.ReconciliationRequest;
import com.caura.txmapper.domain.ReconciliationRunEntity;
import com.caura.txmapper.domain.ReconciliationRunResponse;
import com.caura.txmapper.domain.ReconciliationSummary;
import com.caura.txmapper.domain.ResolveResponse;
import com.caura.txmapper.domain.RunStatus;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.exception.RegistryLoadException;
import com.caura.txmapper.matching.ConfidencePolicy;
import com.caura.txmapper.matching.IdentityResolver;
import com.caura.txmapper.matching.PostReviewResolver;
import com.caura.txmapper.util.RunIdGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Service for orchestrating reconciliation runs.
 * Responsibilities:
 * - Generate a run id for each run
 * - Persist the run as PENDING, then SUCCESS with its summary or FAILED with the error
 * - Delegate matching to IdentityResolver or PostReviewResolver
 * - Build the run summary with the same banding used for review decisions
 */
@Service
@Slf4j
public class ReconciliationService {

    static final String POST_REVIEW_SUFFIX = "_post_review";
    static final int MAX_ERROR_LENGTH = 2000;

    private final IdentityResolver identityResolver;
    private final PostReviewResolver postReviewResolver;
    private final ConfidencePolicy confidencePolicy;
    private final ReconciliationRunRepository runRepository;
    private final RunIdGenerator runIdGenerator;
    private final ObjectMapper objectMapper;

    public ReconciliationService(IdentityResolver identityResolver,
                                 PostReviewResolver postReviewResolver,
                                 ConfidencePolicy confidencePolicy,
                                 ReconciliationRunRepository runRepository,
                                 RunIdGenerator runIdGenerator,
                                 ObjectMapper objectMapper) {
        this.identityResolver = identityResolver;
        this.postReviewResolver = postReviewResolver;
        this.confidencePolicy = confidencePolicy;
        this.runRepository = runRepository;
        this.runIdGenerator = runIdGenerator;
        this.objectMapper = objectMapper;
    }

    /**
     * Resolves every transaction of an imported batch and records the run.
     * Registry failures are recorded and rethrown; any other failure yields a FAILED response.
     *
     * @param request platform, source and transactions
     * @return run response with summary and per-transaction results
     */
    @Transactional(noRollbackFor = RegistryLoadException.class)
    public ReconciliationRunResponse reconcile(ReconciliationRequest request) {
        return run(request.platform(), request.sourceIdentifier(), request.transactions().size(),
                () -> identityResolver.resolveBatch(request.transactions()));
    }

    /**
     * Re-resolves a reviewed batch using reviewer-extracted PII, followed by email propagation.
     * Recorded under the platform {@code <platform>_post_review}.
     */
    @Transactional(noRollbackFor = RegistryLoadException.class)
    public ReconciliationRunResponse reconcilePostReview(PostReviewRequest request) {
        return run(request.platform() + POST_REVIEW_SUFFIX, request.sourceIdentifier(), request.transactions().size(),
                () -> postReviewResolver.resolve(request.transactions()));
    }

    /**
     * Resolves a single transaction without recording a run.
     */
    public ResolveResponse resolve(Transaction transaction) {
        MatchResult result = identityResolver.resolve(transaction);
        return new ResolveResponse(result, confidencePolicy.band(result.confidenceScore()));
    }

    /**
     * Retrieves a run by id. SUCCESS runs carry their stored summary.
     *
     * @param runId the run id to look up
     * @return optional run response
     */
    @Transactional(readOnly = true)
    public Optional<ReconciliationRunResponse> getRunById(String runId) {
        log.debug("Retrieving reconciliation run: {}", runId);

        return runRepository.findById(runId).map(entity -> {
            if (RunStatus.SUCCESS.name().equals(entity.getStatus()) && entity.getSummaryJson() != null) {
                try {
                    ReconciliationSummary summary =
                            objectMapper.readValue(entity.getSummaryJson(), ReconciliationSummary.class);
                    return ReconciliationRunResponse.success(summary);
                } catch (JsonProcessingException e) {
                    log.error("Error parsing stored summary for {}", runId, e);
                    throw new IllegalStateException("Error retrieving reconciliation run " + runId, e);
                }
            }
            return new ReconciliationRunResponse(runId, entity.getStatus(), entity.getCreatedAt(),
                    null, entity.getErrorMessage());
        });
    }

    /**
     * Lists the runs of one platform, newest first, without their results.
     */
    @Transactional(readOnly = true)
    public List<ReconciliationRunResponse> listRuns(String platform) {
        return runRepository.findByPlatformOrderByCreatedAtDesc(platform).stream()
                .map(entity -> new ReconciliationRunResponse(entity.getRunId(), entity.getStatus(),
                        entity.getCreatedAt(), null, entity.getErrorMessage()))
                .toList();
    }

    private ReconciliationRunResponse run(String platform,
                                          String sourceIdentifier,
                                          int transactionCount,
                                          Supplier<List<MatchResult>> resolution) {
        String runId = runIdGenerator.generate(platform);
        log.info("Starting reconciliation run {} for {} transactions from {}",
                runId, transactionCount, sourceIdentifier != null ? sourceIdentifier : platform);
        persistPending(runId, platform, sourceIdentifier);

        long started = System.nanoTime();
        try {
            List<MatchResult> results = resolution.get();
            double processingTime = Math.round((System.nanoTime() - started) / 1_000_000.0) / 1000.0;

            ReconciliationSummary summary = ReconciliationSummary.from(
                    runId, platform, sourceIdentifier, results, processingTime, confidencePolicy::band);
            persistSuccess(summary);
            logStatistics(summary);
            return ReconciliationRunResponse.success(summary);

        } catch (RegistryLoadException ex) {
            log.error("Reconciliation run {} aborted: client registry unavailable", runId, ex);
            persistFailure(runId, ex.getMessage());
            throw ex;
        } catch (Exception ex) {
            log.error("Error in reconciliation run: {}", runId, ex);
            persistFailure(runId, ex.getMessage());
            return ReconciliationRunResponse.failed(runId, OffsetDateTime.now(), ex.getMessage());
        }
    }

    private void persistPending(String runId, String platform, String sourceIdentifier) {
        ReconciliationRunEntity entity = ReconciliationRunEntity.builder()
                .runId(runId)
                .platform(platform)
                .sourceIdentifier(sourceIdentifier)
                .status(RunStatus.PENDING.name())
                .createdAt(OffsetDateTime.now())
                .build();
        runRepository.save(entity);
        log.debug("Persisted pending run: {}", runId);
    }

    private void persistSuccess(ReconciliationSummary summary) {
        String summaryJson;
        try {
            summaryJson = objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error serializing summary of run " + summary.runId(), e);
        }

        ReconciliationRunEntity entity = runRepository.findById(summary.runId())
                .orElseThrow(() -> new IllegalStateException("Run disappeared: " + summary.runId()));
        entity.setStatus(RunStatus.SUCCESS.name());
        entity.setTotalTransactions(summary.totalTransactions());
        entity.setMatchedTransactions(summary.matchedTransactions());
        entity.setRequiresReview(summary.requiresReview());
        entity.setProcessingTime(summary.processingTime());
        entity.setSummaryJson(summaryJson);
        runRepository.save(entity);
        log.debug("Updated run {} with status: SUCCESS", summary.runId());
    }

    private void persistFailure(String runId, String errorMessage) {
        runRepository.findById(runId).ifPresent(entity -> {
            entity.setStatus(RunStatus.FAILED.name());
            entity.setErrorMessage(truncate(errorMessage));
            runRepository.save(entity);
            log.debug("Updated run {} with status: FAILED", runId);
        });
    }

    private void logStatistics(ReconciliationSummary summary) {
        log.info("Reconciliation run {} complete: {}/{} matched ({}%), {} require review, {}s",
                summary.runId(),
                summary.matchedTransactions(),
                summary.totalTransactions(),
                Math.round(summary.matchRate() * 1000) / 10.0,
                summary.requiresReview(),
                summary.processingTime());
        log.info("Confidence distribution for {}: {}", summary.runId(), summary.confidenceDistribution());
        log.info("Match methods for {}: {}", summary.runId(), summary.matchMethodBreakdown());
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
