package com.caura.txmapper.matching;

import com.caura.txmapper.config.MatchingProperties;
import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.MatchResult;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.ClientRegistry;
import com.caura.txmapper.registry.RegistrySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves transactions to registry clients.
 * Responsibilities:
 * - Run the strategy cascade against the active registry snapshot
 * - Apply confidence banding and the review policy
 * - Resolve batches in parallel while preserving input order
 */
@Service
@Slf4j
public class IdentityResolver {

    private final ClientRegistry clientRegistry;
    private final MatchStrategyCascade cascade;
    private final ConfidencePolicy confidencePolicy;
    private final int parallelism;

    public IdentityResolver(ClientRegistry clientRegistry,
                            MatchStrategyCascade cascade,
                            ConfidencePolicy confidencePolicy,
                            MatchingProperties properties) {
        this.clientRegistry = clientRegistry;
        this.cascade = cascade;
        this.confidencePolicy = confidencePolicy;
        this.parallelism = properties.getBatch().getParallelism();
    }

    /**
     * Resolves a single transaction. Never fails for an unmatched or ambiguous transaction:
     * those come back as a normal result with {@code matched = false} or {@code requiresReview = true}.
     */
    public MatchResult resolve(Transaction transaction) {
        Objects.requireNonNull(transaction, "transaction");
        return resolve(transaction, clientRegistry.load());
    }

    /**
     * Resolves against an explicit snapshot.
     */
    public MatchResult resolve(Transaction transaction, RegistrySnapshot registry) {
        Optional<StrategyMatch> match = cascade.firstMatch(transaction, registry);
        if (match.isEmpty()) {
            return MatchResult.noMatch(transaction.transactionId());
        }
        StrategyMatch candidate = match.get();
        return new MatchResult(
                transaction.transactionId(),
                candidate.clientId(),
                candidate.score(),
                candidate.method(),
                null,
                candidate.explanation(),
                true,
                confidencePolicy.requiresReview(candidate.method(), candidate.score())
        );
    }

    /**
     * Resolves many transactions. The output has one result per input, in input order.
     * The whole batch sees a single registry snapshot, even if a reload happens meanwhile.
     * A transaction whose resolution fails unexpectedly is reported as unmatched.
     *
     * @throws IllegalArgumentException if the list contains null elements
     */
    public List<MatchResult> resolveBatch(List<Transaction> transactions) {
        if (transactions.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Transaction batch contains null entries");
        }
        if (transactions.isEmpty()) {
            return List.of();
        }

        RegistrySnapshot registry = clientRegistry.load();
        log.info("Resolving batch of {} transactions against {} clients", transactions.size(), registry.size());

        List<MatchResult> results = resolveAll(transactions, registry)
                .collectList()
                .block();

        if (results == null) {
            throw new IllegalStateException("Batch resolution produced no results");
        }
        log.info("Completed batch resolution: {}/{} matched, {} require review",
                results.stream().filter(MatchResult::matched).count(),
                results.size(),
                results.stream().filter(MatchResult::requiresReview).count());
        return results;
    }

    /**
     * Resolves on the parallel scheduler, at most {@code parallelism} at a time, emitting in input order.
     */
    Flux<MatchResult> resolveAll(List<Transaction> transactions, RegistrySnapshot registry) {
        return Flux.fromIterable(transactions)
                .flatMapSequential(tx -> resolveItem(tx, registry), parallelism);
    }

    private Mono<MatchResult> resolveItem(Transaction transaction, RegistrySnapshot registry) {
        return Mono.fromCallable(() -> resolve(transaction, registry))
                .subscribeOn(Schedulers.parallel())
                .onErrorResume(ex -> {
                    log.error("Resolution of transaction {} failed: {}", transaction.transactionId(), ex.getMessage(), ex);
                    return Mono.just(new MatchResult(transaction.transactionId(), null, 0.0,
                            MatchMethod.NO_MATCH, null,
                            new MatchExplanation.None("Resolution failed: " + ex.getMessage()), false, true));
                });
    }
}
