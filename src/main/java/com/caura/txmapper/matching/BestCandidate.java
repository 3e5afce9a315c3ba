package com.caura.txmapper.matching;

import java.util.Optional;

/**
 * Keeps the best-scoring candidate of a registry scan.
 * Equal scores go to the smaller client id, so the outcome does not depend on iteration order.
 */
final class BestCandidate {

    private StrategyMatch best;

    void offer(StrategyMatch candidate) {
        if (best == null
                || candidate.score() > best.score()
                || (candidate.score() == best.score() && candidate.clientId().compareTo(best.clientId()) < 0)) {
            best = candidate;
        }
    }

    Optional<StrategyMatch> result() {
        return Optional.ofNullable(best);
    }
}
