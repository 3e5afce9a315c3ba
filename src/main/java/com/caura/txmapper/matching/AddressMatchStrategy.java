package com.caura.txmapper.matching;

import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.RegistrySnapshot;

import java.util.Optional;

/**
 * Address search over the transaction description.
 */
class AddressMatchStrategy implements MatchStrategy {

    private final double minScore;

    AddressMatchStrategy(double minScore) {
        this.minScore = minScore;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.ADDRESS_MATCH;
    }

    @Override
    public Optional<StrategyMatch> attempt(Transaction transaction, RegistrySnapshot registry) {
        return registry.findByAddress(transaction.description(), minScore)
                .map(match -> new StrategyMatch(method(), match.clientId(), match.score(), match.explanation()));
    }
}
