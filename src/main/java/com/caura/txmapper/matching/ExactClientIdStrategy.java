package com.caura.txmapper.matching;

import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.RegistrySnapshot;

import java.util.Optional;

/**
 * Exact lookup of the transaction's platform client identifier.
 */
class ExactClientIdStrategy implements MatchStrategy {

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT_CLIENT_ID;
    }

    @Override
    public Optional<StrategyMatch> attempt(Transaction transaction, RegistrySnapshot registry) {
        String identifier = transaction.clientIdentifier();
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        return registry.findByPlatformIdentifier(transaction.platform(), identifier)
                .map(clientId -> new StrategyMatch(method(), clientId, 1.0,
                        new MatchExplanation.Identifier(transaction.platform(), identifier)));
    }
}
