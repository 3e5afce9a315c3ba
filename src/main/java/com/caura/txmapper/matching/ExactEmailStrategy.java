package com.caura.txmapper.matching;

import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.RegistrySnapshot;

import java.util.Optional;

/**
 * Case-insensitive exact lookup of the transaction email.
 */
class ExactEmailStrategy implements MatchStrategy {

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT_EMAIL;
    }

    @Override
    public Optional<StrategyMatch> attempt(Transaction transaction, RegistrySnapshot registry) {
        String email = transaction.email();
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return registry.findByEmail(email)
                .map(clientId -> new StrategyMatch(method(), clientId, 1.0, new MatchExplanation.Email(email)));
    }
}
