package com.caura.txmapper.matching;

import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.RegistrySnapshot;

import java.util.Optional;

/**
 * One step of the matching cascade.
 * Implementations are stateless and read only the given snapshot.
 */
public interface MatchStrategy {

    MatchMethod method();

    /**
     * @return a candidate that clears this strategy's threshold, or empty when the strategy
     *         does not apply to the transaction or finds nothing
     */
    Optional<StrategyMatch> attempt(Transaction transaction, RegistrySnapshot registry);
}
