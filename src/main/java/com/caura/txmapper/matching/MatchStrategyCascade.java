package com.caura.txmapper.matching;

import com.caura.txmapper.config.MatchingProperties;
import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.RegistrySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Ordered matching strategies. The first strategy that yields a candidate decides the result;
 * strategies are never combined.
 * <p>
 * Order: exact platform identifier, exact email, name + suburb for manual entries, fuzzy name
 * in description, address in description. Cheap authoritative lookups run before the
 * registry-wide fuzzy scans.
 */
@Component
@Slf4j
public class MatchStrategyCascade {

    private final List<MatchStrategy> strategies;

    public MatchStrategyCascade(MatchingProperties properties) {
        double nameThreshold = properties.getFuzzyMatching().getNameThreshold();
        this.strategies = List.of(
                new ExactClientIdStrategy(),
                new ExactEmailStrategy(),
                new NameSuburbStrategy(properties.getEnhancedMatching(), nameThreshold),
                new FuzzyNameStrategy(nameThreshold),
                new AddressMatchStrategy(properties.getAddressMatching().getMinScore())
        );
    }

    /**
     * Runs the strategies in priority order against one snapshot.
     *
     * @return the first candidate found, or empty when no strategy matched
     */
    public Optional<StrategyMatch> firstMatch(Transaction transaction, RegistrySnapshot registry) {
        for (MatchStrategy strategy : strategies) {
            Optional<StrategyMatch> match = strategy.attempt(transaction, registry);
            if (match.isPresent()) {
                log.debug("Transaction {} matched by {}: client={}, score={}",
                        transaction.transactionId(), strategy.method().code(),
                        match.get().clientId(), match.get().score());
                return match;
            }
        }
        log.debug("Transaction {} matched no strategy", transaction.transactionId());
        return Optional.empty();
    }

    /**
     * Strategy methods in the order they are tried.
     */
    public List<MatchMethod> order() {
        return strategies.stream().map(MatchStrategy::method).toList();
    }
}
