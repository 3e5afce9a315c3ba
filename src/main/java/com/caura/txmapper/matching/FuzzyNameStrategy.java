package com.caura.txmapper.matching;

import com.caura.txmapper.domain.ClientRecord;
import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.RegistrySnapshot;
import com.caura.txmapper.similarity.StringSimilarity;

import java.util.Locale;
import java.util.Optional;

/**
 * Searches the free-text description for client names.
 * A full name contained verbatim scores 1.0; otherwise the partial ratio of name against
 * description is used.
 */
class FuzzyNameStrategy implements MatchStrategy {

    private final double nameThreshold;

    FuzzyNameStrategy(double nameThreshold) {
        this.nameThreshold = nameThreshold;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.FUZZY_NAME;
    }

    @Override
    public Optional<StrategyMatch> attempt(Transaction transaction, RegistrySnapshot registry) {
        String description = transaction.description();
        if (description == null || description.isBlank()) {
            return Optional.empty();
        }
        String haystack = description.toLowerCase(Locale.ROOT);

        BestCandidate best = new BestCandidate();
        for (ClientRecord client : registry.clients()) {
            String fullName = client.fullName().toLowerCase(Locale.ROOT);
            if (fullName.isEmpty()) {
                continue;
            }
            boolean contained = haystack.contains(fullName);
            double score = contained ? 1.0 : StringSimilarity.partialRatio(fullName, haystack);
            if (score >= nameThreshold) {
                best.offer(new StrategyMatch(method(), client.clientId(), score,
                        new MatchExplanation.Name(client.fullName(), description, contained, score)));
            }
        }
        return best.result();
    }
}
