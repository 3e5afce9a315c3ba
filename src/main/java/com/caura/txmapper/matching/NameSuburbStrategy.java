package com.caura.txmapper.matching;

import com.caura.txmapper.config.MatchingProperties;
import com.caura.txmapper.domain.ClientRecord;
import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.RegistrySnapshot;
import com.caura.txmapper.similarity.StringSimilarity;

import java.util.Locale;
import java.util.Optional;

/**
 * Name + suburb matching for manually entered transactions (paper receipts).
 * <p>
 * The importer puts the written name and suburb into platform metadata. The name is compared
 * with every client's full name; a name scoring at least the gate gets a fixed boost when the
 * suburb also matches the client's registry suburb. The best client at or above the name
 * threshold wins.
 */
class NameSuburbStrategy implements MatchStrategy {

    private final MatchingProperties.EnhancedMatching settings;
    private final double nameThreshold;

    NameSuburbStrategy(MatchingProperties.EnhancedMatching settings, double nameThreshold) {
        this.settings = settings;
        this.nameThreshold = nameThreshold;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.NAME_SUBURB;
    }

    @Override
    public Optional<StrategyMatch> attempt(Transaction transaction, RegistrySnapshot registry) {
        if (!settings.getPlatform().equals(transaction.platform())) {
            return Optional.empty();
        }
        String inputName = transaction.metadata(settings.getNameKey());
        if (inputName == null) {
            return Optional.empty();
        }
        String inputSuburb = transaction.metadata(settings.getSuburbKey());
        String name = inputName.trim().toLowerCase(Locale.ROOT);

        BestCandidate best = new BestCandidate();
        for (ClientRecord client : registry.clients()) {
            String fullName = client.fullName();
            if (fullName.isEmpty()) {
                continue;
            }
            double nameScore = StringSimilarity.ratio(name, fullName.toLowerCase(Locale.ROOT));
            if (nameScore < settings.getNameGate()) {
                continue;
            }

            double score = nameScore;
            Double suburbScore = null;
            boolean boosted = false;
            String clientSuburb = client.location().suburb();
            if (inputSuburb != null && clientSuburb != null && !clientSuburb.isBlank()) {
                suburbScore = StringSimilarity.ratio(
                        inputSuburb.trim().toLowerCase(Locale.ROOT),
                        clientSuburb.trim().toLowerCase(Locale.ROOT));
                if (suburbScore >= settings.getSuburbThreshold()) {
                    score = Math.min(1.0, Math.round((nameScore + settings.getSuburbBoost()) * 100.0) / 100.0);
                    boosted = true;
                }
            }

            if (score >= nameThreshold) {
                best.offer(new StrategyMatch(method(), client.clientId(), score, new MatchExplanation.NameSuburb(
                        fullName, inputName, nameScore, clientSuburb, inputSuburb, suburbScore, boosted)));
            }
        }
        return best.result();
    }
}
