package com.caura.txmapper.matching;

import com.caura.txmapper.config.MatchingProperties;
import com.caura.txmapper.domain.ClientRecord;
import com.caura.txmapper.domain.ExtractedPii;
import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchMethod;
import com.caura.txmapper.domain.MatchResult;
import com.caura.txmapper.domain.ReviewedTransaction;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.AddressMatch;
import com.caura.txmapper.registry.ClientRegistry;
import com.caura.txmapper.registry.RegistrySnapshot;
import com.caura.txmapper.similarity.StringSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Secondary resolution of transactions a reviewer has annotated with extracted PII.
 * <p>
 * Runs in two phases over the whole batch:
 * <ol>
 *   <li>each unmatched transaction is resolved from its extracted fields: email, business number,
 *       phone, address (fuzzy), name (fuzzy), in that order</li>
 *   <li>every transaction email that phase 1 tied to a client is propagated to the transactions
 *       still unresolved that carry the same email</li>
 * </ol>
 * Propagation needs the mappings of the complete batch, so phase 2 starts only after phase 1 finishes.
 */
@Service
@Slf4j
public class PostReviewResolver {

    static final int MIN_NAME_LENGTH = 2;

    private final ClientRegistry clientRegistry;
    private final ConfidencePolicy confidencePolicy;
    private final MatchingProperties.PostReview settings;

    public PostReviewResolver(ClientRegistry clientRegistry,
                              ConfidencePolicy confidencePolicy,
                              MatchingProperties properties) {
        this.clientRegistry = clientRegistry;
        this.confidencePolicy = confidencePolicy;
        this.settings = properties.getPostReview();
    }

    /**
     * Resolves a reviewed batch. One result per input, in input order.
     */
    public List<MatchResult> resolve(List<ReviewedTransaction> reviewed) {
        if (reviewed.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Reviewed batch contains null entries");
        }
        RegistrySnapshot registry = clientRegistry.load();
        log.info("Post-review resolution of {} transactions", reviewed.size());

        List<MatchResult> results = new ArrayList<>(reviewed.size());
        Map<String, EmailMapping> emailMappings = new HashMap<>();

        for (ReviewedTransaction item : reviewed) {
            Transaction tx = item.transaction();
            if (item.previouslyMatched()) {
                if (StringUtils.hasText(item.previousClientId())) {
                    results.add(new MatchResult(tx.transactionId(), item.previousClientId(), 1.0,
                            MatchMethod.PREVIOUSLY_MATCHED, null, null, true, false));
                    continue;
                }
                log.warn("Transaction {} flagged as previously matched without a client id, resolving from extracted PII",
                        tx.transactionId());
            }

            MatchResult result = resolveExtracted(tx, item.pii(), registry);
            if (result.matched() && StringUtils.hasText(tx.email())) {
                // First mapping for an email wins.
                emailMappings.putIfAbsent(emailKey(tx.email()), new EmailMapping(tx.transactionId(), result));
            }
            results.add(result);
        }

        log.info("Found {} email mappings, applying to unresolved transactions", emailMappings.size());

        int propagated = 0;
        for (int i = 0; i < results.size(); i++) {
            MatchResult current = results.get(i);
            Transaction tx = reviewed.get(i).transaction();
            if (current.matched() || !StringUtils.hasText(tx.email())) {
                continue;
            }
            EmailMapping mapping = emailMappings.get(emailKey(tx.email()));
            if (mapping != null) {
                results.set(i, propagate(tx, mapping));
                propagated++;
            }
        }

        log.info("Post-review resolution complete: {}/{} matched, {} by email propagation",
                results.stream().filter(MatchResult::matched).count(), results.size(), propagated);
        return results;
    }

    /**
     * Resolves one transaction from reviewer-extracted fields, first hit wins.
     */
    public MatchResult resolveExtracted(Transaction transaction, ExtractedPii pii, RegistrySnapshot registry) {
        String txId = transaction.transactionId();

        if (StringUtils.hasText(pii.email())) {
            Optional<String> clientId = registry.findByEmail(pii.email());
            if (clientId.isPresent()) {
                return exact(txId, clientId.get(), 1.0, MatchMethod.EXTRACTED_EMAIL,
                        new MatchExplanation.Email(pii.email()));
            }
        }

        if (StringUtils.hasText(pii.businessNumber())) {
            Optional<String> clientId = registry.findByPlatformAttribute(
                    settings.getBusinessNumberPlatform(), settings.getBusinessNumberKey(), pii.businessNumber());
            if (clientId.isPresent()) {
                return exact(txId, clientId.get(), 1.0, MatchMethod.EXTRACTED_BUSINESS_NUMBER,
                        new MatchExplanation.BusinessNumber(pii.businessNumber().trim()));
            }
        }

        if (StringUtils.hasText(pii.phone())) {
            Optional<String> clientId = registry.findByPhone(pii.phone());
            if (clientId.isPresent()) {
                return exact(txId, clientId.get(), settings.getPhoneConfidence(), MatchMethod.EXTRACTED_PHONE,
                        new MatchExplanation.Phone(pii.phone(), pii.phone().replaceAll("\\D", "")));
            }
        }

        if (StringUtils.hasText(pii.address())) {
            Optional<AddressMatch> address = registry.findByAddress(pii.address(), settings.getAddressMinScore());
            if (address.isPresent()) {
                return fuzzy(txId, address.get().clientId(), address.get().score(),
                        MatchMethod.EXTRACTED_ADDRESS_FUZZY, address.get().explanation());
            }
        }

        if (pii.name() != null && pii.name().trim().length() >= MIN_NAME_LENGTH) {
            Optional<StrategyMatch> name = bestName(pii.name(), registry);
            if (name.isPresent()) {
                return fuzzy(txId, name.get().clientId(), name.get().score(),
                        MatchMethod.EXTRACTED_NAME_FUZZY, name.get().explanation());
            }
        }

        return MatchResult.noMatch(txId, MatchMethod.NO_MATCH_POST_REVIEW);
    }

    private Optional<StrategyMatch> bestName(String extractedName, RegistrySnapshot registry) {
        String name = extractedName.trim().toLowerCase(Locale.ROOT);
        BestCandidate best = new BestCandidate();
        for (ClientRecord client : registry.clients()) {
            String fullName = client.fullName();
            if (fullName.isEmpty()) {
                continue;
            }
            double score = StringSimilarity.ratio(name, fullName.toLowerCase(Locale.ROOT));
            if (score >= settings.getNameThreshold()) {
                best.offer(new StrategyMatch(MatchMethod.EXTRACTED_NAME_FUZZY, client.clientId(), score,
                        new MatchExplanation.Name(fullName, extractedName, false, score)));
            }
        }
        return best.result();
    }

    private MatchResult propagate(Transaction tx, EmailMapping mapping) {
        MatchResult source = mapping.result();
        log.debug("Propagating client {} to transaction {} via email from {}",
                source.clientId(), tx.transactionId(), mapping.sourceTransactionId());
        return new MatchResult(
                tx.transactionId(),
                source.clientId(),
                settings.getPropagatedConfidence(),
                MatchMethod.EMAIL_PROPAGATED,
                source.method(),
                new MatchExplanation.Propagated(tx.email(), mapping.sourceTransactionId(),
                        source.method(), source.explanation()),
                true,
                false
        );
    }

    private static MatchResult exact(String txId, String clientId, double score, MatchMethod method,
                                     MatchExplanation explanation) {
        return new MatchResult(txId, clientId, score, method, null, explanation, true, false);
    }

    private MatchResult fuzzy(String txId, String clientId, double score, MatchMethod method,
                              MatchExplanation explanation) {
        return new MatchResult(txId, clientId, score, method, null, explanation, true,
                confidencePolicy.requiresReview(method, score));
    }

    private static String emailKey(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private record EmailMapping(String sourceTransactionId, MatchResult result) {}
}
