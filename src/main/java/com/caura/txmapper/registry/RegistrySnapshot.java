package com.caura.txmapper.registry;

import com.caura.txmapper.domain.ClientRecord;
import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchExplanation.AddressStrategy;
import com.caura.txmapper.domain.RegistryStatus;
import com.caura.txmapper.similarity.StringSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Immutable client registry snapshot with its lookup indices.
 * <p>
 * Built once per (re)load and never mutated afterwards, so any number of threads may read it.
 * Every index is multi-valued and keeps registry order; single-value lookups return the first
 * client in registry order. Duplicates are logged when the indices are built.
 */
@Slf4j
public final class RegistrySnapshot {

    static final double SUBURB_MATCH_SCORE = 0.85;
    static final double POSTCODE_MATCH_SCORE = 0.90;
    static final int MIN_ADDRESS_LENGTH = 5;

    private final String source;
    private final Instant loadedAt;
    private final Map<String, Object> metadata;
    private final Map<String, ClientRecord> clients;
    private final Map<String, List<String>> emailIndex;
    private final Map<String, List<String>> nameIndex;
    private final Map<String, Map<String, List<String>>> platformIndex;
    private final Map<String, List<String>> phoneIndex;

    private RegistrySnapshot(String source,
                             Instant loadedAt,
                             Map<String, Object> metadata,
                             Map<String, ClientRecord> clients,
                             Map<String, List<String>> emailIndex,
                             Map<String, List<String>> nameIndex,
                             Map<String, Map<String, List<String>>> platformIndex,
                             Map<String, List<String>> phoneIndex) {
        this.source = source;
        this.loadedAt = loadedAt;
        this.metadata = metadata;
        this.clients = clients;
        this.emailIndex = emailIndex;
        this.nameIndex = nameIndex;
        this.platformIndex = platformIndex;
        this.phoneIndex = phoneIndex;
    }

    /**
     * Builds a snapshot and all its indices.
     *
     * @param clients client records in registry order, ids already unique
     */
    public static RegistrySnapshot build(String source, Map<String, Object> metadata, Collection<ClientRecord> clients) {
        Map<String, ClientRecord> byId = new LinkedHashMap<>();
        Map<String, List<String>> emails = new HashMap<>();
        Map<String, List<String>> names = new HashMap<>();
        Map<String, Map<String, List<String>>> platforms = new HashMap<>();
        Map<String, List<String>> phones = new HashMap<>();

        for (ClientRecord client : clients) {
            String clientId = client.clientId();
            byId.put(clientId, client);

            for (String email : client.personalInfo().emails()) {
                String key = email.trim().toLowerCase(Locale.ROOT);
                if (!key.isEmpty()) {
                    addDistinct(emails, key, clientId);
                }
            }

            String fullName = client.fullName();
            if (!fullName.isEmpty()) {
                names.computeIfAbsent(fullName.toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(clientId);
            }

            for (ClientRecord.PlatformIdentifier platformId : client.platformIdentifiers()) {
                Map<String, List<String>> platformEntries =
                        platforms.computeIfAbsent(platformId.platform(), k -> new HashMap<>());
                String idOnPlatform = platformId.clientIdOnPlatform();
                if (idOnPlatform != null && !idOnPlatform.isBlank()) {
                    addDistinct(platformEntries, idOnPlatform.trim(), clientId);
                }
                String displayName = platformId.displayName();
                if (displayName != null && !displayName.isBlank()) {
                    addDistinct(platformEntries, displayName.trim().toLowerCase(Locale.ROOT), clientId);
                }
            }

            for (String number : client.personalInfo().contactNumbers()) {
                String digits = digitsOnly(number);
                if (!digits.isEmpty()) {
                    addDistinct(phones, digits, clientId);
                }
            }
        }

        warnOnDuplicates("email", emails);
        warnOnDuplicates("name", names);
        platforms.forEach((platform, entries) -> warnOnDuplicates(platform + " identifier", entries));

        RegistrySnapshot snapshot = new RegistrySnapshot(
                source,
                Instant.now(),
                metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of(),
                Collections.unmodifiableMap(byId),
                freeze(emails),
                freeze(names),
                freezeNested(platforms),
                freeze(phones)
        );
        log.info("Built registry snapshot from {}: {} clients, {} emails, {} names, {} platforms",
                source, byId.size(), emails.size(), names.size(), platforms.size());
        return snapshot;
    }

    public String source() {
        return source;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * All clients in registry order.
     */
    public Collection<ClientRecord> clients() {
        return clients.values();
    }

    public int size() {
        return clients.size();
    }

    public int emailCount() {
        return emailIndex.size();
    }

    public int nameCount() {
        return nameIndex.size();
    }

    public RegistryStatus status() {
        return new RegistryStatus(source, loadedAt, size(), emailCount(), nameCount(), metadata);
    }

    public Optional<ClientRecord> getClient(String clientId) {
        return Optional.ofNullable(clientId).map(clients::get);
    }

    /**
     * Case-insensitive exact email lookup.
     */
    public Optional<String> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return first(emailIndex.get(email.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Case-insensitive exact lookup on "given family". Returns every colliding client.
     */
    public List<String> findByName(String name) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        return nameIndex.getOrDefault(name.trim().toLowerCase(Locale.ROOT), List.of());
    }

    /**
     * Looks the identifier up as-is, then lowercased, in the platform's sub-index.
     */
    public Optional<String> findByPlatformIdentifier(String platform, String identifier) {
        if (platform == null || identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        Map<String, List<String>> entries = platformIndex.getOrDefault(platform, Map.of());
        String key = identifier.trim();
        Optional<String> exact = first(entries.get(key));
        return exact.isPresent() ? exact : first(entries.get(key.toLowerCase(Locale.ROOT)));
    }

    /**
     * Phone lookup comparing digits only, ignoring spaces, brackets and other formatting.
     */
    public Optional<String> findByPhone(String phone) {
        String digits = digitsOnly(phone);
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        return first(phoneIndex.get(digits));
    }

    /**
     * Finds the first client carrying {@code key = value} in its identifiers for the given platform.
     */
    public Optional<String> findByPlatformAttribute(String platform, String key, String value) {
        if (platform == null || key == null || value == null || value.isBlank()) {
            return Optional.empty();
        }
        String wanted = value.trim();
        for (ClientRecord client : clients.values()) {
            for (ClientRecord.PlatformIdentifier platformId : client.platformIdentifiers()) {
                if (platform.equals(platformId.platform()) && wanted.equals(platformId.identifier(key))) {
                    return Optional.of(client.clientId());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Registry-wide address search over every client with a location.
     * <p>
     * Each candidate scores the maximum of: full-address partial ratio, street-only partial ratio,
     * suburb containment ({@value #SUBURB_MATCH_SCORE}) and literal postcode containment
     * ({@value #POSTCODE_MATCH_SCORE}). The highest candidate wins if it reaches {@code minScore};
     * equal scores go to the smaller client id.
     *
     * @param freeText address text, typically a transaction description
     * @param minScore inclusive threshold
     * @return the best candidate, empty if none qualifies or the input is shorter than
     *         {@value #MIN_ADDRESS_LENGTH} characters
     */
    public Optional<AddressMatch> findByAddress(String freeText, double minScore) {
        if (freeText == null || freeText.trim().length() < MIN_ADDRESS_LENGTH) {
            return Optional.empty();
        }
        String normalizedInput = AddressNormalizer.normalize(freeText);
        if (normalizedInput.isEmpty()) {
            return Optional.empty();
        }

        AddressMatch best = null;
        for (ClientRecord client : clients.values()) {
            ClientRecord.Location location = client.location();
            if (location.isEmpty()) {
                continue;
            }
            AddressMatch candidate = scoreAddress(client, freeText, normalizedInput);
            if (candidate == null || candidate.score() < minScore) {
                continue;
            }
            if (best == null
                    || candidate.score() > best.score()
                    || (candidate.score() == best.score() && candidate.clientId().compareTo(best.clientId()) < 0)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private static AddressMatch scoreAddress(ClientRecord client, String rawInput, String normalizedInput) {
        ClientRecord.Location location = client.location();
        String fullAddress = joinPresent(location.unit(), location.street(), location.suburb(), location.postcode());
        Map<AddressStrategy, Double> scores = new EnumMap<>(AddressStrategy.class);

        String normalizedAddress = AddressNormalizer.normalize(fullAddress);
        if (!normalizedAddress.isEmpty()) {
            scores.put(AddressStrategy.FULL_ADDRESS, StringSimilarity.partialRatio(normalizedInput, normalizedAddress));
        }

        String normalizedStreet = AddressNormalizer.normalize(location.street());
        if (!normalizedStreet.isEmpty()) {
            scores.put(AddressStrategy.STREET_ONLY, StringSimilarity.partialRatio(normalizedInput, normalizedStreet));
        }

        String normalizedSuburb = AddressNormalizer.normalize(location.suburb());
        if (!normalizedSuburb.isEmpty() && normalizedInput.contains(normalizedSuburb)) {
            scores.put(AddressStrategy.SUBURB_MATCH, SUBURB_MATCH_SCORE);
        }

        String postcode = location.postcode() != null ? location.postcode().trim() : "";
        if (!postcode.isEmpty() && rawInput.contains(postcode)) {
            scores.put(AddressStrategy.POSTCODE_MATCH, POSTCODE_MATCH_SCORE);
        }

        if (scores.isEmpty()) {
            return null;
        }

        AddressStrategy bestStrategy = null;
        double bestScore = -1.0;
        for (Map.Entry<AddressStrategy, Double> entry : scores.entrySet()) {
            if (entry.getValue() > bestScore) {
                bestScore = entry.getValue();
                bestStrategy = entry.getKey();
            }
        }

        return new AddressMatch(client.clientId(), bestScore, new MatchExplanation.Address(
                fullAddress,
                bestStrategy,
                location,
                rawInput,
                normalizedInput,
                scores
        ));
    }

    static String digitsOnly(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder digits = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }

    private static String joinPresent(String... parts) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                joiner.add(part.trim());
            }
        }
        return joiner.toString();
    }

    private static void addDistinct(Map<String, List<String>> index, String key, String clientId) {
        List<String> ids = index.computeIfAbsent(key, k -> new ArrayList<>());
        if (!ids.contains(clientId)) {
            ids.add(clientId);
        }
    }

    private static void warnOnDuplicates(String kind, Map<String, List<String>> index) {
        index.forEach((key, ids) -> {
            if (ids.size() > 1) {
                log.warn("Registry {} '{}' is shared by {} clients {}; lookups resolve to {}",
                        kind, key, ids.size(), ids, ids.get(0));
            }
        });
    }

    private static Optional<String> first(List<String> ids) {
        return ids == null || ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> index) {
        Map<String, List<String>> frozen = new HashMap<>();
        index.forEach((key, ids) -> frozen.put(key, List.copyOf(ids)));
        return Collections.unmodifiableMap(frozen);
    }

    private static Map<String, Map<String, List<String>>> freezeNested(Map<String, Map<String, List<String>>> index) {
        Map<String, Map<String, List<String>>> frozen = new HashMap<>();
        index.forEach((platform, entries) -> frozen.put(platform, freeze(entries)));
        return Collections.unmodifiableMap(frozen);
    }
}
