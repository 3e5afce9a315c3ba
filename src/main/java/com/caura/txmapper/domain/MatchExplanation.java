package com.caura.txmapper.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Structured audit payload explaining how a {@link MatchResult} was reached.
 * One record type per strategy family, each carrying the values and intermediate scores
 * the strategy used.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MatchExplanation.None.class, name = "none"),
        @JsonSubTypes.Type(value = MatchExplanation.Identifier.class, name = "identifier"),
        @JsonSubTypes.Type(value = MatchExplanation.Email.class, name = "email"),
        @JsonSubTypes.Type(value = MatchExplanation.Phone.class, name = "phone"),
        @JsonSubTypes.Type(value = MatchExplanation.BusinessNumber.class, name = "business_number"),
        @JsonSubTypes.Type(value = MatchExplanation.Name.class, name = "name"),
        @JsonSubTypes.Type(value = MatchExplanation.NameSuburb.class, name = "name_suburb"),
        @JsonSubTypes.Type(value = MatchExplanation.Address.class, name = "address"),
        @JsonSubTypes.Type(value = MatchExplanation.Propagated.class, name = "propagated")
})
public interface MatchExplanation {

    /** Nothing matched. */
    record None(String reason) implements MatchExplanation {
        public static final None NO_STRATEGY_MATCHED = new None("No strategy produced a match");
    }

    record Identifier(String platform, String matchedIdentifier) implements MatchExplanation {}

    record Email(String matchedEmail) implements MatchExplanation {}

    record Phone(String matchedPhone, String normalizedDigits) implements MatchExplanation {}

    record BusinessNumber(String matchedBusinessNumber) implements MatchExplanation {}

    /**
     * Name similarity. {@code inputName} is the extracted name for post-review matches,
     * or the searched description for description matches.
     */
    record Name(String matchedName, String inputName, boolean contained, double fuzzyScore)
            implements MatchExplanation {}

    record NameSuburb(String matchedName,
                      String inputName,
                      double nameScore,
                      String matchedSuburb,
                      String inputSuburb,
                      Double suburbScore,
                      boolean suburbBoostApplied) implements MatchExplanation {}

    /**
     * Address similarity with every per-strategy score computed for the winning client.
     */
    record Address(String matchedAddress,
                   AddressStrategy matchStrategy,
                   ClientRecord.Location clientLocation,
                   String inputAddress,
                   String normalizedInput,
                   Map<AddressStrategy, Double> allScores) implements MatchExplanation {

        public Address {
            allScores = allScores == null || allScores.isEmpty()
                    ? Map.of()
                    : Collections.unmodifiableMap(new EnumMap<>(allScores));
        }
    }

    record Propagated(String propagatedFromEmail,
                      String sourceTransactionId,
                      MatchMethod originalMethod,
                      MatchExplanation originalExplanation) implements MatchExplanation {}

    /**
     * Address comparison strategies, in evaluation order.
     */
    enum AddressStrategy {
        FULL_ADDRESS,
        STREET_ONLY,
        SUBURB_MATCH,
        POSTCODE_MATCH
    }
}
