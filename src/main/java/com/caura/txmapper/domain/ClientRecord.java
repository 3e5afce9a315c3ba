package com.caura.txmapper.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Client identity record as held in the client registry.
 * Field names follow the registry file format. Missing optional sections default to empty values,
 * so callers never need to null-check nested structures.
 */
@Schema(description = "Client identity record from the client registry")
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientRecord(

    @Schema(description = "Registry-wide unique client identifier", example = "CL00042")
    @JsonProperty("caura_id")
    String clientId,

    @JsonProperty("personal_info")
    PersonalInfo personalInfo,

    @JsonProperty("location")
    Location location,

    @JsonProperty("platform_identifiers")
    List<PlatformIdentifier> platformIdentifiers
) {

    public ClientRecord {
        personalInfo = personalInfo != null ? personalInfo : PersonalInfo.EMPTY;
        location = location != null ? location : Location.EMPTY;
        platformIdentifiers = platformIdentifiers != null
                ? platformIdentifiers.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList())
                : List.of();
    }

    /**
     * Returns a copy carrying the given client id.
     */
    public ClientRecord withClientId(String id) {
        return new ClientRecord(id, personalInfo, location, platformIdentifiers);
    }

    /**
     * "given family", trimmed; empty when both parts are missing.
     */
    public String fullName() {
        return (nvl(personalInfo.givenName()) + " " + nvl(personalInfo.familyName())).trim();
    }

    private static String nvl(String s) {
        return s != null ? s : "";
    }

    /**
     * Personal details of a client.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PersonalInfo(

        @JsonProperty("given_name")
        String givenName,

        @JsonProperty("family_name")
        String familyName,

        @JsonProperty("emails")
        List<String> emails,

        @JsonProperty("contact_numbers")
        List<String> contactNumbers
    ) {

        static final PersonalInfo EMPTY = new PersonalInfo(null, null, null, null);

        public PersonalInfo {
            emails = nonNullEntries(emails);
            contactNumbers = nonNullEntries(contactNumbers);
        }
    }

    /**
     * Postal location. All components are optional.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Location(

        @Schema(description = "Unit or address line", example = "Unit 4")
        @JsonProperty("address_1")
        String unit,

        @Schema(description = "Street line", example = "12 Smith St")
        @JsonProperty("address_2")
        String street,

        @JsonProperty("suburb")
        String suburb,

        @JsonProperty("postcode")
        String postcode
    ) {

        static final Location EMPTY = new Location(null, null, null, null);

        @JsonIgnore
        public boolean isEmpty() {
            return isBlank(unit) && isBlank(street) && isBlank(suburb) && isBlank(postcode);
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }

    /**
     * Identifiers a client carries on one external platform (Stripe, ShiftCare, aged care portal).
     * The identifiers map holds {@code client_id} and {@code display_name} where the platform
     * provides them, plus any platform-specific extras such as {@code acn}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlatformIdentifier(

        @JsonProperty("platform")
        String platform,

        @JsonProperty("identifiers")
        Map<String, Object> identifiers
    ) {

        public PlatformIdentifier {
            platform = platform != null ? platform : "";
            identifiers = identifiers != null
                    ? identifiers.entrySet().stream()
                        .filter(e -> e.getKey() != null && e.getValue() != null)
                        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue))
                    : Map.of();
        }

        /**
         * Scalar identifier value as text, or null when absent or structured.
         */
        public String identifier(String key) {
            Object value = identifiers.get(key);
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                return value.toString();
            }
            return null;
        }

        public String clientIdOnPlatform() {
            return identifier("client_id");
        }

        public String displayName() {
            return identifier("display_name");
        }
    }

    private static List<String> nonNullEntries(List<String> values) {
        return values != null
                ? values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList())
                : List.of();
    }
}
