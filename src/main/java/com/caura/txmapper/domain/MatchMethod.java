package com.caura.txmapper.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of matching strategies a {@link MatchResult} can come from.
 * Exact-identifier methods are authoritative and never require review.
 */
public enum MatchMethod {

    EXACT_CLIENT_ID("exact_client_id", true),
    EXACT_EMAIL("exact_email", true),
    NAME_SUBURB("name_suburb", false),
    FUZZY_NAME("fuzzy_name", false),
    ADDRESS_MATCH("address_match", false),
    NO_MATCH("no_match", false),

    // Post-review pass over manually extracted PII
    PREVIOUSLY_MATCHED("previously_matched", true),
    EXTRACTED_EMAIL("extracted_email", true),
    EXTRACTED_BUSINESS_NUMBER("extracted_business_number", true),
    EXTRACTED_PHONE("extracted_phone", true),
    EXTRACTED_ADDRESS_FUZZY("extracted_address_fuzzy", false),
    EXTRACTED_NAME_FUZZY("extracted_name_fuzzy", false),
    NO_MATCH_POST_REVIEW("no_match_post_review", false),
    EMAIL_PROPAGATED("email_propagated_from_", true);

    private final String code;
    private final boolean exactIdentifier;

    MatchMethod(String code, boolean exactIdentifier) {
        this.code = code;
        this.exactIdentifier = exactIdentifier;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isExactIdentifier() {
        return exactIdentifier;
    }

    public boolean isMatch() {
        return this != NO_MATCH && this != NO_MATCH_POST_REVIEW;
    }

    /**
     * Wire name of this method. Propagated matches carry the originating method,
     * e.g. {@code email_propagated_from_extracted_phone}.
     */
    public String wireName(MatchMethod propagatedFrom) {
        if (this == EMAIL_PROPAGATED && propagatedFrom != null) {
            return code + propagatedFrom.code;
        }
        return code;
    }
}
