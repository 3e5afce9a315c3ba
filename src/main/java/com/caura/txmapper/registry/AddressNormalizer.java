package com.caura.txmapper.registry;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonicalizes free-text addresses for similarity comparison.
 * <p>
 * Steps, in order: lowercase and trim; replace {@code , . - _ /} with a space; expand street-type
 * abbreviations on word boundaries; collapse unit synonyms to {@code u}; collapse whitespace.
 * The composition is idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.
 */
public final class AddressNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[,.\\-_/]");

    private static final Map<String, String> STREET_TYPES = Map.of(
            "st", "street",
            "rd", "road",
            "ave", "avenue",
            "dr", "drive",
            "pl", "place",
            "cr", "crescent",
            "ct", "court",
            "ln", "lane",
            "wy", "way"
    );

    private static final Pattern STREET_TYPE = Pattern.compile("\\b(st|rd|ave|dr|pl|cr|ct|ln|wy)\\b");

    private static final Pattern UNIT_SYNONYM = Pattern.compile("\\b(unit|apt|apartment|flat)\\b");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AddressNormalizer() {
    }

    /**
     * @param address free text, may be null
     * @return the canonical form, empty for null or blank input
     */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            return "";
        }
        String normalized = address.toLowerCase(Locale.ROOT).trim();
        normalized = PUNCTUATION.matcher(normalized).replaceAll(" ");
        normalized = STREET_TYPE.matcher(normalized).replaceAll(m -> STREET_TYPES.get(m.group(1)));
        normalized = UNIT_SYNONYM.matcher(normalized).replaceAll("u");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }
}
