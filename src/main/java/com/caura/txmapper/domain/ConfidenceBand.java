package com.caura.txmapper.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Discrete confidence classification of a similarity score.
 * Always derived from the score; see {@code ConfidencePolicy}.
 * The lowercase names apply to values and to map keys alike.
 */
public enum ConfidenceBand {
    @JsonProperty("high")
    HIGH("high"),
    @JsonProperty("medium")
    MEDIUM("medium"),
    @JsonProperty("low")
    LOW("low");

    private final String label;

    ConfidenceBand(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
