package com.caura.txmapper.registry;

import com.caura.txmapper.domain.MatchExplanation;

/**
 * Best registry-wide address candidate.
 */
public record AddressMatch(String clientId, double score, MatchExplanation.Address explanation) {
}
