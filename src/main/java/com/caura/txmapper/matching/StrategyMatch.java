package com.caura.txmapper.matching;

import com.caura.txmapper.domain.MatchExplanation;
import com.caura.txmapper.domain.MatchMethod;

/**
 * Candidate produced by one strategy: the uniform result shape of every {@link MatchStrategy}.
 */
public record StrategyMatch(MatchMethod method, String clientId, double score, MatchExplanation explanation) {
}
