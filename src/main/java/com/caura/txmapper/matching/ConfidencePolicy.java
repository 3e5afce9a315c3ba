package com.caura.txmapper.matching;

import com.caura.txmapper.config.MatchingProperties;
import com.caura.txmapper.domain.ConfidenceBand;
import com.caura.txmapper.domain.MatchMethod;
import org.springframework.stereotype.Component;

/**
 * Single source of truth for confidence banding and the review policy.
 * Scoring and reporting both go through this class, so they can never disagree.
 */
@Component
public class ConfidencePolicy {

    private final double high;
    private final double medium;

    public ConfidencePolicy(MatchingProperties properties) {
        double high = properties.getConfidenceThresholds().getHigh();
        double medium = properties.getConfidenceThresholds().getMedium();
        if (medium > high) {
            throw new IllegalArgumentException(
                    "Medium confidence threshold " + medium + " exceeds high threshold " + high);
        }
        this.high = high;
        this.medium = medium;
    }

    /**
     * {@code >= high} is HIGH, {@code >= medium} is MEDIUM, anything else LOW.
     */
    public ConfidenceBand band(double score) {
        if (score >= high) {
            return ConfidenceBand.HIGH;
        }
        if (score >= medium) {
            return ConfidenceBand.MEDIUM;
        }
        return ConfidenceBand.LOW;
    }

    /**
     * Exact-identifier methods never need review; every other method needs review unless the
     * score lands in the HIGH band.
     */
    public boolean requiresReview(MatchMethod method, double score) {
        if (method.isExactIdentifier()) {
            return false;
        }
        return band(score) != ConfidenceBand.HIGH;
    }

    public double highThreshold() {
        return high;
    }
}
