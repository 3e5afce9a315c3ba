package com.caura.txmapper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Matching configuration bound from the {@code matching} prefix.
 * Relaxed binding accepts both {@code confidence_thresholds.high} and {@code confidence-thresholds.high}.
 * Every value has a default, so an empty configuration reproduces the documented behaviour.
 */
@ConfigurationProperties(prefix = "matching")
@Validated
@Getter
@Setter
public class MatchingProperties {

    @Valid
    private ConfidenceThresholds confidenceThresholds = new ConfidenceThresholds();

    @Valid
    private FuzzyMatching fuzzyMatching = new FuzzyMatching();

    @Valid
    private AddressMatching addressMatching = new AddressMatching();

    @Valid
    private EnhancedMatching enhancedMatching = new EnhancedMatching();

    @Valid
    private PostReview postReview = new PostReview();

    @Valid
    private Batch batch = new Batch();

    @Getter
    @Setter
    public static class ConfidenceThresholds {

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double high = 0.85;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double medium = 0.60;

        // Recognised for compatibility with existing configuration files; banding uses high and medium only.
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double low = 0.40;
    }

    @Getter
    @Setter
    public static class FuzzyMatching {

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double nameThreshold = 0.85;
    }

    @Getter
    @Setter
    public static class AddressMatching {

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minScore = 0.80;
    }

    /**
     * Name + suburb matching for manually entered receipts.
     */
    @Getter
    @Setter
    public static class EnhancedMatching {

        @NotBlank
        private String platform = "paper_receipt";

        @NotBlank
        private String nameKey = "client_name";

        @NotBlank
        private String suburbKey = "client_suburb";

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double nameGate = 0.60;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double suburbThreshold = 0.80;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double suburbBoost = 0.15;
    }

    /**
     * Secondary resolution over reviewer-extracted PII.
     */
    @Getter
    @Setter
    public static class PostReview {

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double addressMinScore = 0.70;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double nameThreshold = 0.75;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double phoneConfidence = 0.95;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double propagatedConfidence = 0.90;

        @NotBlank
        private String businessNumberPlatform = "aged_care";

        @NotBlank
        private String businessNumberKey = "acn";
    }

    @Getter
    @Setter
    public static class Batch {

        @Min(1)
        private int parallelism = 8;
    }
}
