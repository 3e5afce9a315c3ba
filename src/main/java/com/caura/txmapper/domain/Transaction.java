package com.caura.txmapper.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Financial transaction handed over by an importer (bank statement, Stripe export,
 * ShiftCare invoice, paper receipt) after normalization to a common shape.
 */
@Schema(description = "Transaction to resolve to a registry client")
public record Transaction(

    @Schema(description = "Transaction identifier, unique within a batch", example = "ch_3PbX9s")
    @NotBlank(message = "Transaction ID is required")
    String transactionId,

    @Schema(description = "Transaction date", example = "2025-07-14")
    @NotNull(message = "Date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date,

    @Schema(description = "Transaction amount", example = "42.50")
    @NotNull(message = "Amount is required")
    BigDecimal amount,

    @Schema(description = "Free-text description or memo", example = "PAYMENT 12 Smith Street Parkville")
    String description,

    @Schema(description = "Payment reference if the source provides one")
    String reference,

    @Schema(description = "Payer email if known", example = "jane.citizen@example.com")
    String email,

    @Schema(description = "Client identifier on the source platform", example = "cus_QxY12")
    String clientIdentifier,

    @Schema(description = "Source platform", example = "stripe")
    @NotBlank(message = "Platform is required")
    String platform,

    @Schema(description = "Importer-specific metadata, e.g. client_name and client_suburb for paper receipts")
    Map<String, String> platformMetadata
) {

    public Transaction {
        // Importers emit absent fields as null values, e.g. a receipt without suburb.
        platformMetadata = platformMetadata != null
                ? platformMetadata.entrySet().stream()
                    .filter(e -> e.getKey() != null && e.getValue() != null)
                    .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue))
                : Map.of();
    }

    /**
     * Metadata value, or null when absent or blank.
     */
    public String metadata(String key) {
        String value = platformMetadata.get(key);
        return value != null && !value.isBlank() ? value : null;
    }
}
