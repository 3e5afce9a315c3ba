package com.caura.txmapper.domain;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Identity fields a reviewer manually extracted from an unmatched transaction.
 * Any field may be absent; blank values are treated as absent.
 */
@Schema(description = "Manually extracted identity fields")
public record ExtractedPii(

    @Schema(example = "Jane Citizen")
    String name,

    @Schema(example = "12 Smith St, Parkville 3052")
    String address,

    @Schema(description = "Business number (ACN)", example = "ACN12345678")
    String businessNumber,

    @Schema(description = "Invoice number quoted by the payer")
    String invoice,

    @Schema(example = "0412 345 678")
    String phone,

    @Schema(example = "jane.citizen@example.com")
    String email
) {

    public static final ExtractedPii NONE = new ExtractedPii(null, null, null, null, null, null);
}
