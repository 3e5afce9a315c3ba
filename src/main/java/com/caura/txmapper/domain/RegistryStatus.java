package com.caura.txmapper.domain;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

/**
 * Description of the active registry snapshot.
 */
@Schema(description = "Active client registry snapshot")
public record RegistryStatus(

    @Schema(description = "Where the snapshot was loaded from", example = "class path resource [registry/client-map.json]")
    String source,

    @Schema(description = "When the snapshot was published")
    Instant loadedAt,

    @Schema(example = "1250")
    int clientCount,

    @Schema(description = "Distinct emails indexed")
    int emailCount,

    @Schema(description = "Distinct names indexed")
    int nameCount,

    @Schema(description = "Envelope metadata, empty for flat registries")
    Map<String, Object> metadata
) {}
