package com.caura.txmapper.controller;

import com.caura.txmapper.domain.ClientRecord;
import com.caura.txmapper.domain.RegistryStatus;
import com.caura.txmapper.registry.ClientRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for the client registry.
 */
@RestController
@RequestMapping("/api/v1/registry")
@Tag(name = "Registry", description = "Client registry APIs")
@Slf4j
public class RegistryController {

    private final ClientRegistry clientRegistry;

    public RegistryController(ClientRegistry clientRegistry) {
        this.clientRegistry = clientRegistry;
    }

    @GetMapping
    @Operation(summary = "Registry status", description = "Describes the active registry snapshot")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Active snapshot",
                    content = @Content(schema = @Schema(implementation = RegistryStatus.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Client registry unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<RegistryStatus> status() {
        return ResponseEntity.ok(clientRegistry.load().status());
    }

    @GetMapping("/clients/{clientId}")
    @Operation(summary = "Get client", description = "Retrieves one registry client by id")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Client found",
                    content = @Content(schema = @Schema(implementation = ClientRecord.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Client not found"
            )
    })
    public ResponseEntity<ClientRecord> getClient(
            @Parameter(description = "Registry client id", example = "CL00042")
            @PathVariable String clientId) {

        return clientRegistry.getClient(clientId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Re-reads the registry source and swaps the active snapshot.
     * In-flight runs finish on the snapshot they started with.
     */
    @PostMapping("/reload")
    @Operation(summary = "Reload registry", description = "Re-reads the registry source and atomically replaces the active snapshot")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Registry reloaded",
                    content = @Content(schema = @Schema(implementation = RegistryStatus.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Reload failed; the previous snapshot stays active",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<RegistryStatus> reload() {
        log.info("Registry reload requested");
        return ResponseEntity.ok(clientRegistry.reload().status());
    }
}
