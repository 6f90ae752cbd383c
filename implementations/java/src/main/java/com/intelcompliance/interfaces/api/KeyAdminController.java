package com.intelcompliance.interfaces.api;

import com.intelcompliance.application.SecurityContextProvider;
import com.intelcompliance.domain.model.KeyMetadata;
import com.intelcompliance.domain.model.KeyPurpose;
import com.intelcompliance.infrastructure.crypto.KeyManagementService;
import com.intelcompliance.infrastructure.crypto.KeyReport;
import com.intelcompliance.interfaces.api.dto.KeyActionRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Key administration. Restricted to the ADMIN role by the security filter
 * chain. Responses carry metadata only, never key material.
 */
@RestController
@RequestMapping(value = "/api/admin/keys", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Key administration", description = "Key report, rotation and revocation")
@SecurityRequirement(name = "basicAuth")
public class KeyAdminController {

    private final KeyManagementService keyManagementService;
    private final SecurityContextProvider securityContext;

    @GetMapping("/report")
    @Operation(summary = "Key inventory and upcoming rotations")
    public KeyReport report() {
        return keyManagementService.keyReport();
    }

    @PostMapping(value = "/{purpose}/rotation", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Rotate the active key of a purpose")
    public KeyMetadata rotate(@PathVariable KeyPurpose purpose, @Valid @RequestBody KeyActionRequest request) {
        log.warn("Key rotation for {} requested by {}", purpose, securityContext.currentActor());
        return keyManagementService.rotateKey(purpose, request.getReason());
    }

    @PostMapping(value = "/{keyId}/revocation", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Revoke a key", description = "A revoked active key is replaced immediately")
    public ResponseEntity<Void> revoke(@PathVariable String keyId, @Valid @RequestBody KeyActionRequest request) {
        log.warn("Key revocation of {} requested by {}", keyId, securityContext.currentActor());
        keyManagementService.revokeKey(keyId, request.getReason());
        return ResponseEntity.noContent().build();
    }
}
