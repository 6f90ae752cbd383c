package com.intelcompliance.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Standard error response DTO. Never carries stack traces, key material or
 * decrypted values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private UUID requestId;
    private Instant timestamp;
    private Integer status;
    private String error;
    private String message;
    private String path;
    /** Current and requested state for rejected incident transitions. */
    private String currentState;
    private String requestedState;
    private List<ValidationError> validationErrors;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValidationError {
        private String field;
        private String message;
    }
}
