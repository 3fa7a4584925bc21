package com.chainbills.ledger.dto;

import lombok.*;

/**
 * Unified error response returned by API endpoints.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class ErrorResponse {

    private final int status;      // HTTP status code
    private final String error;    // Short title (e.g., "Bad Request", "Conflict")
    private final String code;     // Ledger error code (e.g., "PAYABLE_IS_CLOSED"), null for transport errors
    private final String message;  // Detailed error description
    private final String path;     // Request path
}
