package com.wpanther.cgaca.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of renewing one certificate
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RenewalResult {

    public enum Outcome {
        RENEWED,
        FAILED,
        // Not renewed automatically: disabled, or level needs re-verification
        SKIPPED
    }

    private String certificateId;
    private Outcome outcome;
    private String newCertificateId;
    private String error;
    private boolean requiresVerification;
}
