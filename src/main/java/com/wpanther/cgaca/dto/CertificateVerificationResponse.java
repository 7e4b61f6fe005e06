package com.wpanther.cgaca.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wpanther.cgaca.entity.CgaLevel;
import com.wpanther.cgaca.entity.VerificationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Answer to "is this certificate currently valid?"
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CertificateVerificationResponse {
    private boolean valid;
    private VerificationResult status;
    private String message;
    private String certificateId;
    private String agentId;
    private String organizationId;
    private String organizationName;
    private CgaLevel level;
    private Instant issuedAt;
    private Instant expiresAt;
}
