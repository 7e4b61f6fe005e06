package com.wpanther.cgaca.dto.verification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent whose live state is checked against the registry.
 * Either certificateId or the full claimed identity must be given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationTarget {
    private String certificateId;
    private String agentId;
    private String agentVersion;
    private String organizationId;
    private String requestIp;
    private String action;
}
