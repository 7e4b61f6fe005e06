package com.wpanther.cgaca.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * DTO containing registry and verification activity metrics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationMetricsResponse {

    // Certificates by stored status
    private Map<String, Long> certificatesByStatus;

    // Active certificates by level
    private Map<String, Long> activeCertificatesByLevel;

    // Verification attempts by result
    private Map<String, Long> verificationsByResult;

    // Time-based metrics
    private long verificationsLast24Hours;
    private long verificationsLast7Days;
    private long verificationsLast30Days;

    private long revocations;

    // Timestamp when metrics were calculated
    private Instant timestamp;
}
