package com.wpanther.cgaca.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity for verification attempts
 * Append-only, written for every verification whatever the outcome
 */
@Entity
@Table(name = "verification_history", indexes = {
        @Index(name = "idx_verification_history_certificate_id", columnList = "certificate_id"),
        @Index(name = "idx_verification_history_agent_id", columnList = "agent_id"),
        @Index(name = "idx_verification_history_timestamp", columnList = "request_timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationHistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "certificate_id")
    private String certificateId;

    @Column(name = "agent_id", nullable = false)
    private String agentId;

    @Column(name = "request_ip")
    private String requestIp;

    @Column(name = "request_action")
    private String requestAction;

    @Column(name = "request_timestamp", nullable = false)
    private Instant requestTimestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "result", nullable = false, length = 16)
    private VerificationResult result;

    @Column(name = "result_details", length = 4000)
    private String resultDetails;

    @Column(name = "duration_ms")
    private Long durationMs;
}
