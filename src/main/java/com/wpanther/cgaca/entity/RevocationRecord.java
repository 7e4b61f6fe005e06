package com.wpanther.cgaca.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Revocation of a single certificate. At most one exists per certificate.
 */
@Entity
@Table(name = "revocations",
        uniqueConstraints = @UniqueConstraint(name = "uk_revocations_certificate_id", columnNames = "certificate_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevocationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "certificate_id", nullable = false)
    private String certificateId;

    @Column(name = "revoked_at", nullable = false)
    private Instant revokedAt;

    @Column(name = "reason", nullable = false)
    private String reason;

    @Column(name = "revoked_by", nullable = false)
    private String revokedBy;

    @Column(name = "incident_id")
    private String incidentId;
}
