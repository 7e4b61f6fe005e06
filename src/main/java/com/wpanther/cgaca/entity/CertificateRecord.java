package com.wpanther.cgaca.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Issued CGA certificate as held in the registry.
 * The canonical content is the exact byte sequence the CA signed.
 */
@Entity
@Table(name = "certificates",
        uniqueConstraints = @UniqueConstraint(name = "uk_certificates_identity_version",
                columnNames = {"agent_id", "agent_version", "organization_id", "certificate_version"}),
        indexes = {
                @Index(name = "idx_certificates_agent_id", columnList = "agent_id"),
                @Index(name = "idx_certificates_organization_id", columnList = "organization_id"),
                @Index(name = "idx_certificates_status", columnList = "status"),
                @Index(name = "idx_certificates_expires_at", columnList = "expires_at"),
                @Index(name = "idx_certificates_level", columnList = "level")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CertificateRecord {

    @Id
    private String id;

    @Column(name = "agent_id", nullable = false)
    private String agentId;

    @Column(name = "agent_version", nullable = false)
    private String agentVersion;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(name = "organization_name", nullable = false)
    private String organizationName;

    @Column(name = "organization_domain")
    private String organizationDomain;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, length = 16)
    private CgaLevel level;

    @Column(name = "golden_thread_hash", nullable = false, length = 128)
    private String goldenThreadHash;

    @Builder.Default
    @Column(name = "golden_thread_algorithm", nullable = false, length = 32)
    private String goldenThreadAlgorithm = "SHA-256";

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Lob
    @Column(name = "certificate_content", nullable = false)
    private String certificateContent;

    @Column(name = "signature_algorithm", nullable = false, length = 32)
    private String signatureAlgorithm;

    @Column(name = "signature_key_id", nullable = false)
    private String signatureKeyId;

    @Column(name = "signature_value", nullable = false, length = 1024)
    private String signatureValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CertificateStatus status;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revocation_reason")
    private String revocationReason;

    // Incremented by each renewal; part of the identity uniqueness constraint
    @Builder.Default
    @Column(name = "certificate_version", nullable = false)
    private int certificateVersion = 1;

    @Column(name = "previous_certificate_id")
    private String previousCertificateId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
