package com.wpanther.cgaca.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * CA signing key. The private key is only ever stored encrypted.
 * Rotated keys stay in the table to verify signatures they produced.
 */
@Entity
@Table(name = "ca_keys", indexes = @Index(name = "idx_ca_keys_status", columnList = "status"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaKeyRecord {

    @Id
    private String id;

    @Column(name = "algorithm", nullable = false, length = 32)
    private String algorithm;

    @Lob
    @Column(name = "public_key", nullable = false)
    private String publicKey;

    @Lob
    @ToString.Exclude
    @Column(name = "private_key_encrypted", nullable = false)
    private String encryptedPrivateKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private KeyStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "rotated_at")
    private Instant rotatedAt;

    @Column(name = "certificates_signed", nullable = false)
    private long certificatesSigned;
}
