package com.wpanther.cgaca.entity;

public enum CertificateStatus {
    ACTIVE,
    REVOKED,
    // Reserved for a persisted expiry sweep; expiry is computed from expiresAt at query time
    EXPIRED,
    SUPERSEDED
}
