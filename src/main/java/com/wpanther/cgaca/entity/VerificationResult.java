package com.wpanther.cgaca.entity;

/**
 * Outcome stored in the verification history
 */
public enum VerificationResult {
    VALID,
    INVALID,
    REVOKED,
    EXPIRED,
    UNKNOWN
}
