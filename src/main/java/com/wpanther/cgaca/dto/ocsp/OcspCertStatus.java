package com.wpanther.cgaca.dto.ocsp;

/**
 * Certificate status reported in a single response
 */
public enum OcspCertStatus {
    GOOD,
    REVOKED,
    EXPIRED,
    UNKNOWN
}
