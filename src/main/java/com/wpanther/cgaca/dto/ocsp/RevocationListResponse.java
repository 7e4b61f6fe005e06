package com.wpanther.cgaca.dto.ocsp;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * CRL-style list of every revoked certificate, signed like an OCSP response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevocationListResponse {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RevokedCertificate {
        private String certificateId;
        private Instant revocationDate;
        private String reason;
    }

    private String issuerId;
    private Instant thisUpdate;
    private Instant nextUpdate;
    private List<RevokedCertificate> revokedCertificates;
    private String signatureAlgorithm;
    private String signatureKeyId;
    private String signature;
}
