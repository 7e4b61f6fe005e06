package com.wpanther.cgaca.service;

import com.wpanther.cgaca.crypto.CaKeyAlgorithm;
import com.wpanther.cgaca.dto.AuthorityInfoResponse;
import com.wpanther.cgaca.dto.CertificateVerificationResponse;
import com.wpanther.cgaca.dto.ManualRenewalResponse;
import com.wpanther.cgaca.dto.RenewalRunSummary;
import com.wpanther.cgaca.dto.SigningRequest;
import com.wpanther.cgaca.dto.VerificationMetricsResponse;
import com.wpanther.cgaca.dto.ocsp.OcspRequest;
import com.wpanther.cgaca.dto.ocsp.OcspResponse;
import com.wpanther.cgaca.dto.ocsp.RevocationListResponse;
import com.wpanther.cgaca.dto.ocsp.SingleResponse;
import com.wpanther.cgaca.dto.verification.LiveVerificationResult;
import com.wpanther.cgaca.dto.verification.VerificationTarget;
import com.wpanther.cgaca.entity.CaKeyRecord;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CertificateStatus;
import com.wpanther.cgaca.entity.CgaLevel;
import com.wpanther.cgaca.entity.RevocationRecord;
import com.wpanther.cgaca.entity.VerificationHistoryRecord;
import com.wpanther.cgaca.entity.VerificationResult;
import com.wpanther.cgaca.exception.CryptoException;
import com.wpanther.cgaca.exception.KeyUnavailableException;
import com.wpanther.cgaca.exception.ValidationException;
import com.wpanther.cgaca.registry.CertificateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for callers of the certificate authority.
 * Transport layers map the exceptions of this class onto their own error responses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CertificateAuthorityService {

    private final CertificateRegistry registry;
    private final SigningService signingService;
    private final RevocationService revocationService;
    private final OcspResponderService ocspResponderService;
    private final RenewalService renewalService;
    private final LiveVerificationService liveVerificationService;
    private final VerificationMetricsService metricsService;
    private final Clock clock;

    /**
     * Issues a certificate.
     *
     * @throws ValidationException     when required fields are missing or malformed
     * @throws com.wpanther.cgaca.exception.ConflictException when the agent identity already holds a certificate
     * @throws KeyUnavailableException when no usable CA key is active
     */
    public CertificateRecord submitSigningRequest(SigningRequest request) {
        return signingService.sign(request);
    }

    public List<SingleResponse> queryStatus(List<String> certificateIds) {
        return ocspResponderService.queryStatus(certificateIds);
    }

    public OcspResponse processOcspRequest(OcspRequest request) {
        return ocspResponderService.processRequest(request);
    }

    public RevocationListResponse getRevocationList() {
        return ocspResponderService.getRevocationList();
    }

    public RevocationRecord revoke(String certificateId, String reason, String actor, String incidentId) {
        return revocationService.revoke(certificateId, reason, actor, incidentId);
    }

    public List<RevocationRecord> revokeAll(List<String> certificateIds, String reason, String actor,
                                            String incidentId) {
        return revocationService.revokeAll(certificateIds, reason, actor, incidentId);
    }

    public CertificateRecord getCertificate(String certificateId) {
        return registry.requireCertificate(certificateId);
    }

    public List<CertificateRecord> listByAgent(String agentId) {
        return registry.listByAgent(agentId);
    }

    public List<CertificateRecord> listByOrg(String organizationId) {
        return registry.listByOrganization(organizationId);
    }

    public boolean verifySignature(CertificateRecord certificate) {
        return signingService.verifySignature(certificate);
    }

    /**
     * Tells a relying party whether a certificate can be trusted right now.
     * The answer is written to the verification history.
     */
    public CertificateVerificationResponse verifyCertificate(String certificateId, String requestIp, String action) {
        if (certificateId == null || certificateId.isBlank()) {
            throw new ValidationException("Certificate id is required", Map.of("certificateId", "must not be blank"));
        }
        long started = System.nanoTime();
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);

        Optional<CertificateRecord> found = registry.findCertificate(certificateId);
        if (found.isEmpty()) {
            recordVerification(null, "unknown", requestIp, action, now, VerificationResult.UNKNOWN,
                    "Certificate not found", started);
            return CertificateVerificationResponse.builder()
                    .valid(false)
                    .status(VerificationResult.UNKNOWN)
                    .message("Certificate not found")
                    .certificateId(certificateId)
                    .build();
        }

        CertificateRecord certificate = found.get();
        VerificationResult status;
        String message;
        Optional<RevocationRecord> revocation = registry.findRevocation(certificateId);
        if (revocation.isPresent() || certificate.getStatus() == CertificateStatus.REVOKED) {
            status = VerificationResult.REVOKED;
            message = "Certificate revoked: " + revocation.map(RevocationRecord::getReason)
                    .orElse(certificate.getRevocationReason());
        } else if (certificate.isExpiredAt(now)) {
            status = VerificationResult.EXPIRED;
            message = "Certificate has expired";
        } else if (certificate.getStatus() == CertificateStatus.SUPERSEDED) {
            status = VerificationResult.INVALID;
            message = "Certificate has been superseded by a newer version";
        } else {
            status = VerificationResult.VALID;
            message = "Certificate is valid";
            try {
                signingService.verifySignature(certificate);
            } catch (CryptoException | KeyUnavailableException e) {
                log.warn("Certificate {} failed signature verification: {}", certificateId, e.getMessage());
                status = VerificationResult.INVALID;
                message = "Certificate signature is invalid: " + e.getMessage();
            }
        }

        recordVerification(certificateId, certificate.getAgentId(), requestIp, action, now, status, message, started);
        return CertificateVerificationResponse.builder()
                .valid(status == VerificationResult.VALID)
                .status(status)
                .message(message)
                .certificateId(certificate.getId())
                .agentId(certificate.getAgentId())
                .organizationId(certificate.getOrganizationId())
                .organizationName(certificate.getOrganizationName())
                .level(certificate.getLevel())
                .issuedAt(certificate.getIssuedAt())
                .expiresAt(certificate.getExpiresAt())
                .build();
    }

    public LiveVerificationResult verifyLiveAgent(VerificationTarget target) {
        return liveVerificationService.verify(target);
    }

    public List<LiveVerificationResult> verifyLiveAgents(List<VerificationTarget> targets) {
        return liveVerificationService.verifyBatch(targets);
    }

    /**
     * Issuer identity and the public key relying parties verify certificates with
     */
    public AuthorityInfoResponse getAuthorityInfo() {
        CaKeyRecord key = registry.getActiveKey()
                .orElseThrow(() -> new KeyUnavailableException("No active CA signing key"));
        return AuthorityInfoResponse.builder()
                .issuerId(signingService.getIssuerId())
                .issuerName(signingService.getIssuerName())
                .keyId(key.getId())
                .keyAlgorithm(key.getAlgorithm())
                .signatureAlgorithm(CaKeyAlgorithm.fromName(key.getAlgorithm()).getSignatureAlgorithm())
                .publicKeyPem(signingService.getPublicKeyPem(key.getId()))
                .supportedLevels(Arrays.stream(CgaLevel.values()).map(Enum::name).collect(Collectors.toList()))
                .build();
    }

    /**
     * Active certificates expiring within the given number of days
     */
    public List<CertificateRecord> listExpiring(int days) {
        if (days <= 0) {
            throw new ValidationException("Days must be positive", Map.of("days", "must be greater than 0"));
        }
        return renewalService.computeRenewalCandidates(Duration.ofDays(days));
    }

    public RenewalRunSummary runRenewals() {
        return renewalService.processRenewals();
    }

    public ManualRenewalResponse requestManualRenewal(String certificateId, String actor) {
        return renewalService.requestManualRenewal(certificateId, actor);
    }

    public VerificationMetricsResponse getMetrics() {
        return metricsService.calculateMetrics();
    }

    private void recordVerification(String certificateId, String agentId, String requestIp, String action,
                                    Instant timestamp, VerificationResult result, String details, long startedNanos) {
        registry.appendVerification(VerificationHistoryRecord.builder()
                .certificateId(certificateId)
                .agentId(agentId)
                .requestIp(requestIp)
                .requestAction(action)
                .requestTimestamp(timestamp)
                .result(result)
                .resultDetails(details)
                .durationMs((System.nanoTime() - startedNanos) / 1_000_000)
                .build());
    }
}
