package com.wpanther.cgaca.service;

import com.wpanther.cgaca.dto.ManualRenewalResponse;
import com.wpanther.cgaca.dto.RenewalResult;
import com.wpanther.cgaca.dto.RenewalRunSummary;
import com.wpanther.cgaca.dto.SigningRequest;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CertificateStatus;
import com.wpanther.cgaca.entity.CgaLevel;
import com.wpanther.cgaca.exception.ConflictException;
import com.wpanther.cgaca.exception.StorageException;
import com.wpanther.cgaca.registry.CertificateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-issues certificates that are about to expire.
 * Every candidate is renewed in its own transaction so one failure never undoes another renewal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RenewalService {

    private static final String RENEWAL_ACTOR = "system";

    private final CertificateRegistry registry;
    private final SigningService signingService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Value("${app.renewal.window-days:14}")
    private int windowDays;

    @Value("${app.renewal.auto-renew-enabled:true}")
    private boolean autoRenewEnabled;

    // Levels above this one need a fresh verification instead of automatic renewal
    @Value("${app.renewal.max-auto-renew-level:GOLD}")
    private CgaLevel maxAutoRenewLevel;

    @Value("${app.renewal.verification-base-url:https://ca.example.com/renew}")
    private String verificationBaseUrl;

    /**
     * Active certificates expiring within the configured window
     */
    public List<CertificateRecord> computeRenewalCandidates() {
        return computeRenewalCandidates(Duration.ofDays(windowDays));
    }

    /**
     * Active certificates with now &lt; expiresAt &lt;= now + window
     */
    public List<CertificateRecord> computeRenewalCandidates(Duration window) {
        Instant now = now();
        return registry.findExpiringActive(now, now.plus(window));
    }

    /**
     * Runs one renewal sweep over the current candidates
     */
    public RenewalRunSummary processRenewals() {
        Instant startedAt = now();
        List<CertificateRecord> candidates = computeRenewalCandidates();
        log.info("Starting renewal run: {} candidate(s) within {} days", candidates.size(), windowDays);

        List<RenewalResult> results = new ArrayList<>();
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (CertificateRecord candidate : candidates) {
            RenewalResult result = processCandidate(candidate);
            results.add(result);
            switch (result.getOutcome()) {
                case RENEWED:
                    succeeded++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    skipped++;
            }
        }

        RenewalRunSummary summary = RenewalRunSummary.builder()
                .startedAt(startedAt)
                .finishedAt(now())
                .candidates(candidates.size())
                .succeeded(succeeded)
                .failed(failed)
                .skipped(skipped)
                .results(results)
                .build();
        log.info("Renewal run completed: {} renewed, {} failed, {} skipped", succeeded, failed, skipped);
        return summary;
    }

    /**
     * Re-issues one certificate with the same identity and attested content, a new validity
     * period from its level and certificateVersion + 1. The old record becomes SUPERSEDED.
     */
    @Transactional
    public RenewalResult renewCertificate(String certificateId) {
        CertificateRecord current = registry.lockCertificate(certificateId);
        if (current.getStatus() != CertificateStatus.ACTIVE) {
            throw new ConflictException("Certificate " + certificateId + " is " + current.getStatus()
                    + " and cannot be renewed");
        }

        SigningRequest request = SigningRequest.builder()
                .agentId(current.getAgentId())
                .agentVersion(current.getAgentVersion())
                .organizationId(current.getOrganizationId())
                .organizationName(current.getOrganizationName())
                .organizationDomain(current.getOrganizationDomain())
                .level(current.getLevel())
                .attestedContent(signingService.extractAttestedContent(current))
                .supersedesCertificateId(certificateId)
                .requestedBy(RENEWAL_ACTOR)
                .build();
        CertificateRecord renewed = signingService.sign(request);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previousCertificateId", certificateId);
        details.put("newCertificateId", renewed.getId());
        details.put("level", renewed.getLevel().name());
        registry.recordAudit(RENEWAL_ACTOR, "certificate_renewed", "certificate", renewed.getId(), details);

        log.info("Renewed certificate {} as {} (expires {})", certificateId, renewed.getId(), renewed.getExpiresAt());
        return RenewalResult.builder()
                .certificateId(certificateId)
                .outcome(RenewalResult.Outcome.RENEWED)
                .newCertificateId(renewed.getId())
                .build();
    }

    /**
     * Records a request to renew a certificate through re-verification
     */
    @Transactional
    public ManualRenewalResponse requestManualRenewal(String certificateId, String requestedBy) {
        CertificateRecord certificate = registry.requireCertificate(certificateId);
        String verificationUrl = verificationBaseUrl.endsWith("/")
                ? verificationBaseUrl + certificate.getId()
                : verificationBaseUrl + "/" + certificate.getId();

        registry.recordAudit(requestedBy != null ? requestedBy : "api", "manual_renewal_requested",
                "certificate", certificateId, Map.of("verificationUrl", verificationUrl));
        log.info("Manual renewal requested for certificate {}", certificateId);

        return ManualRenewalResponse.builder()
                .certificateId(certificateId)
                .verificationUrl(verificationUrl)
                .build();
    }

    // ------------------------------------------------------------------

    private RenewalResult processCandidate(CertificateRecord candidate) {
        if (candidate.getLevel().isAbove(maxAutoRenewLevel)) {
            log.info("Certificate {} at level {} requires re-verification for renewal",
                    candidate.getId(), candidate.getLevel());
            return RenewalResult.builder()
                    .certificateId(candidate.getId())
                    .outcome(RenewalResult.Outcome.SKIPPED)
                    .requiresVerification(true)
                    .error("Level " + candidate.getLevel() + " requires re-verification for renewal")
                    .build();
        }
        if (!autoRenewEnabled) {
            return RenewalResult.builder()
                    .certificateId(candidate.getId())
                    .outcome(RenewalResult.Outcome.SKIPPED)
                    .error("Auto-renewal disabled")
                    .build();
        }

        try {
            return transactionTemplate.execute(status -> renewCertificate(candidate.getId()));
        } catch (RuntimeException e) {
            log.error("Renewal of certificate {} failed", candidate.getId(), e);
            auditFailure(candidate.getId(), e);
            return RenewalResult.builder()
                    .certificateId(candidate.getId())
                    .outcome(RenewalResult.Outcome.FAILED)
                    .error(e.getMessage())
                    .build();
        }
    }

    private void auditFailure(String certificateId, RuntimeException cause) {
        try {
            registry.recordAudit(RENEWAL_ACTOR, "certificate_renewal_failed", "certificate", certificateId,
                    Map.of("error", String.valueOf(cause.getMessage())));
        } catch (StorageException e) {
            log.error("Could not audit renewal failure of certificate {}", certificateId, e);
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
