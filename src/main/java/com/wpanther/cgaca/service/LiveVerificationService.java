package com.wpanther.cgaca.service;

import com.wpanther.cgaca.dto.verification.LiveAgentState;
import com.wpanther.cgaca.dto.verification.LiveVerificationOutcome;
import com.wpanther.cgaca.dto.verification.LiveVerificationResult;
import com.wpanther.cgaca.dto.verification.ProbeCheck;
import com.wpanther.cgaca.dto.verification.VerificationTarget;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CertificateStatus;
import com.wpanther.cgaca.entity.VerificationHistoryRecord;
import com.wpanther.cgaca.entity.VerificationResult;
import com.wpanther.cgaca.exception.ValidationException;
import com.wpanther.cgaca.registry.CertificateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Compares what a running agent reports with its certificate.
 * Every attempt is written to the verification history, whatever the outcome.
 * Repeated failures of the same certificate lead to automatic revocation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiveVerificationService {

    private static final String UNKNOWN_AGENT = "unknown";

    private final CertificateRegistry registry;
    private final RevocationService revocationService;
    private final ObjectProvider<AgentStateProbe> agentStateProbe;
    private final Clock clock;

    // Failed live verifications in a row per certificate id
    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();

    // 0 disables automatic revocation
    @Value("${app.verification.max-consecutive-failures:3}")
    private int maxConsecutiveFailures;

    public LiveVerificationResult verify(VerificationTarget target) {
        if (target == null) {
            throw new ValidationException("Verification target is required");
        }
        long started = System.nanoTime();
        Instant timestamp = now();

        Optional<CertificateRecord> resolved = resolveCertificate(target);
        if (resolved.isEmpty()) {
            String details = "No certificate found for " + describe(target);
            long durationMs = elapsedMs(started);
            appendHistory(target, null, VerificationResult.UNKNOWN, details, timestamp, durationMs);
            log.info("Live verification of {}: no certificate", describe(target));
            return LiveVerificationResult.builder()
                    .certificateId(target.getCertificateId())
                    .agentId(target.getAgentId())
                    .outcome(LiveVerificationOutcome.INVALID)
                    .details(details)
                    .checks(Collections.emptyList())
                    .timestamp(timestamp)
                    .durationMs(durationMs)
                    .build();
        }

        CertificateRecord certificate = resolved.get();
        List<ProbeCheck> checks = new ArrayList<>();
        Evaluation evaluation = evaluate(certificate, target, timestamp, checks);
        long durationMs = elapsedMs(started);

        appendHistory(target, certificate, evaluation.outcome.getHistoryResult(), evaluation.details,
                timestamp, durationMs);
        boolean autoRevoked = trackFailures(certificate, evaluation.outcome);

        log.info("Live verification of certificate {} for agent {}: {} ({} ms)",
                certificate.getId(), certificate.getAgentId(), evaluation.outcome, durationMs);
        return LiveVerificationResult.builder()
                .certificateId(certificate.getId())
                .agentId(certificate.getAgentId())
                .outcome(evaluation.outcome)
                .details(evaluation.details)
                .checks(checks)
                .timestamp(timestamp)
                .durationMs(durationMs)
                .autoRevoked(autoRevoked)
                .build();
    }

    /**
     * Verifies each target independently; a target that throws yields an INVALID result
     */
    public List<LiveVerificationResult> verifyBatch(List<VerificationTarget> targets) {
        List<LiveVerificationResult> results = new ArrayList<>(targets.size());
        for (VerificationTarget target : targets) {
            try {
                results.add(verify(target));
            } catch (RuntimeException e) {
                log.error("Live verification of {} failed", target != null ? describe(target) : "null target", e);
                results.add(LiveVerificationResult.builder()
                        .certificateId(target != null ? target.getCertificateId() : null)
                        .agentId(target != null ? target.getAgentId() : null)
                        .outcome(LiveVerificationOutcome.INVALID)
                        .details("Verification error: " + e.getMessage())
                        .checks(Collections.emptyList())
                        .timestamp(now())
                        .build());
            }
        }
        return results;
    }

    public int getConsecutiveFailures(String certificateId) {
        return consecutiveFailures.getOrDefault(certificateId, 0);
    }

    public void resetFailures(String certificateId) {
        consecutiveFailures.remove(certificateId);
    }

    // ------------------------------------------------------------------

    private Optional<CertificateRecord> resolveCertificate(VerificationTarget target) {
        if (target.getCertificateId() != null) {
            return registry.findCertificate(target.getCertificateId());
        }
        if (target.getAgentId() == null || target.getAgentVersion() == null || target.getOrganizationId() == null) {
            throw new ValidationException("Either a certificate id or agent id, version and organization are required");
        }
        return registry.findCurrentByIdentity(target.getAgentId(), target.getAgentVersion(), target.getOrganizationId());
    }

    // Revoked, then expired, then golden thread mismatch, then failed checks
    private Evaluation evaluate(CertificateRecord certificate, VerificationTarget target, Instant now,
                                List<ProbeCheck> checks) {
        if (certificate.getStatus() == CertificateStatus.REVOKED
                || registry.findRevocation(certificate.getId()).isPresent()) {
            return new Evaluation(LiveVerificationOutcome.REVOKED, "Certificate has been revoked");
        }
        if (certificate.isExpiredAt(now)) {
            return new Evaluation(LiveVerificationOutcome.EXPIRED, "Certificate expired at " + certificate.getExpiresAt());
        }
        if (certificate.getStatus() == CertificateStatus.SUPERSEDED) {
            return new Evaluation(LiveVerificationOutcome.INVALID, "Certificate has been superseded");
        }

        AgentStateProbe probe = agentStateProbe.getIfAvailable();
        if (probe == null) {
            return new Evaluation(LiveVerificationOutcome.INVALID, "No agent state probe configured");
        }

        LiveAgentState state;
        try {
            state = probe.probe(certificate, target);
        } catch (RuntimeException e) {
            log.warn("Probe of agent {} failed: {}", certificate.getAgentId(), e.getMessage());
            return new Evaluation(LiveVerificationOutcome.INVALID, "Agent probe failed: " + e.getMessage());
        }
        if (state == null) {
            return new Evaluation(LiveVerificationOutcome.INVALID, "Agent reported no state");
        }
        if (state.getChecks() != null) {
            checks.addAll(state.getChecks());
        }

        if (state.getGoldenThreadHash() == null) {
            return new Evaluation(LiveVerificationOutcome.INVALID, "Agent did not report a golden thread hash");
        }
        if (!state.getGoldenThreadHash().equalsIgnoreCase(certificate.getGoldenThreadHash())) {
            return new Evaluation(LiveVerificationOutcome.MISMATCH, "Golden thread mismatch: certified "
                    + certificate.getGoldenThreadHash() + ", running " + state.getGoldenThreadHash());
        }

        List<String> failed = checks.stream()
                .filter(check -> !check.isPassed())
                .map(ProbeCheck::getName)
                .collect(Collectors.toList());
        if (!failed.isEmpty()) {
            return new Evaluation(LiveVerificationOutcome.INVALID, "Failed checks: " + String.join(", ", failed));
        }
        return new Evaluation(LiveVerificationOutcome.VALID, "Agent matches its certificate");
    }

    /**
     * @return true when this failure triggered automatic revocation
     */
    private boolean trackFailures(CertificateRecord certificate, LiveVerificationOutcome outcome) {
        // Only active certificates can be auto-revoked, so only they are counted
        if (outcome == LiveVerificationOutcome.VALID || maxConsecutiveFailures <= 0
                || certificate.getStatus() != CertificateStatus.ACTIVE) {
            consecutiveFailures.remove(certificate.getId());
            return false;
        }
        if (outcome != LiveVerificationOutcome.INVALID && outcome != LiveVerificationOutcome.MISMATCH) {
            return false;
        }

        int failures = consecutiveFailures.merge(certificate.getId(), 1, Integer::sum);
        if (failures < maxConsecutiveFailures) {
            return false;
        }

        consecutiveFailures.remove(certificate.getId());
        try {
            revocationService.revoke(certificate.getId(),
                    "Live verification failed " + failures + " consecutive times", "system", null);
            log.warn("Certificate {} auto-revoked after {} failed live verifications", certificate.getId(), failures);
            return true;
        } catch (RuntimeException e) {
            log.error("Automatic revocation of certificate {} failed", certificate.getId(), e);
            return false;
        }
    }

    private void appendHistory(VerificationTarget target, CertificateRecord certificate, VerificationResult result,
                               String details, Instant timestamp, long durationMs) {
        String agentId = certificate != null ? certificate.getAgentId() : target.getAgentId();
        registry.appendVerification(VerificationHistoryRecord.builder()
                .certificateId(certificate != null ? certificate.getId() : target.getCertificateId())
                .agentId(agentId != null ? agentId : UNKNOWN_AGENT)
                .requestIp(target.getRequestIp())
                .requestAction(target.getAction())
                .requestTimestamp(timestamp)
                .result(result)
                .resultDetails(details)
                .durationMs(durationMs)
                .build());
    }

    private String describe(VerificationTarget target) {
        if (target.getCertificateId() != null) {
            return "certificate " + target.getCertificateId();
        }
        return String.format("agent %s version %s in organization %s",
                target.getAgentId(), target.getAgentVersion(), target.getOrganizationId());
    }

    private long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static final class Evaluation {
        private final LiveVerificationOutcome outcome;
        private final String details;

        private Evaluation(LiveVerificationOutcome outcome, String details) {
            this.outcome = outcome;
            this.details = details;
        }
    }
}
