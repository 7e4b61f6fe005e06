package com.wpanther.cgaca.service;

import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CertificateStatus;
import com.wpanther.cgaca.entity.RevocationRecord;
import com.wpanther.cgaca.exception.ValidationException;
import com.wpanther.cgaca.registry.CertificateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class RevocationService {

    private final CertificateRegistry registry;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    /**
     * Revokes a certificate. Repeating the call returns the original revocation unchanged.
     * Active, superseded and expired certificates can all be revoked; the OCSP cache entry
     * is dropped in every case so the next status query is recomputed.
     */
    @Transactional
    public RevocationRecord revoke(String certificateId, String reason, String revokedBy, String incidentId) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Revocation reason is required", Map.of("reason", "must not be blank"));
        }

        CertificateRecord certificate = registry.lockCertificate(certificateId);
        CertificateStatus previousStatus = certificate.getStatus();

        Optional<RevocationRecord> existing = registry.findRevocation(certificateId);
        if (existing.isPresent()) {
            log.debug("Certificate {} already revoked at {}", certificateId, existing.get().getRevokedAt());
            registry.invalidateOcspCache(certificateId);
            return existing.get();
        }

        registry.transitionStatus(certificateId,
                EnumSet.of(CertificateStatus.ACTIVE, CertificateStatus.SUPERSEDED, CertificateStatus.EXPIRED),
                CertificateStatus.REVOKED, reason);

        RevocationRecord revocation = registry.insertRevocation(RevocationRecord.builder()
                .certificateId(certificateId)
                .revokedAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                .reason(reason)
                .revokedBy(revokedBy != null ? revokedBy : "system")
                .incidentId(incidentId)
                .build());

        registry.invalidateOcspCache(certificateId);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("previousStatus", previousStatus.name());
        details.put("agentId", certificate.getAgentId());
        details.put("organizationId", certificate.getOrganizationId());
        if (incidentId != null) {
            details.put("incidentId", incidentId);
        }
        registry.recordAudit(revokedBy, "certificate_revoked", "certificate", certificateId, details);

        log.info("Revoked certificate {} for agent {}: {}", certificateId, certificate.getAgentId(), reason);
        return revocation;
    }

    /**
     * Revokes several certificates, each in its own transaction.
     * A failing id is logged and skipped; the others are still revoked.
     *
     * @return revocations that succeeded, in input order
     */
    public List<RevocationRecord> revokeAll(List<String> certificateIds, String reason, String revokedBy,
                                            String incidentId) {
        List<RevocationRecord> revoked = new ArrayList<>();
        for (String certificateId : certificateIds) {
            try {
                revoked.add(transactionTemplate.execute(
                        status -> revoke(certificateId, reason, revokedBy, incidentId)));
            } catch (RuntimeException e) {
                log.error("Failed to revoke certificate {} (incident {}): {}", certificateId, incidentId, e.getMessage());
            }
        }
        log.info("Batch revocation finished: {} of {} certificates revoked", revoked.size(), certificateIds.size());
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<RevocationRecord> listRevocations() {
        return registry.listRevocations();
    }

    @Transactional(readOnly = true)
    public Optional<RevocationRecord> findRevocation(String certificateId) {
        return registry.findRevocation(certificateId);
    }
}
