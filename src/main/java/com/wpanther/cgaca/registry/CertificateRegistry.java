package com.wpanther.cgaca.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.cgaca.entity.ActorType;
import com.wpanther.cgaca.entity.AuditLogRecord;
import com.wpanther.cgaca.entity.CaKeyRecord;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CertificateStatus;
import com.wpanther.cgaca.entity.KeyStatus;
import com.wpanther.cgaca.entity.OcspCacheEntry;
import com.wpanther.cgaca.entity.RevocationRecord;
import com.wpanther.cgaca.entity.VerificationHistoryRecord;
import com.wpanther.cgaca.entity.VerificationResult;
import com.wpanther.cgaca.exception.ConflictException;
import com.wpanther.cgaca.exception.NotFoundException;
import com.wpanther.cgaca.exception.StorageException;
import com.wpanther.cgaca.repository.AuditLogRepository;
import com.wpanther.cgaca.repository.CaKeyRecordRepository;
import com.wpanther.cgaca.repository.CertificateRecordRepository;
import com.wpanther.cgaca.repository.OcspCacheEntryRepository;
import com.wpanther.cgaca.repository.RevocationRecordRepository;
import com.wpanther.cgaca.repository.VerificationHistoryRepository;
import jakarta.persistence.EntityManager;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Single persistence handle shared by every CA component.
 * Status changes lock the certificate row and validate the current status before writing,
 * so concurrent revocation and renewal of one certificate cannot both succeed.
 * Constraint violations surface as {@link ConflictException}, every other persistence
 * failure as {@link StorageException}.
 */
@Service
@Slf4j
public class CertificateRegistry {

    private final CertificateRecordRepository certificateRepository;
    private final RevocationRecordRepository revocationRepository;
    private final OcspCacheEntryRepository ocspCacheRepository;
    private final VerificationHistoryRepository verificationRepository;
    private final CaKeyRecordRepository keyRepository;
    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate independentTransaction;
    private final EntityManager entityManager;

    public CertificateRegistry(CertificateRecordRepository certificateRepository,
                               RevocationRecordRepository revocationRepository,
                               OcspCacheEntryRepository ocspCacheRepository,
                               VerificationHistoryRepository verificationRepository,
                               CaKeyRecordRepository keyRepository,
                               AuditLogRepository auditLogRepository,
                               ObjectMapper objectMapper,
                               Clock clock,
                               PlatformTransactionManager transactionManager,
                               EntityManager entityManager) {
        this.certificateRepository = certificateRepository;
        this.revocationRepository = revocationRepository;
        this.ocspCacheRepository = ocspCacheRepository;
        this.verificationRepository = verificationRepository;
        this.keyRepository = keyRepository;
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.independentTransaction = new TransactionTemplate(transactionManager);
        this.independentTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.entityManager = entityManager;
    }

    // ------------------------------------------------------------------
    // Certificates
    // ------------------------------------------------------------------

    /**
     * Inserts a new certificate. Never overwrites: an existing id or identity version is a conflict.
     */
    @Transactional
    public CertificateRecord insertCertificate(CertificateRecord certificate) {
        Instant now = now();
        if (certificate.getCreatedAt() == null) {
            certificate.setCreatedAt(now);
        }
        certificate.setUpdatedAt(now);

        return write("insert certificate " + certificate.getId(), () -> {
            if (certificateRepository.existsById(certificate.getId())) {
                throw new ConflictException("Certificate already exists: " + certificate.getId());
            }
            try {
                return certificateRepository.saveAndFlush(certificate);
            } catch (DataIntegrityViolationException e) {
                throw new ConflictException(String.format(
                        "Certificate already exists for agent %s version %s in organization %s",
                        certificate.getAgentId(), certificate.getAgentVersion(), certificate.getOrganizationId()), e);
            }
        });
    }

    @Transactional(readOnly = true)
    public Optional<CertificateRecord> findCertificate(String certificateId) {
        return read(() -> certificateRepository.findById(certificateId));
    }

    @Transactional(readOnly = true)
    public CertificateRecord requireCertificate(String certificateId) {
        return findCertificate(certificateId)
                .orElseThrow(() -> new NotFoundException("Certificate not found: " + certificateId));
    }

    /**
     * Latest record of an identity, which is the only one that is not superseded
     */
    @Transactional(readOnly = true)
    public Optional<CertificateRecord> findCurrentByIdentity(String agentId, String agentVersion, String organizationId) {
        return read(() -> certificateRepository
                .findByAgentIdAndAgentVersionAndOrganizationIdOrderByCertificateVersionDesc(
                        agentId, agentVersion, organizationId)
                .stream()
                .findFirst());
    }

    @Transactional(readOnly = true)
    public boolean identityExists(String agentId, String agentVersion, String organizationId) {
        return read(() -> certificateRepository.existsByAgentIdAndAgentVersionAndOrganizationId(
                agentId, agentVersion, organizationId));
    }

    @Transactional(readOnly = true)
    public List<CertificateRecord> listByAgent(String agentId) {
        return read(() -> certificateRepository.findByAgentIdOrderByCreatedAtDesc(agentId));
    }

    @Transactional(readOnly = true)
    public List<CertificateRecord> listByOrganization(String organizationId) {
        return read(() -> certificateRepository.findByOrganizationIdOrderByCreatedAtDesc(organizationId));
    }

    /**
     * Active certificates with from &lt; expiresAt &lt;= until, soonest expiry first
     */
    @Transactional(readOnly = true)
    public List<CertificateRecord> findExpiringActive(Instant from, Instant until) {
        return read(() -> certificateRepository
                .findByStatusAndExpiresAtGreaterThanAndExpiresAtLessThanEqualOrderByExpiresAtAsc(
                        CertificateStatus.ACTIVE, from, until));
    }

    /**
     * Locks the certificate row for the rest of the surrounding transaction.
     * The returned record is reloaded after the lock is held: an instance read earlier in the
     * same transaction may carry a status that a concurrent writer has since committed over.
     */
    @Transactional
    public CertificateRecord lockCertificate(String certificateId) {
        return write("lock certificate " + certificateId, () -> {
            CertificateRecord certificate = certificateRepository.findByIdForUpdate(certificateId)
                    .orElseThrow(() -> new NotFoundException("Certificate not found: " + certificateId));
            entityManager.refresh(certificate);
            return certificate;
        });
    }

    /**
     * Moves a certificate to a new status after checking, under a row lock, that its
     * current status is one of the allowed ones.
     */
    @Transactional
    public CertificateRecord transitionStatus(String certificateId, Set<CertificateStatus> allowedFrom,
                                              CertificateStatus target, String reason) {
        CertificateRecord certificate = lockCertificate(certificateId);
        if (!allowedFrom.contains(certificate.getStatus())) {
            throw new ConflictException(String.format("Certificate %s is %s and cannot become %s",
                    certificateId, certificate.getStatus(), target));
        }

        Instant now = now();
        certificate.setStatus(target);
        certificate.setUpdatedAt(now);
        if (target == CertificateStatus.REVOKED) {
            certificate.setRevokedAt(now);
            certificate.setRevocationReason(reason);
        }
        log.debug("Certificate {} transitioned to {}", certificateId, target);
        return write("update certificate " + certificateId, () -> certificateRepository.saveAndFlush(certificate));
    }

    // ------------------------------------------------------------------
    // Revocations
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<RevocationRecord> findRevocation(String certificateId) {
        return read(() -> revocationRepository.findByCertificateId(certificateId));
    }

    @Transactional
    public RevocationRecord insertRevocation(RevocationRecord revocation) {
        return write("insert revocation for " + revocation.getCertificateId(), () -> {
            try {
                return revocationRepository.saveAndFlush(revocation);
            } catch (DataIntegrityViolationException e) {
                throw new ConflictException("Certificate already revoked: " + revocation.getCertificateId(), e);
            }
        });
    }

    @Transactional(readOnly = true)
    public List<RevocationRecord> listRevocations() {
        return read(revocationRepository::findAllByOrderByRevokedAtAsc);
    }

    @Transactional(readOnly = true)
    public long countRevocations(String certificateId) {
        return read(() -> revocationRepository.countByCertificateId(certificateId));
    }

    // ------------------------------------------------------------------
    // OCSP cache
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<OcspCacheEntry> findOcspCacheEntry(String certificateId) {
        return read(() -> ocspCacheRepository.findById(certificateId));
    }

    /**
     * Replaces the single cache row of a certificate in a transaction of its own.
     *
     * @return false when a concurrent writer inserted the row first; its response is equivalent
     */
    public boolean storeOcspCacheEntry(OcspCacheEntry entry) {
        try {
            independentTransaction.executeWithoutResult(status -> {
                OcspCacheEntry row = ocspCacheRepository.findById(entry.getCertificateId()).orElse(entry);
                row.setCertStatus(entry.getCertStatus());
                row.setResponseBytes(entry.getResponseBytes());
                row.setProducedAt(entry.getProducedAt());
                row.setThisUpdate(entry.getThisUpdate());
                row.setNextUpdate(entry.getNextUpdate());
                ocspCacheRepository.saveAndFlush(row);
            });
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent OCSP cache write for certificate {}, keeping the other response",
                    entry.getCertificateId());
            return false;
        } catch (DataAccessException e) {
            throw storageFailure("store OCSP cache entry for " + entry.getCertificateId(), e);
        }
    }

    @Transactional
    public boolean invalidateOcspCache(String certificateId) {
        return write("invalidate OCSP cache for " + certificateId, () -> {
            if (!ocspCacheRepository.existsById(certificateId)) {
                return false;
            }
            ocspCacheRepository.deleteById(certificateId);
            ocspCacheRepository.flush();
            return true;
        });
    }

    @Transactional
    public int deleteStaleOcspCacheEntries(Instant now) {
        return write("delete stale OCSP cache entries", () -> ocspCacheRepository.deleteByNextUpdateNotAfter(now));
    }

    // ------------------------------------------------------------------
    // Verification history
    // ------------------------------------------------------------------

    @Transactional
    public VerificationHistoryRecord appendVerification(VerificationHistoryRecord record) {
        if (record.getRequestTimestamp() == null) {
            record.setRequestTimestamp(now());
        }
        return write("append verification history for agent " + record.getAgentId(),
                () -> verificationRepository.save(record));
    }

    @Transactional(readOnly = true)
    public List<VerificationHistoryRecord> verificationHistory(String certificateId, int limit) {
        return read(() -> verificationRepository.findByCertificateIdOrderByRequestTimestampDesc(
                certificateId, PageRequest.of(0, limit)));
    }

    @Transactional(readOnly = true)
    public List<VerificationHistoryRecord> verificationHistoryForAgent(String agentId) {
        return read(() -> verificationRepository.findByAgentIdOrderByRequestTimestampDesc(agentId));
    }

    @Transactional(readOnly = true)
    public List<VerificationHistoryRecord> verificationsBetween(Instant start, Instant end) {
        return read(() -> verificationRepository.findByRequestTimestampBetween(start, end));
    }

    // ------------------------------------------------------------------
    // CA keys
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<CaKeyRecord> getActiveKey() {
        return read(keyRepository::findActive);
    }

    /**
     * Active key, row locked for the rest of the surrounding transaction.
     * Issuance holds this lock so that it is serialized with other issuance and with key rotation.
     */
    @Transactional
    public Optional<CaKeyRecord> lockActiveKey() {
        return write("lock active CA key",
                () -> keyRepository.findByStatusForUpdate(KeyStatus.ACTIVE).stream().findFirst());
    }

    @Transactional(readOnly = true)
    public Optional<CaKeyRecord> findKey(String keyId) {
        return read(() -> keyRepository.findById(keyId));
    }

    @Transactional(readOnly = true)
    public List<CaKeyRecord> listKeys() {
        return read(keyRepository::findAllByOrderByCreatedAtAsc);
    }

    /**
     * Installs a new active key. Any current active key becomes ROTATED in the same transaction.
     *
     * @return the key that was active before, if any
     */
    @Transactional
    public Optional<CaKeyRecord> activateKey(CaKeyRecord newKey) {
        Instant now = now();
        return write("activate CA key " + newKey.getId(), () -> {
            List<CaKeyRecord> active = keyRepository.findByStatusForUpdate(KeyStatus.ACTIVE);
            for (CaKeyRecord key : active) {
                key.setStatus(KeyStatus.ROTATED);
                key.setRotatedAt(now);
                keyRepository.save(key);
            }

            newKey.setStatus(KeyStatus.ACTIVE);
            if (newKey.getCreatedAt() == null) {
                newKey.setCreatedAt(now);
            }
            keyRepository.saveAndFlush(newKey);

            if (keyRepository.countByStatus(KeyStatus.ACTIVE) != 1) {
                throw new ConflictException("Concurrent key activation detected, retry key generation");
            }
            return active.stream().findFirst();
        });
    }

    @Transactional
    public void incrementKeyUsage(String keyId) {
        write("increment usage of CA key " + keyId, () -> keyRepository.incrementCertificatesSigned(keyId));
    }

    // ------------------------------------------------------------------
    // Audit
    // ------------------------------------------------------------------

    /**
     * Appends an audit entry. Failures are raised, never dropped.
     *
     * @param actor   "system", "api", "admin:alice", ...
     * @param details serialized as JSON, may be null
     */
    @Transactional
    public AuditLogRecord recordAudit(String actor, String action, String resourceType, String resourceId,
                                      Object details) {
        ActorRef actorRef = ActorRef.parse(actor);
        AuditLogRecord entry = AuditLogRecord.builder()
                .timestamp(now())
                .actorType(actorRef.getType())
                .actorId(actorRef.getId())
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .details(toJson(details))
                .build();
        return write("record audit " + action + " on " + resourceType + " " + resourceId,
                () -> auditLogRepository.save(entry));
    }

    @Transactional(readOnly = true)
    public List<AuditLogRecord> auditTrail(String resourceType, String resourceId) {
        return read(() -> auditLogRepository.findByResourceTypeAndResourceIdOrderByIdAsc(resourceType, resourceId));
    }

    @Transactional(readOnly = true)
    public List<AuditLogRecord> auditByAction(String action) {
        return read(() -> auditLogRepository.findByActionOrderByIdAsc(action));
    }

    // ------------------------------------------------------------------
    // Counts
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Map<String, Long> countCertificatesByStatus() {
        return read(() -> {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (CertificateStatus status : CertificateStatus.values()) {
                counts.put(status.name(), certificateRepository.countByStatus(status));
            }
            return counts;
        });
    }

    @Transactional(readOnly = true)
    public Map<String, Long> countActiveCertificatesByLevel() {
        return read(() -> groupCounts(certificateRepository.countByLevelForStatus(CertificateStatus.ACTIVE)));
    }

    @Transactional(readOnly = true)
    public Map<String, Long> countVerificationsByResult() {
        return read(() -> {
            Map<VerificationResult, Long> byResult = new EnumMap<>(VerificationResult.class);
            for (Object[] row : verificationRepository.countGroupedByResult()) {
                byResult.put((VerificationResult) row[0], (Long) row[1]);
            }
            Map<String, Long> counts = new LinkedHashMap<>();
            for (VerificationResult result : VerificationResult.values()) {
                counts.put(result.name(), byResult.getOrDefault(result, 0L));
            }
            return counts;
        });
    }

    @Transactional(readOnly = true)
    public long countAllRevocations() {
        return read(revocationRepository::count);
    }

    // ------------------------------------------------------------------

    private Map<String, Long> groupCounts(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : rows) {
            counts.put(String.valueOf(row[0]), (Long) row[1]);
        }
        return counts;
    }

    private String toJson(Object details) {
        if (details == null) {
            return null;
        }
        if (details instanceof String) {
            return (String) details;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new StorageException("Audit details cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private <T> T read(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw storageFailure("read registry", e);
        }
    }

    private <T> T write(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            throw storageFailure(operation, e);
        }
    }

    private StorageException storageFailure(String operation, DataAccessException e) {
        log.error("Registry failure during {}", operation, e);
        return new StorageException("Failed to " + operation + ": " + e.getMostSpecificCause().getMessage(), e);
    }

    /**
     * Actor string split into type and id: "admin:alice" is (ADMIN, alice),
     * "system" is (SYSTEM, null), anything unrecognised is an API caller.
     */
    @Getter
    @AllArgsConstructor
    static final class ActorRef {

        private final ActorType type;
        private final String id;

        static ActorRef parse(String actor) {
            if (actor == null || actor.isBlank()) {
                return new ActorRef(ActorType.SYSTEM, null);
            }
            String trimmed = actor.trim();
            int separator = trimmed.indexOf(':');
            String prefix = separator >= 0 ? trimmed.substring(0, separator) : trimmed;
            String id = separator >= 0 ? trimmed.substring(separator + 1) : null;
            for (ActorType type : ActorType.values()) {
                if (type.name().equals(prefix.toUpperCase(Locale.ROOT))) {
                    return new ActorRef(type, id == null || id.isEmpty() ? null : id);
                }
            }
            return new ActorRef(ActorType.API, trimmed);
        }
    }
}
