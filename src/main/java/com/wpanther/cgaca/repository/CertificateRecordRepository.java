package com.wpanther.cgaca.repository;

import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CertificateStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface CertificateRecordRepository extends JpaRepository<CertificateRecord, String> {

    /**
     * Find a certificate and lock its row for a status transition
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CertificateRecord c WHERE c.id = :id")
    Optional<CertificateRecord> findByIdForUpdate(@Param("id") String id);

    /**
     * Find every record of an identity, newest version first
     */
    List<CertificateRecord> findByAgentIdAndAgentVersionAndOrganizationIdOrderByCertificateVersionDesc(
            String agentId, String agentVersion, String organizationId);

    boolean existsByAgentIdAndAgentVersionAndOrganizationId(
            String agentId, String agentVersion, String organizationId);

    List<CertificateRecord> findByAgentIdOrderByCreatedAtDesc(String agentId);

    List<CertificateRecord> findByOrganizationIdOrderByCreatedAtDesc(String organizationId);

    /**
     * Find active certificates expiring in (from, until], soonest first
     */
    List<CertificateRecord> findByStatusAndExpiresAtGreaterThanAndExpiresAtLessThanEqualOrderByExpiresAtAsc(
            CertificateStatus status, Instant from, Instant until);

    long countByStatus(CertificateStatus status);

    @Query("SELECT c.level, COUNT(c) FROM CertificateRecord c WHERE c.status = :status GROUP BY c.level")
    List<Object[]> countByLevelForStatus(@Param("status") CertificateStatus status);
}
