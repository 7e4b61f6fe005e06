package com.wpanther.cgaca.repository;

import com.wpanther.cgaca.entity.VerificationHistoryRecord;
import com.wpanther.cgaca.entity.VerificationResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface VerificationHistoryRepository extends JpaRepository<VerificationHistoryRecord, Long> {

    /**
     * Find the latest verification attempts for a certificate
     */
    List<VerificationHistoryRecord> findByCertificateIdOrderByRequestTimestampDesc(String certificateId, Pageable pageable);

    List<VerificationHistoryRecord> findByAgentIdOrderByRequestTimestampDesc(String agentId);

    List<VerificationHistoryRecord> findByRequestTimestampBetween(Instant start, Instant end);

    long countByResult(VerificationResult result);

    /**
     * Count verification attempts grouped by result
     */
    @Query("SELECT v.result, COUNT(v) FROM VerificationHistoryRecord v GROUP BY v.result")
    List<Object[]> countGroupedByResult();
}
