package com.wpanther.cgaca.repository;

import com.wpanther.cgaca.entity.AuditLogRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogRecord, Long> {

    /**
     * Find audit entries for a resource, oldest first
     */
    List<AuditLogRecord> findByResourceTypeAndResourceIdOrderByIdAsc(String resourceType, String resourceId);

    List<AuditLogRecord> findByActionOrderByIdAsc(String action);

    List<AuditLogRecord> findByTimestampBetweenOrderByIdAsc(Instant start, Instant end);
}
