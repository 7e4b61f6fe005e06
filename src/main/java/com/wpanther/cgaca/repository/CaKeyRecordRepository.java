package com.wpanther.cgaca.repository;

import com.wpanther.cgaca.entity.CaKeyRecord;
import com.wpanther.cgaca.entity.KeyStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CaKeyRecordRepository extends JpaRepository<CaKeyRecord, String> {

    List<CaKeyRecord> findByStatus(KeyStatus status);

    /**
     * Lock the active key rows while a successor is installed
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT k FROM CaKeyRecord k WHERE k.status = :status")
    List<CaKeyRecord> findByStatusForUpdate(@Param("status") KeyStatus status);

    long countByStatus(KeyStatus status);

    List<CaKeyRecord> findAllByOrderByCreatedAtAsc();

    /**
     * Bump the usage counter without loading the entity
     */
    @Modifying
    @Query("UPDATE CaKeyRecord k SET k.certificatesSigned = k.certificatesSigned + 1 WHERE k.id = :id")
    int incrementCertificatesSigned(@Param("id") String id);

    default Optional<CaKeyRecord> findActive() {
        return findByStatus(KeyStatus.ACTIVE).stream().findFirst();
    }
}
