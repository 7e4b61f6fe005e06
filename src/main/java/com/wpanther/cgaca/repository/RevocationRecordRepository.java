package com.wpanther.cgaca.repository;

import com.wpanther.cgaca.entity.RevocationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RevocationRecordRepository extends JpaRepository<RevocationRecord, Long> {

    Optional<RevocationRecord> findByCertificateId(String certificateId);

    boolean existsByCertificateId(String certificateId);

    long countByCertificateId(String certificateId);

    List<RevocationRecord> findAllByOrderByRevokedAtAsc();
}
