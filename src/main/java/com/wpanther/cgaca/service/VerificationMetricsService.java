package com.wpanther.cgaca.service;

import com.wpanther.cgaca.dto.VerificationMetricsResponse;
import com.wpanther.cgaca.entity.VerificationHistoryRecord;
import com.wpanther.cgaca.registry.CertificateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Service for calculating registry and verification metrics
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VerificationMetricsService {

    private final CertificateRegistry registry;
    private final Clock clock;

    @Transactional(readOnly = true)
    public VerificationMetricsResponse calculateMetrics() {
        log.debug("Calculating certificate authority metrics");

        Instant now = Instant.now(clock);
        List<VerificationHistoryRecord> lastMonth = registry.verificationsBetween(now.minus(30, ChronoUnit.DAYS), now);

        return VerificationMetricsResponse.builder()
                .certificatesByStatus(registry.countCertificatesByStatus())
                .activeCertificatesByLevel(registry.countActiveCertificatesByLevel())
                .verificationsByResult(registry.countVerificationsByResult())
                .verificationsLast24Hours(countSince(lastMonth, now.minus(24, ChronoUnit.HOURS)))
                .verificationsLast7Days(countSince(lastMonth, now.minus(7, ChronoUnit.DAYS)))
                .verificationsLast30Days(lastMonth.size())
                .revocations(registry.countAllRevocations())
                .timestamp(now)
                .build();
    }

    /**
     * Counts verifications at or after start
     */
    private long countSince(List<VerificationHistoryRecord> records, Instant start) {
        return records.stream()
                .filter(record -> !record.getRequestTimestamp().isBefore(start))
                .count();
    }
}
