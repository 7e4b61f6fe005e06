package com.wpanther.cgaca.scheduler;

import com.wpanther.cgaca.dto.RenewalRunSummary;
import com.wpanther.cgaca.registry.CertificateRegistry;
import com.wpanther.cgaca.service.RenewalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Scheduled certificate renewal and OCSP cache hygiene
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class CertificateRenewalScheduler {

    private final RenewalService renewalService;
    private final CertificateRegistry registry;
    private final Clock clock;

    /**
     * Renews certificates entering the renewal window
     * Runs daily at 3 AM by default (configurable via app.renewal.cron)
     */
    @Scheduled(cron = "${app.renewal.cron:0 0 3 * * *}")
    public void renewExpiringCertificates() {
        log.info("Starting scheduled certificate renewal");

        try {
            RenewalRunSummary summary = renewalService.processRenewals();
            if (summary.exitCode() != 0) {
                log.warn("Scheduled renewal finished with {} failure(s) out of {} candidate(s)",
                        summary.getFailed(), summary.getCandidates());
            }
        } catch (Exception e) {
            log.error("Error during scheduled certificate renewal", e);
        }
    }

    /**
     * Deletes OCSP cache rows whose validity window has closed
     * Runs every 15 minutes by default (configurable via app.ocsp.cleanup-cron)
     */
    @Scheduled(cron = "${app.ocsp.cleanup-cron:0 */15 * * * *}")
    public void cleanupStaleOcspResponses() {
        log.debug("Starting OCSP cache cleanup");

        try {
            int deleted = registry.deleteStaleOcspCacheEntries(Instant.now(clock));
            log.info("OCSP cache cleanup completed: {} stale response(s) deleted", deleted);
        } catch (Exception e) {
            log.error("Error during OCSP cache cleanup", e);
        }
    }
}
