package com.wpanther.cgaca.scheduler;

import com.wpanther.cgaca.dto.RenewalRunSummary;
import com.wpanther.cgaca.exception.StorageException;
import com.wpanther.cgaca.registry.CertificateRegistry;
import com.wpanther.cgaca.service.RenewalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CertificateRenewalScheduler
 */
@ExtendWith(MockitoExtension.class)
class CertificateRenewalSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:00:00Z");

    @Mock
    private RenewalService renewalService;

    @Mock
    private CertificateRegistry registry;

    private CertificateRenewalScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new CertificateRenewalScheduler(renewalService, registry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testRenewExpiringCertificates_RunsRenewalSweep() {
        // Arrange
        when(renewalService.processRenewals()).thenReturn(RenewalRunSummary.builder()
                .candidates(3)
                .succeeded(2)
                .failed(1)
                .results(Collections.emptyList())
                .build());

        // Act
        scheduler.renewExpiringCertificates();

        // Assert
        verify(renewalService, times(1)).processRenewals();
    }

    @Test
    void testRenewExpiringCertificates_ExceptionIsContained() {
        // Arrange
        when(renewalService.processRenewals()).thenThrow(new StorageException("database down", null));

        // Act & Assert
        assertThatCode(() -> scheduler.renewExpiringCertificates()).doesNotThrowAnyException();
    }

    @Test
    void testCleanupStaleOcspResponses_UsesCurrentTime() {
        // Arrange
        when(registry.deleteStaleOcspCacheEntries(NOW)).thenReturn(4);

        // Act
        scheduler.cleanupStaleOcspResponses();

        // Assert
        verify(registry).deleteStaleOcspCacheEntries(NOW);
        verifyNoInteractions(renewalService);
    }

    @Test
    void testCleanupStaleOcspResponses_ExceptionIsContained() {
        // Arrange
        when(registry.deleteStaleOcspCacheEntries(any(Instant.class)))
                .thenThrow(new StorageException("database down", null));

        // Act & Assert
        assertThatCode(() -> scheduler.cleanupStaleOcspResponses()).doesNotThrowAnyException();
    }
}
