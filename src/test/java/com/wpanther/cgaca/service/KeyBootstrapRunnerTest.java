package com.wpanther.cgaca.service;

import com.wpanther.cgaca.entity.CaKeyRecord;
import com.wpanther.cgaca.entity.KeyStatus;
import com.wpanther.cgaca.registry.CertificateRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.mockito.Mockito.*;

/**
 * Unit tests for KeyBootstrapRunner
 */
@ExtendWith(MockitoExtension.class)
class KeyBootstrapRunnerTest {

    @Mock
    private CertificateRegistry registry;

    @Mock
    private SigningService signingService;

    @InjectMocks
    private KeyBootstrapRunner runner;

    @Test
    void testRun_DisabledDoesNothing() {
        ReflectionTestUtils.setField(runner, "bootstrapKey", false);

        runner.run(null);

        verifyNoInteractions(registry, signingService);
    }

    @Test
    void testRun_GeneratesFirstKey() {
        // Arrange
        ReflectionTestUtils.setField(runner, "bootstrapKey", true);
        when(registry.getActiveKey()).thenReturn(Optional.empty());
        when(signingService.generateKey()).thenReturn(CaKeyRecord.builder().id("ca-key-20260301-0a1b2c3d").build());

        // Act
        runner.run(null);

        // Assert
        verify(signingService).generateKey();
    }

    @Test
    void testRun_KeepsExistingKey() {
        // Arrange
        ReflectionTestUtils.setField(runner, "bootstrapKey", true);
        when(registry.getActiveKey()).thenReturn(Optional.of(
                CaKeyRecord.builder().id("ca-key-existing").status(KeyStatus.ACTIVE).build()));

        // Act
        runner.run(null);

        // Assert
        verify(signingService, never()).generateKey();
    }
}
