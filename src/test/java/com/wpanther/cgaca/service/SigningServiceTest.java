package com.wpanther.cgaca.service;

import com.wpanther.cgaca.crypto.KeyEncryptionService;
import com.wpanther.cgaca.dto.SigningRequest;
import com.wpanther.cgaca.entity.CaKeyRecord;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CgaLevel;
import com.wpanther.cgaca.entity.KeyStatus;
import com.wpanther.cgaca.exception.KeyUnavailableException;
import com.wpanther.cgaca.exception.ValidationException;
import com.wpanther.cgaca.registry.CertificateRegistry;
import com.wpanther.cgaca.support.TestRequests;
import com.wpanther.cgaca.util.CanonicalJson;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SigningService with a mocked registry
 */
@ExtendWith(MockitoExtension.class)
class SigningServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:30:00Z");
    private static final String PASSPHRASE = "unit-test-passphrase";

    private static ValidatorFactory validatorFactory;

    @Mock
    private CertificateRegistry registry;

    private final CanonicalJson canonicalJson = new CanonicalJson();

    private SigningService signingService;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        SecureRandom random = new SecureRandom();
        Validator validator = validatorFactory.getValidator();
        signingService = new SigningService(registry, new KeyEncryptionService(random, 1024, 8, 1),
                canonicalJson, random, validator, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(signingService, "defaultKeyAlgorithm", "ES256");
        ReflectionTestUtils.setField(signingService, "keyEncryptionPassword", PASSPHRASE);
        ReflectionTestUtils.setField(signingService, "keyValidityDays", 0);
        ReflectionTestUtils.setField(signingService, "issuerId", "cga-ca-test");
        ReflectionTestUtils.setField(signingService, "issuerName", "Test CA");
    }

    @Test
    void testSign_WithoutActiveKeyWritesNothing() {
        // Arrange
        when(registry.lockActiveKey()).thenReturn(Optional.empty());

        // Act & Assert
        assertThatThrownBy(() -> signingService.sign(TestRequests.signingRequest(CgaLevel.GOLD)))
                .isInstanceOf(KeyUnavailableException.class);
        verify(registry, never()).insertCertificate(any());
        verify(registry, never()).activateKey(any());
        verify(registry, never()).recordAudit(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void testSign_ExpiredActiveKeyIsUnusable() {
        // Arrange
        CaKeyRecord expired = CaKeyRecord.builder()
                .id("ca-key-old")
                .algorithm("ES256")
                .status(KeyStatus.ACTIVE)
                .expiresAt(NOW.minus(1, ChronoUnit.DAYS))
                .build();
        when(registry.lockActiveKey()).thenReturn(Optional.of(expired));

        // Act & Assert
        assertThatThrownBy(() -> signingService.sign(TestRequests.signingRequest(CgaLevel.BRONZE)))
                .isInstanceOf(KeyUnavailableException.class)
                .hasMessageContaining("expired");
        verify(registry, never()).insertCertificate(any());
    }

    @Test
    void testSign_InvalidRequestIsRejectedBeforeKeyLookup() {
        // Arrange
        SigningRequest request = TestRequests.signingRequest(CgaLevel.GOLD).toBuilder().validityDays(0).build();

        // Act & Assert
        assertThatThrownBy(() -> signingService.sign(request))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrors()).containsKey("validityDays"));
        verifyNoInteractions(registry);
    }

    @Test
    void testSign_ProducesVerifiableCertificate() {
        // Arrange
        CaKeyRecord key = generateActiveKey();
        when(registry.lockActiveKey()).thenReturn(Optional.of(key));
        when(registry.findKey(key.getId())).thenReturn(Optional.of(key));
        when(registry.insertCertificate(any(CertificateRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));
        SigningRequest request = TestRequests.signingRequest(CgaLevel.SILVER).toBuilder().requestedBy("agent:agent-7").build();

        // Act
        CertificateRecord certificate = signingService.sign(request);

        // Assert
        assertThat(certificate.getId()).matches("cga-20260301-[a-z0-9]{1,8}-silver-[0-9a-f]{8}");
        assertThat(certificate.getIssuedAt()).isEqualTo(NOW);
        assertThat(certificate.getExpiresAt()).isEqualTo(NOW.plus(CgaLevel.SILVER.getValidityDays(), ChronoUnit.DAYS));
        assertThat(certificate.getCertificateContent())
                .contains("\"issuer\":{\"id\":\"cga-ca-test\",\"name\":\"Test CA\"}")
                .contains("\"formatVersion\":\"1.0\"")
                .doesNotContain("previousCertificateId");
        assertThat(signingService.verifySignature(certificate)).isTrue();
        assertThat(signingService.extractAttestedContent(certificate)).isEqualTo(request.getAttestedContent());

        verify(registry).incrementKeyUsage(key.getId());
        verify(registry).recordAudit(eq("agent:agent-7"), eq("certificate_signed"), eq("certificate"),
                eq(certificate.getId()), any());
    }

    @Test
    void testGenerateKey_AuditsPredecessorRotation() {
        // Arrange
        CaKeyRecord previous = CaKeyRecord.builder().id("ca-key-previous").status(KeyStatus.ROTATED).build();
        when(registry.activateKey(any(CaKeyRecord.class))).thenReturn(Optional.of(previous));

        // Act
        CaKeyRecord key = signingService.generateKey("Ed25519", PASSPHRASE.toCharArray());

        // Assert
        assertThat(key.getId()).matches("ca-key-20260301-[0-9a-f]{8}");
        assertThat(key.getAlgorithm()).isEqualTo("ED25519");
        assertThat(key.getStatus()).isEqualTo(KeyStatus.ACTIVE);
        assertThat(key.getExpiresAt()).isNull();
        assertThat(key.getEncryptedPrivateKey()).isNotBlank();
        verify(registry).recordAudit(eq("system"), eq("key_rotated"), eq("ca_key"), eq("ca-key-previous"), any());
        verify(registry).recordAudit(eq("system"), eq("key_generated"), eq("ca_key"), eq(key.getId()), any());
    }

    @Test
    void testGenerateKey_ExplicitPassphraseUsesConfiguredAlgorithm() {
        // Arrange
        when(registry.activateKey(any(CaKeyRecord.class))).thenReturn(Optional.empty());

        // Act
        CaKeyRecord key = signingService.generateKey(PASSPHRASE.toCharArray());

        // Assert
        assertThat(key.getAlgorithm()).isEqualTo("ES256");
        verify(registry, never()).recordAudit(anyString(), eq("key_rotated"), anyString(), anyString(), any());
    }

    @Test
    void testGenerateKey_PassphraseOtherThanConfiguredIsRejected() {
        // Act & Assert
        assertThatThrownBy(() -> signingService.generateKey("operator-chosen-passphrase".toCharArray()))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrors()).containsKey("passphrase"));
        assertThatThrownBy(() -> signingService.generateKey("Ed25519", "another-passphrase".toCharArray()))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(registry);
    }

    @Test
    void testGenerateKey_RequiresPassphrase() {
        assertThatThrownBy(() -> signingService.generateKey("ES256", new char[0]))
                .isInstanceOf(ValidationException.class);
        verify(registry, never()).activateKey(any());
    }

    @Test
    void testGenerateKey_RejectsUnsupportedAlgorithm() {
        assertThatThrownBy(() -> signingService.generateKey("RSA", PASSPHRASE.toCharArray()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("RSA");
    }

    @Test
    void testGenerateKey_MissingConfiguredPassphrase() {
        ReflectionTestUtils.setField(signingService, "keyEncryptionPassword", "");

        assertThatThrownBy(() -> signingService.generateKey()).isInstanceOf(KeyUnavailableException.class);
        verifyNoInteractions(registry);
    }

    @Test
    void testRotateKey_RequiresActiveKey() {
        when(registry.getActiveKey()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> signingService.rotateKey()).isInstanceOf(KeyUnavailableException.class);
        verify(registry, never()).activateKey(any());
    }

    private CaKeyRecord generateActiveKey() {
        when(registry.activateKey(any(CaKeyRecord.class))).thenReturn(Optional.empty());
        CaKeyRecord key = signingService.generateKey();
        ArgumentCaptor<CaKeyRecord> captor = ArgumentCaptor.forClass(CaKeyRecord.class);
        verify(registry).activateKey(captor.capture());
        clearInvocations(registry);
        return captor.getValue();
    }
}
