package com.wpanther.cgaca.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wpanther.cgaca.crypto.CaKeyAlgorithm;
import com.wpanther.cgaca.crypto.KeyEncryptionService;
import com.wpanther.cgaca.dto.SignatureResult;
import com.wpanther.cgaca.dto.SigningRequest;
import com.wpanther.cgaca.entity.CaKeyRecord;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CertificateStatus;
import com.wpanther.cgaca.entity.KeyStatus;
import com.wpanther.cgaca.exception.ConflictException;
import com.wpanther.cgaca.exception.CryptoException;
import com.wpanther.cgaca.exception.KeyGenerationException;
import com.wpanther.cgaca.exception.KeyUnavailableException;
import com.wpanther.cgaca.exception.NotFoundException;
import com.wpanther.cgaca.exception.ValidationException;
import com.wpanther.cgaca.registry.CertificateRegistry;
import com.wpanther.cgaca.util.CanonicalJson;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Base64;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Owns the CA signing keys and issues certificates with them.
 * Private keys are decrypted inside a single call and the plaintext bytes are wiped afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SigningService {

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final String CONTENT_FORMAT_VERSION = "1.0";

    private final CertificateRegistry registry;
    private final KeyEncryptionService keyEncryptionService;
    private final CanonicalJson canonicalJson;
    private final SecureRandom secureRandom;
    private final Validator validator;
    private final Clock clock;

    @Value("${app.ca.key-algorithm:ES256}")
    private String defaultKeyAlgorithm;

    @Value("${app.ca.key-encryption-password:}")
    private String keyEncryptionPassword;

    // 0 means keys do not expire
    @Value("${app.ca.key-validity-days:0}")
    private int keyValidityDays;

    @Value("${app.ca.issuer-id:cga-ca}")
    private String issuerId;

    @Value("${app.ca.issuer-name:CGA Certificate Authority}")
    private String issuerName;

    // ------------------------------------------------------------------
    // Key management
    // ------------------------------------------------------------------

    /**
     * Generates a key with the configured algorithm and passphrase and makes it the active key
     */
    @Transactional
    public CaKeyRecord generateKey() {
        return generateKey(defaultKeyAlgorithm, configuredPassphrase());
    }

    /**
     * Same as {@link #generateKey()} with the passphrase given by the caller.
     * It has to be the configured key encryption password, the only one signing decrypts with.
     */
    @Transactional
    public CaKeyRecord generateKey(char[] passphrase) {
        return generateKey(defaultKeyAlgorithm, passphrase);
    }

    /**
     * Generates a key pair, stores the private key encrypted under the passphrase and activates it.
     * A previously active key becomes ROTATED in the same transaction and stays usable for verification.
     *
     * @throws ValidationException when the passphrase is not the configured key encryption password
     */
    @Transactional
    public CaKeyRecord generateKey(String algorithmName, char[] passphrase) {
        CaKeyAlgorithm algorithm = resolveAlgorithm(algorithmName);
        if (passphrase == null || passphrase.length == 0) {
            throw new ValidationException("Key encryption passphrase is required");
        }
        requireConfiguredPassphrase(passphrase);

        KeyPair keyPair;
        try {
            keyPair = algorithm.generateKeyPair(secureRandom);
        } catch (GeneralSecurityException e) {
            log.error("Failed to generate {} key pair", algorithm, e);
            throw new KeyGenerationException("Failed to generate " + algorithm + " key pair: " + e.getMessage(), e);
        }

        byte[] pkcs8 = keyPair.getPrivate().getEncoded();
        String encryptedPrivateKey;
        try {
            encryptedPrivateKey = keyEncryptionService.encrypt(pkcs8, passphrase);
        } finally {
            Arrays.fill(pkcs8, (byte) 0);
        }

        Instant now = now();
        CaKeyRecord key = CaKeyRecord.builder()
                .id("ca-key-" + ID_DATE.format(now) + "-" + randomHex(4))
                .algorithm(algorithm.name())
                .publicKey(Base64.getEncoder().encodeToString(keyPair.getPublic().getEncoded()))
                .encryptedPrivateKey(encryptedPrivateKey)
                .status(KeyStatus.ACTIVE)
                .createdAt(now)
                .expiresAt(keyValidityDays > 0 ? now.plus(keyValidityDays, ChronoUnit.DAYS) : null)
                .certificatesSigned(0)
                .build();

        registry.activateKey(key).ifPresent(previous -> {
            registry.recordAudit("system", "key_rotated", "ca_key", previous.getId(),
                    Map.of("replacedBy", key.getId()));
            log.info("CA key {} rotated, replaced by {}", previous.getId(), key.getId());
        });
        registry.recordAudit("system", "key_generated", "ca_key", key.getId(),
                Map.of("algorithm", algorithm.name()));

        log.info("Generated CA signing key {} ({})", key.getId(), algorithm);
        return key;
    }

    /**
     * Replaces the active key. Unlike generateKey, an active key must already exist.
     */
    @Transactional
    public CaKeyRecord rotateKey() {
        return rotateKey(configuredPassphrase());
    }

    @Transactional
    public CaKeyRecord rotateKey(char[] passphrase) {
        CaKeyRecord current = registry.getActiveKey()
                .orElseThrow(() -> new KeyUnavailableException("No active CA key to rotate"));
        return generateKey(current.getAlgorithm(), passphrase);
    }

    /**
     * PEM encoded SubjectPublicKeyInfo of a CA key
     */
    @Transactional(readOnly = true)
    public String getPublicKeyPem(String keyId) {
        CaKeyRecord key = registry.findKey(keyId)
                .orElseThrow(() -> new NotFoundException("CA key not found: " + keyId));
        StringWriter writer = new StringWriter();
        try (PemWriter pemWriter = new PemWriter(writer)) {
            pemWriter.writeObject(new PemObject("PUBLIC KEY", Base64.getDecoder().decode(key.getPublicKey())));
        } catch (IOException e) {
            throw new CryptoException("Failed to encode public key of " + keyId, e);
        }
        return writer.toString();
    }

    // ------------------------------------------------------------------
    // Issuance
    // ------------------------------------------------------------------

    /**
     * Issues and persists a certificate for the request.
     * A second certificate for the same agent identity is only accepted when the request names
     * the current one in supersedesCertificateId; that record becomes SUPERSEDED.
     * The identity check runs while the active key row is locked, so two requests for one
     * identity cannot both pass it. Locks are taken certificate first, key second.
     */
    @Transactional
    public CertificateRecord sign(SigningRequest request) {
        validate(request);

        CaKeyRecord key;
        int certificateVersion = 1;
        String previousCertificateId = null;
        if (request.getSupersedesCertificateId() == null) {
            key = usableKey(registry.lockActiveKey());
            if (registry.identityExists(request.getAgentId(), request.getAgentVersion(), request.getOrganizationId())) {
                throw new ConflictException(String.format(
                        "Certificate already exists for agent %s version %s in organization %s",
                        request.getAgentId(), request.getAgentVersion(), request.getOrganizationId()));
            }
        } else {
            CertificateRecord previous = supersede(request);
            certificateVersion = previous.getCertificateVersion() + 1;
            previousCertificateId = previous.getId();
            key = usableKey(registry.lockActiveKey());
        }

        Instant issuedAt = now();
        int validityDays = request.getValidityDays() != null
                ? request.getValidityDays()
                : request.getLevel().getValidityDays();
        Instant expiresAt = issuedAt.plus(validityDays, ChronoUnit.DAYS);
        String certificateId = generateCertificateId(request, issuedAt);
        String goldenThreadHash = canonicalJson.sha256Hex(request.getAttestedContent());
        CaKeyAlgorithm algorithm = CaKeyAlgorithm.fromName(key.getAlgorithm());

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("formatVersion", CONTENT_FORMAT_VERSION);
        content.put("certificateId", certificateId);
        content.put("certificateVersion", certificateVersion);
        if (previousCertificateId != null) {
            content.put("previousCertificateId", previousCertificateId);
        }
        content.put("issuer", Map.of("id", issuerId, "name", issuerName));
        content.put("subject", subject(request));
        content.put("level", request.getLevel().name());
        content.put("issuedAt", issuedAt.toString());
        content.put("expiresAt", expiresAt.toString());
        content.put("goldenThread", Map.of("algorithm", CanonicalJson.HASH_ALGORITHM, "hash", goldenThreadHash));
        content.put("attestedContent", request.getAttestedContent());
        content.put("signatureAlgorithm", algorithm.getSignatureAlgorithm());
        content.put("signatureKeyId", key.getId());

        String certificateContent = canonicalJson.write(content);
        SignatureResult signature = signWithKey(key, certificateContent.getBytes(StandardCharsets.UTF_8));

        CertificateRecord certificate = CertificateRecord.builder()
                .id(certificateId)
                .agentId(request.getAgentId())
                .agentVersion(request.getAgentVersion())
                .organizationId(request.getOrganizationId())
                .organizationName(request.getOrganizationName())
                .organizationDomain(request.getOrganizationDomain())
                .level(request.getLevel())
                .goldenThreadHash(goldenThreadHash)
                .goldenThreadAlgorithm(CanonicalJson.HASH_ALGORITHM)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .certificateContent(certificateContent)
                .signatureAlgorithm(signature.getAlgorithm())
                .signatureKeyId(signature.getKeyId())
                .signatureValue(signature.getValue())
                .status(CertificateStatus.ACTIVE)
                .certificateVersion(certificateVersion)
                .previousCertificateId(previousCertificateId)
                .build();

        CertificateRecord saved = registry.insertCertificate(certificate);
        registry.incrementKeyUsage(key.getId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("agentId", saved.getAgentId());
        details.put("agentVersion", saved.getAgentVersion());
        details.put("organizationId", saved.getOrganizationId());
        details.put("level", saved.getLevel().name());
        details.put("keyId", key.getId());
        details.put("certificateVersion", certificateVersion);
        if (previousCertificateId != null) {
            details.put("previousCertificateId", previousCertificateId);
        }
        registry.recordAudit(actorOf(request), "certificate_signed", "certificate", saved.getId(), details);

        log.info("Issued certificate {} for agent {} ({}) level {} with key {}",
                saved.getId(), saved.getAgentId(), saved.getOrganizationId(), saved.getLevel(), key.getId());
        return saved;
    }

    /**
     * Checks that a stored certificate is intact: the attested content still hashes to the golden
     * thread and the CA signature over the canonical content verifies with the issuing key.
     *
     * @return true when both hold
     * @throws CryptoException         on a hash or signature mismatch, or unreadable content
     * @throws KeyUnavailableException when the issuing key is no longer present or usable
     */
    @Transactional(readOnly = true)
    public boolean verifySignature(CertificateRecord certificate) {
        JsonNode content;
        try {
            content = canonicalJson.readTree(certificate.getCertificateContent());
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Certificate content of " + certificate.getId() + " is not readable", e);
        }

        JsonNode attested = content.get("attestedContent");
        if (attested == null || !attested.isObject()) {
            throw new CryptoException("Certificate " + certificate.getId() + " carries no attested content");
        }
        String recomputed = canonicalJson.sha256Hex(attested);
        String embedded = content.path("goldenThread").path("hash").asText(null);
        if (!recomputed.equals(certificate.getGoldenThreadHash()) || !recomputed.equals(embedded)) {
            throw new CryptoException("Golden thread hash mismatch for certificate " + certificate.getId());
        }
        if (!certificate.getId().equals(content.path("certificateId").asText(null))) {
            throw new CryptoException("Certificate content does not belong to " + certificate.getId());
        }

        CaKeyRecord key = registry.findKey(certificate.getSignatureKeyId())
                .filter(k -> k.getStatus() == KeyStatus.ACTIVE || k.getStatus() == KeyStatus.ROTATED)
                .orElseThrow(() -> new KeyUnavailableException(
                        "Signing key " + certificate.getSignatureKeyId() + " is not available"));

        SignatureResult signature = SignatureResult.builder()
                .keyId(key.getId())
                .algorithm(certificate.getSignatureAlgorithm())
                .value(certificate.getSignatureValue())
                .build();
        if (!verifyWithKey(key, certificate.getCertificateContent().getBytes(StandardCharsets.UTF_8), signature)) {
            throw new CryptoException("Signature verification failed for certificate " + certificate.getId());
        }
        return true;
    }

    /**
     * Signs arbitrary bytes, such as an OCSP response, with the active key
     */
    @Transactional(readOnly = true)
    public SignatureResult signPayload(byte[] payload) {
        return signWithKey(usableKey(registry.getActiveKey()), payload);
    }

    /**
     * Verifies a detached signature produced by {@link #signPayload(byte[])}
     */
    @Transactional(readOnly = true)
    public boolean verifyPayload(byte[] payload, SignatureResult signature) {
        CaKeyRecord key = registry.findKey(signature.getKeyId())
                .orElseThrow(() -> new KeyUnavailableException("Signing key " + signature.getKeyId() + " is not available"));
        return verifyWithKey(key, payload, signature);
    }

    /**
     * Attested content embedded in a certificate, used when re-issuing it
     */
    public Map<String, Object> extractAttestedContent(CertificateRecord certificate) {
        JsonNode attested = canonicalJson.readTree(certificate.getCertificateContent()).get("attestedContent");
        if (attested == null || !attested.isObject()) {
            throw new CryptoException("Certificate " + certificate.getId() + " carries no attested content");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> content = canonicalJson.read(canonicalJson.writeBytes(attested), Map.class);
        return content;
    }

    public String getIssuerId() {
        return issuerId;
    }

    public String getIssuerName() {
        return issuerName;
    }

    // ------------------------------------------------------------------

    private void validate(SigningRequest request) {
        if (request == null) {
            throw new ValidationException("Signing request is required");
        }
        Set<ConstraintViolation<SigningRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            Map<String, String> errors = new TreeMap<>();
            for (ConstraintViolation<SigningRequest> violation : violations) {
                errors.put(violation.getPropertyPath().toString(), violation.getMessage());
            }
            log.debug("Rejected signing request for agent {}: {}", request.getAgentId(), errors);
            throw new ValidationException("Invalid signing request", errors);
        }
    }

    private CertificateRecord supersede(SigningRequest request) {
        CertificateRecord previous = registry.lockCertificate(request.getSupersedesCertificateId());
        if (!previous.getAgentId().equals(request.getAgentId())
                || !previous.getAgentVersion().equals(request.getAgentVersion())
                || !previous.getOrganizationId().equals(request.getOrganizationId())) {
            throw new ValidationException("Certificate " + previous.getId() + " belongs to a different agent identity",
                    Map.of("supersedesCertificateId", "must reference a certificate of the same agent identity"));
        }

        String currentId = registry.findCurrentByIdentity(
                        request.getAgentId(), request.getAgentVersion(), request.getOrganizationId())
                .map(CertificateRecord::getId)
                .orElse(null);
        if (!previous.getId().equals(currentId)) {
            throw new ConflictException("Certificate " + previous.getId() + " is not the current certificate of its agent");
        }

        return registry.transitionStatus(previous.getId(), EnumSet.of(CertificateStatus.ACTIVE),
                CertificateStatus.SUPERSEDED, null);
    }

    private CaKeyRecord usableKey(Optional<CaKeyRecord> activeKey) {
        CaKeyRecord key = activeKey
                .orElseThrow(() -> new KeyUnavailableException("No active CA signing key, generate one first"));
        if (key.getExpiresAt() != null && !now().isBefore(key.getExpiresAt())) {
            throw new KeyUnavailableException("Active CA signing key " + key.getId() + " expired at " + key.getExpiresAt());
        }
        return key;
    }

    private SignatureResult signWithKey(CaKeyRecord key, byte[] payload) {
        CaKeyAlgorithm algorithm = CaKeyAlgorithm.fromName(key.getAlgorithm());
        byte[] pkcs8 = keyEncryptionService.decrypt(key.getEncryptedPrivateKey(), configuredPassphrase());
        try {
            PrivateKey privateKey = algorithm.decodePrivateKey(pkcs8);
            byte[] signature = algorithm.sign(privateKey, payload);
            return SignatureResult.builder()
                    .keyId(key.getId())
                    .algorithm(algorithm.getSignatureAlgorithm())
                    .value(Base64.getEncoder().encodeToString(signature))
                    .build();
        } catch (GeneralSecurityException e) {
            log.error("Signing with CA key {} failed", key.getId(), e);
            throw new CryptoException("Signing with CA key " + key.getId() + " failed: " + e.getMessage(), e);
        } finally {
            Arrays.fill(pkcs8, (byte) 0);
        }
    }

    private boolean verifyWithKey(CaKeyRecord key, byte[] payload, SignatureResult signature) {
        CaKeyAlgorithm algorithm = CaKeyAlgorithm.fromName(key.getAlgorithm());
        if (signature.getAlgorithm() != null && !algorithm.getSignatureAlgorithm().equals(signature.getAlgorithm())) {
            throw new CryptoException("Signature algorithm " + signature.getAlgorithm()
                    + " does not match key " + key.getId());
        }
        try {
            PublicKey publicKey = algorithm.decodePublicKey(Base64.getDecoder().decode(key.getPublicKey()));
            return algorithm.verify(publicKey, payload, Base64.getDecoder().decode(signature.getValue()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new CryptoException("Signature of key " + key.getId() + " cannot be checked: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> subject(SigningRequest request) {
        Map<String, Object> organization = new LinkedHashMap<>();
        organization.put("id", request.getOrganizationId());
        organization.put("name", request.getOrganizationName());
        if (request.getOrganizationDomain() != null) {
            organization.put("domain", request.getOrganizationDomain());
        }
        Map<String, Object> subject = new LinkedHashMap<>();
        subject.put("agentId", request.getAgentId());
        subject.put("agentVersion", request.getAgentVersion());
        subject.put("organization", organization);
        return subject;
    }

    /**
     * cga-yyyyMMdd-agentshort-level-random, e.g. cga-20260301-agent7-gold-1a2b3c4d
     */
    private String generateCertificateId(SigningRequest request, Instant issuedAt) {
        String agentShort = request.getAgentId().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (agentShort.length() > 8) {
            agentShort = agentShort.substring(0, 8);
        }
        if (agentShort.isEmpty()) {
            agentShort = "agent";
        }
        return String.format("cga-%s-%s-%s-%s", ID_DATE.format(issuedAt), agentShort,
                request.getLevel().name().toLowerCase(Locale.ROOT), randomHex(4));
    }

    private String randomHex(int bytes) {
        byte[] random = new byte[bytes];
        secureRandom.nextBytes(random);
        return Hex.toHexString(random);
    }

    private CaKeyAlgorithm resolveAlgorithm(String algorithmName) {
        try {
            return CaKeyAlgorithm.fromName(algorithmName);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), Map.of("algorithm", "must be ES256 or Ed25519"));
        }
    }

    private char[] configuredPassphrase() {
        if (keyEncryptionPassword == null || keyEncryptionPassword.isEmpty()) {
            throw new KeyUnavailableException("CA key encryption password is not configured (app.ca.key-encryption-password)");
        }
        return keyEncryptionPassword.toCharArray();
    }

    private void requireConfiguredPassphrase(char[] passphrase) {
        byte[] given = utf8(passphrase);
        byte[] expected = utf8(configuredPassphrase());
        try {
            if (!MessageDigest.isEqual(given, expected)) {
                throw new ValidationException("Key encryption passphrase does not match the configured CA key password",
                        Map.of("passphrase", "must match app.ca.key-encryption-password"));
            }
        } finally {
            Arrays.fill(given, (byte) 0);
            Arrays.fill(expected, (byte) 0);
        }
    }

    private static byte[] utf8(char[] chars) {
        ByteBuffer buffer = StandardCharsets.UTF_8.encode(CharBuffer.wrap(chars));
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        if (buffer.hasArray()) {
            Arrays.fill(buffer.array(), (byte) 0);
        }
        return bytes;
    }

    private String actorOf(SigningRequest request) {
        return request.getRequestedBy() != null ? request.getRequestedBy() : "api";
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
