package com.wpanther.cgaca.service;

import com.wpanther.cgaca.dto.SignatureResult;
import com.wpanther.cgaca.dto.ocsp.OcspCertStatus;
import com.wpanther.cgaca.dto.ocsp.OcspRequest;
import com.wpanther.cgaca.dto.ocsp.OcspResponse;
import com.wpanther.cgaca.dto.ocsp.OcspResponseStatus;
import com.wpanther.cgaca.dto.ocsp.RevocationListResponse;
import com.wpanther.cgaca.dto.ocsp.SingleResponse;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.OcspCacheEntry;
import com.wpanther.cgaca.entity.RevocationRecord;
import com.wpanther.cgaca.exception.ValidationException;
import com.wpanther.cgaca.registry.CertificateRegistry;
import com.wpanther.cgaca.util.CanonicalJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Answers certificate status queries.
 * Status is always derived from the registry at query time; the cache only saves
 * rebuilding a response whose status has not changed and whose window is still open.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OcspResponderService {

    private final CertificateRegistry registry;
    private final SigningService signingService;
    private final CanonicalJson canonicalJson;
    private final Clock clock;

    @Value("${app.ocsp.response-validity-seconds:3600}")
    private long responseValiditySeconds;

    @Value("${app.ocsp.cache-enabled:true}")
    private boolean cacheEnabled;

    /**
     * One single response per id, in request order
     */
    public List<SingleResponse> queryStatus(List<String> certificateIds) {
        if (certificateIds == null || certificateIds.isEmpty()) {
            throw new ValidationException("At least one certificate id is required",
                    Map.of("certificateIds", "must not be empty"));
        }
        Instant now = now();
        return certificateIds.stream()
                .map(id -> resolve(id, now))
                .collect(Collectors.toList());
    }

    /**
     * Status of a single certificate
     */
    public SingleResponse queryStatus(String certificateId) {
        return resolve(certificateId, now());
    }

    /**
     * Full signed exchange. An empty request, or one with a blank id, is answered with
     * MALFORMED_REQUEST and no responses.
     */
    public OcspResponse processRequest(OcspRequest request) {
        Instant producedAt = now();
        if (request == null || request.getCertificateIds() == null || request.getCertificateIds().isEmpty()
                || request.getCertificateIds().stream().anyMatch(id -> id == null || id.isBlank())) {
            log.debug("Malformed OCSP request: {}", request);
            return OcspResponse.builder()
                    .responseStatus(OcspResponseStatus.MALFORMED_REQUEST)
                    .producedAt(producedAt)
                    .nonce(request != null ? request.getNonce() : null)
                    .build();
        }

        List<SingleResponse> responses = request.getCertificateIds().stream()
                .map(id -> resolve(id, producedAt))
                .collect(Collectors.toList());

        SignatureResult signature = signingService.signPayload(
                responsePayload(producedAt, responses, request.getNonce()));

        log.debug("OCSP request for {} certificate(s) answered", responses.size());
        return OcspResponse.builder()
                .responseStatus(OcspResponseStatus.SUCCESSFUL)
                .producedAt(producedAt)
                .responses(responses)
                .nonce(request.getNonce())
                .signatureAlgorithm(signature.getAlgorithm())
                .signatureKeyId(signature.getKeyId())
                .signature(signature.getValue())
                .build();
    }

    /**
     * Checks the CA signature of a response produced by {@link #processRequest(OcspRequest)}
     */
    public boolean verifyResponse(OcspResponse response) {
        if (response.getSignature() == null) {
            return false;
        }
        return signingService.verifyPayload(
                responsePayload(response.getProducedAt(), response.getResponses(), response.getNonce()),
                SignatureResult.builder()
                        .keyId(response.getSignatureKeyId())
                        .algorithm(response.getSignatureAlgorithm())
                        .value(response.getSignature())
                        .build());
    }

    /**
     * Signed list of every revoked certificate
     */
    public RevocationListResponse getRevocationList() {
        Instant thisUpdate = now();
        Instant nextUpdate = thisUpdate.plusSeconds(responseValiditySeconds);
        List<RevocationListResponse.RevokedCertificate> revoked = registry.listRevocations().stream()
                .map(r -> RevocationListResponse.RevokedCertificate.builder()
                        .certificateId(r.getCertificateId())
                        .revocationDate(r.getRevokedAt())
                        .reason(r.getReason())
                        .build())
                .collect(Collectors.toList());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("issuerId", signingService.getIssuerId());
        payload.put("thisUpdate", thisUpdate);
        payload.put("nextUpdate", nextUpdate);
        payload.put("revokedCertificates", revoked);
        SignatureResult signature = signingService.signPayload(canonicalJson.writeBytes(payload));

        return RevocationListResponse.builder()
                .issuerId(signingService.getIssuerId())
                .thisUpdate(thisUpdate)
                .nextUpdate(nextUpdate)
                .revokedCertificates(revoked)
                .signatureAlgorithm(signature.getAlgorithm())
                .signatureKeyId(signature.getKeyId())
                .signature(signature.getValue())
                .build();
    }

    // ------------------------------------------------------------------

    private SingleResponse resolve(String certificateId, Instant now) {
        Optional<RevocationRecord> revocation = registry.findRevocation(certificateId);
        Optional<CertificateRecord> certificate = revocation.isPresent()
                ? Optional.empty()
                : registry.findCertificate(certificateId);
        OcspCertStatus status = computeStatus(revocation, certificate, now);

        if (status == OcspCertStatus.UNKNOWN) {
            return SingleResponse.builder()
                    .certificateId(certificateId)
                    .certStatus(OcspCertStatus.UNKNOWN)
                    .thisUpdate(now)
                    .build();
        }

        if (cacheEnabled) {
            Optional<SingleResponse> cached = registry.findOcspCacheEntry(certificateId)
                    .filter(entry -> entry.isValidAt(now) && status.name().equals(entry.getCertStatus()))
                    .map(entry -> canonicalJson.read(entry.getResponseBytes(), SingleResponse.class));
            if (cached.isPresent()) {
                log.debug("OCSP cache hit for {} ({})", certificateId, status);
                return cached.get();
            }
        }

        SingleResponse.SingleResponseBuilder response = SingleResponse.builder()
                .certificateId(certificateId)
                .certStatus(status)
                .thisUpdate(now)
                .nextUpdate(now.plusSeconds(responseValiditySeconds));
        revocation.ifPresent(r -> response
                .revocationTime(r.getRevokedAt())
                .revocationReason(r.getReason()));
        SingleResponse built = response.build();

        if (cacheEnabled) {
            registry.storeOcspCacheEntry(OcspCacheEntry.builder()
                    .certificateId(certificateId)
                    .certStatus(status.name())
                    .responseBytes(canonicalJson.writeBytes(built))
                    .producedAt(now)
                    .thisUpdate(built.getThisUpdate())
                    .nextUpdate(built.getNextUpdate())
                    .build());
        }
        return built;
    }

    // Revoked beats expired; a certificate without a record is unknown
    private OcspCertStatus computeStatus(Optional<RevocationRecord> revocation,
                                         Optional<CertificateRecord> certificate, Instant now) {
        if (revocation.isPresent()) {
            return OcspCertStatus.REVOKED;
        }
        if (certificate.isEmpty()) {
            return OcspCertStatus.UNKNOWN;
        }
        return certificate.get().isExpiredAt(now) ? OcspCertStatus.EXPIRED : OcspCertStatus.GOOD;
    }

    private byte[] responsePayload(Instant producedAt, List<SingleResponse> responses, String nonce) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("producedAt", producedAt);
        payload.put("responses", responses);
        if (nonce != null) {
            payload.put("nonce", nonce);
        }
        return canonicalJson.writeBytes(payload);
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
