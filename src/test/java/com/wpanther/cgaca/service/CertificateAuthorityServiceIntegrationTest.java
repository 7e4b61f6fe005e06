package com.wpanther.cgaca.service;

import com.wpanther.cgaca.dto.AuthorityInfoResponse;
import com.wpanther.cgaca.dto.CertificateVerificationResponse;
import com.wpanther.cgaca.dto.RenewalResult;
import com.wpanther.cgaca.dto.RenewalRunSummary;
import com.wpanther.cgaca.dto.SigningRequest;
import com.wpanther.cgaca.dto.VerificationMetricsResponse;
import com.wpanther.cgaca.dto.ocsp.OcspCertStatus;
import com.wpanther.cgaca.dto.ocsp.OcspRequest;
import com.wpanther.cgaca.dto.ocsp.OcspResponse;
import com.wpanther.cgaca.dto.ocsp.RevocationListResponse;
import com.wpanther.cgaca.dto.ocsp.SingleResponse;
import com.wpanther.cgaca.dto.verification.LiveVerificationOutcome;
import com.wpanther.cgaca.dto.verification.LiveVerificationResult;
import com.wpanther.cgaca.dto.verification.VerificationTarget;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CgaLevel;
import com.wpanther.cgaca.entity.RevocationRecord;
import com.wpanther.cgaca.entity.VerificationResult;
import com.wpanther.cgaca.exception.NotFoundException;
import com.wpanther.cgaca.exception.ValidationException;
import com.wpanther.cgaca.support.IntegrationTestSupport;
import com.wpanther.cgaca.support.TestRequests;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CertificateAuthorityServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private CertificateAuthorityService certificateAuthorityService;

    @Test
    void issueQueryAndRevokeThroughFacade() {
        // Arrange
        SigningRequest request = TestRequests.signingRequest(CgaLevel.GOLD);

        // Act
        CertificateRecord certificate = certificateAuthorityService.submitSigningRequest(request);
        List<SingleResponse> good = certificateAuthorityService.queryStatus(List.of(certificate.getId()));
        LiveVerificationResult live = certificateAuthorityService.verifyLiveAgent(
                VerificationTarget.builder().certificateId(certificate.getId()).build());
        certificateAuthorityService.revoke(certificate.getId(), "decommissioned", "admin:alice", null);
        List<SingleResponse> revoked = certificateAuthorityService.queryStatus(List.of(certificate.getId()));

        // Assert
        assertThat(certificateAuthorityService.verifySignature(certificate)).isTrue();
        assertThat(good.get(0).getCertStatus()).isEqualTo(OcspCertStatus.GOOD);
        assertThat(live.isPassed()).isTrue();
        assertThat(revoked.get(0).getCertStatus()).isEqualTo(OcspCertStatus.REVOKED);
        assertThat(certificateAuthorityService.getCertificate(certificate.getId()).getId()).isEqualTo(certificate.getId());
        assertThat(certificateAuthorityService.listByAgent(request.getAgentId())).hasSize(1);
        assertThat(certificateAuthorityService.listByOrg(request.getOrganizationId())).hasSize(1);
    }

    @Test
    void getCertificate_unknownIdIsNotFound() {
        assertThatThrownBy(() -> certificateAuthorityService.getCertificate("cga-nope"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void verifyCertificate_reportsStatusAndRecordsHistory() {
        // Arrange
        CertificateRecord valid = certificateAuthorityService.submitSigningRequest(
                TestRequests.signingRequest(CgaLevel.SILVER));
        CertificateRecord revoked = certificateAuthorityService.submitSigningRequest(
                TestRequests.signingRequest(CgaLevel.SILVER));
        certificateAuthorityService.revoke(revoked.getId(), "compromised", "admin:alice", null);

        // Act
        CertificateVerificationResponse validResponse =
                certificateAuthorityService.verifyCertificate(valid.getId(), "192.0.2.1", "read");
        CertificateVerificationResponse revokedResponse =
                certificateAuthorityService.verifyCertificate(revoked.getId(), "192.0.2.1", "read");
        CertificateVerificationResponse unknownResponse =
                certificateAuthorityService.verifyCertificate("cga-missing", "192.0.2.1", "read");

        // Assert
        assertThat(validResponse.isValid()).isTrue();
        assertThat(validResponse.getStatus()).isEqualTo(VerificationResult.VALID);
        assertThat(revokedResponse.isValid()).isFalse();
        assertThat(revokedResponse.getStatus()).isEqualTo(VerificationResult.REVOKED);
        assertThat(revokedResponse.getMessage()).contains("compromised");
        assertThat(unknownResponse.getStatus()).isEqualTo(VerificationResult.UNKNOWN);

        assertThat(registry.verificationHistory(valid.getId(), 5)).singleElement()
                .satisfies(record -> assertThat(record.getRequestAction()).isEqualTo("read"));
    }

    @Test
    void verifyCertificate_expiredCertificate() {
        // Arrange
        CertificateRecord certificate = certificateAuthorityService.submitSigningRequest(
                TestRequests.signingRequest(CgaLevel.BRONZE).toBuilder().validityDays(1).build());
        clock.advance(Duration.ofDays(1));

        // Act
        CertificateVerificationResponse response =
                certificateAuthorityService.verifyCertificate(certificate.getId(), null, null);

        // Assert
        assertThat(response.getStatus()).isEqualTo(VerificationResult.EXPIRED);
    }

    @Test
    void getAuthorityInfo_describesActiveKey() {
        // Act
        AuthorityInfoResponse info = certificateAuthorityService.getAuthorityInfo();

        // Assert
        assertThat(info.getKeyId()).isEqualTo(activeKey.getId());
        assertThat(info.getSignatureAlgorithm()).isEqualTo("SHA256withECDSA");
        assertThat(info.getPublicKeyPem()).startsWith("-----BEGIN PUBLIC KEY-----");
        assertThat(info.getSupportedLevels()).containsExactly("BRONZE", "SILVER", "GOLD", "PLATINUM");
    }

    @Test
    void listExpiring_requiresPositiveDays() {
        assertThatThrownBy(() -> certificateAuthorityService.listExpiring(0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void listExpiring_findsCertificatesInsideWindow() {
        // Arrange
        CertificateRecord soon = certificateAuthorityService.submitSigningRequest(
                TestRequests.signingRequest(CgaLevel.BRONZE).toBuilder().validityDays(3).build());

        // Act & Assert
        assertThat(certificateAuthorityService.listExpiring(7))
                .extracting(CertificateRecord::getId)
                .contains(soon.getId());
        assertThat(certificateAuthorityService.listExpiring(1))
                .extracting(CertificateRecord::getId)
                .doesNotContain(soon.getId());
    }

    @Test
    void getMetrics_countsRegistryActivity() {
        // Arrange
        CertificateRecord certificate = certificateAuthorityService.submitSigningRequest(
                TestRequests.signingRequest(CgaLevel.PLATINUM));
        certificateAuthorityService.verifyCertificate(certificate.getId(), null, "metrics");

        // Act
        VerificationMetricsResponse metrics = certificateAuthorityService.getMetrics();

        // Assert
        assertThat(metrics.getCertificatesByStatus()).containsKeys("ACTIVE", "REVOKED", "SUPERSEDED");
        assertThat(metrics.getCertificatesByStatus().get("ACTIVE")).isPositive();
        assertThat(metrics.getActiveCertificatesByLevel()).containsKey("PLATINUM");
        assertThat(metrics.getVerificationsByResult().get("VALID")).isPositive();
        assertThat(metrics.getVerificationsLast24Hours()).isPositive();
        assertThat(metrics.getVerificationsLast30Days()).isGreaterThanOrEqualTo(metrics.getVerificationsLast7Days());
    }

    @Test
    void incidentSweepThroughFacade() {
        // Arrange
        CertificateRecord first = certificateAuthorityService.submitSigningRequest(
                TestRequests.signingRequest(CgaLevel.GOLD));
        CertificateRecord second = certificateAuthorityService.submitSigningRequest(
                TestRequests.signingRequest(CgaLevel.GOLD));

        // Act
        List<LiveVerificationResult> before = certificateAuthorityService.verifyLiveAgents(List.of(
                VerificationTarget.builder().certificateId(first.getId()).build(),
                VerificationTarget.builder().certificateId(second.getId()).build()));
        List<RevocationRecord> revoked = certificateAuthorityService.revokeAll(
                List.of(first.getId(), second.getId()), "supplier breach", "admin:alice", "INC-77");
        OcspResponse ocsp = certificateAuthorityService.processOcspRequest(OcspRequest.builder()
                .certificateIds(List.of(first.getId(), second.getId()))
                .build());
        RevocationListResponse crl = certificateAuthorityService.getRevocationList();

        // Assert
        assertThat(before).extracting(LiveVerificationResult::getOutcome)
                .containsOnly(LiveVerificationOutcome.VALID);
        assertThat(revoked).hasSize(2);
        assertThat(ocsp.getResponses()).extracting(SingleResponse::getCertStatus)
                .containsOnly(OcspCertStatus.REVOKED);
        assertThat(crl.getRevokedCertificates())
                .extracting(RevocationListResponse.RevokedCertificate::getCertificateId)
                .contains(first.getId(), second.getId());
    }

    @Test
    void renewalsThroughFacade() {
        // Arrange
        CertificateRecord expiring = certificateAuthorityService.submitSigningRequest(
                TestRequests.signingRequest(CgaLevel.SILVER).toBuilder().validityDays(4).build());

        // Act
        RenewalRunSummary summary = certificateAuthorityService.runRenewals();

        // Assert
        assertThat(summary.getResults())
                .filteredOn(result -> result.getCertificateId().equals(expiring.getId()))
                .singleElement()
                .extracting(RenewalResult::getOutcome)
                .isEqualTo(RenewalResult.Outcome.RENEWED);
        assertThat(certificateAuthorityService.requestManualRenewal(expiring.getId(), "admin:alice")
                .getVerificationUrl()).contains(expiring.getId());
    }
}
