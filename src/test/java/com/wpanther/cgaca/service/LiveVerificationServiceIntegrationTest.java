package com.wpanther.cgaca.service;

import com.wpanther.cgaca.dto.SigningRequest;
import com.wpanther.cgaca.dto.ocsp.OcspCertStatus;
import com.wpanther.cgaca.dto.verification.LiveVerificationOutcome;
import com.wpanther.cgaca.dto.verification.LiveVerificationResult;
import com.wpanther.cgaca.dto.verification.ProbeCheck;
import com.wpanther.cgaca.dto.verification.VerificationTarget;
import com.wpanther.cgaca.entity.CertificateRecord;
import com.wpanther.cgaca.entity.CertificateStatus;
import com.wpanther.cgaca.entity.CgaLevel;
import com.wpanther.cgaca.entity.VerificationHistoryRecord;
import com.wpanther.cgaca.entity.VerificationResult;
import com.wpanther.cgaca.support.IntegrationTestSupport;
import com.wpanther.cgaca.support.TestRequests;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LiveVerificationServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private LiveVerificationService liveVerificationService;

    @Autowired
    private OcspResponderService ocspResponderService;

    @Test
    void verify_matchingAgentIsValidAndRecorded() {
        // Arrange
        SigningRequest request = TestRequests.signingRequest(CgaLevel.GOLD);
        CertificateRecord certificate = signingService.sign(request);
        agentStateProbe.reportChecks(List.of(
                ProbeCheck.builder().name("kill_switch").passed(true).latencyMs(12L).build(),
                ProbeCheck.builder().name("health_endpoint").passed(true).build()));

        // Act
        LiveVerificationResult result = liveVerificationService.verify(VerificationTarget.builder()
                .agentId(request.getAgentId())
                .agentVersion(request.getAgentVersion())
                .organizationId(request.getOrganizationId())
                .requestIp("10.0.0.7")
                .action("invoke")
                .build());

        // Assert
        assertThat(result.getOutcome()).isEqualTo(LiveVerificationOutcome.VALID);
        assertThat(result.isPassed()).isTrue();
        assertThat(result.getChecks()).hasSize(2);

        List<VerificationHistoryRecord> history = registry.verificationHistory(certificate.getId(), 10);
        assertThat(history).singleElement().satisfies(record -> {
            assertThat(record.getResult()).isEqualTo(VerificationResult.VALID);
            assertThat(record.getRequestIp()).isEqualTo("10.0.0.7");
            assertThat(record.getDurationMs()).isNotNull();
        });
    }

    @Test
    void verify_repeatedMismatchRevokesCertificate() {
        // Arrange
        CertificateRecord certificate = signingService.sign(TestRequests.signingRequest(CgaLevel.SILVER));
        agentStateProbe.reportHash("0000000000000000000000000000000000000000000000000000000000000000");
        VerificationTarget target = VerificationTarget.builder().certificateId(certificate.getId()).build();

        // Act
        LiveVerificationResult first = liveVerificationService.verify(target);
        liveVerificationService.verify(target);
        LiveVerificationResult third = liveVerificationService.verify(target);

        // Assert
        assertThat(first.getOutcome()).isEqualTo(LiveVerificationOutcome.MISMATCH);
        assertThat(first.isAutoRevoked()).isFalse();
        assertThat(third.isAutoRevoked()).isTrue();
        assertThat(registry.requireCertificate(certificate.getId()).getStatus()).isEqualTo(CertificateStatus.REVOKED);
        assertThat(ocspResponderService.queryStatus(certificate.getId()).getCertStatus())
                .isEqualTo(OcspCertStatus.REVOKED);
        assertThat(registry.verificationHistory(certificate.getId(), 10))
                .extracting(VerificationHistoryRecord::getResult)
                .containsOnly(VerificationResult.INVALID);

        assertThat(liveVerificationService.verify(target).getOutcome()).isEqualTo(LiveVerificationOutcome.REVOKED);
    }

    @Test
    void verify_unknownIdentityIsRecordedAsUnknown() {
        // Act
        LiveVerificationResult result = liveVerificationService.verify(VerificationTarget.builder()
                .agentId("agent-ghost-" + System.nanoTime())
                .agentVersion("9.9.9")
                .organizationId("org-ghost")
                .build());

        // Assert
        assertThat(result.getOutcome()).isEqualTo(LiveVerificationOutcome.INVALID);
        assertThat(registry.verificationHistoryForAgent(result.getAgentId()))
                .singleElement()
                .extracting(VerificationHistoryRecord::getResult)
                .isEqualTo(VerificationResult.UNKNOWN);
    }
}
