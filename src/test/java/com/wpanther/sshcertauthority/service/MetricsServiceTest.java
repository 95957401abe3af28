package com.wpanther.sshcertauthority.service;

import com.wpanther.sshcertauthority.dto.SigningMetricsResponse;
import com.wpanther.sshcertauthority.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void testCalculateMetrics() {
        // Arrange
        MetricsService metricsService = new MetricsService(clock);
        metricsService.recordSigned("ssh-ed25519");
        metricsService.recordSigned("ssh-ed25519");
        metricsService.recordSigned("ecdsa-sha2-nistp256");
        metricsService.recordRejected(ErrorCode.VALIDATION_ERROR);
        metricsService.recordFailed(ErrorCode.SIGNING_TIMEOUT);
        metricsService.recordFailed(ErrorCode.BACKEND_UNAVAILABLE);

        // Act
        SigningMetricsResponse metrics = metricsService.calculateMetrics();

        // Assert
        assertThat(metrics.getSignedCertificates()).isEqualTo(3);
        assertThat(metrics.getRejectedRequests()).isEqualTo(1);
        assertThat(metrics.getFailedRequests()).isEqualTo(2);
        assertThat(metrics.getCertificatesByKeyType())
                .containsEntry("ssh-ed25519", 2L)
                .containsEntry("ecdsa-sha2-nistp256", 1L);
        assertThat(metrics.getErrorsByCode())
                .containsEntry("VALIDATION_ERROR", 1L)
                .containsEntry("SIGNING_TIMEOUT", 1L)
                .containsEntry("BACKEND_UNAVAILABLE", 1L);
        assertThat(metrics.getStartedAt()).isEqualTo(clock.instant());
        assertThat(metrics.getTimestamp()).isEqualTo(clock.instant());
    }

    @Test
    void testEmptyMetrics() {
        SigningMetricsResponse metrics = new MetricsService(clock).calculateMetrics();

        assertThat(metrics.getSignedCertificates()).isZero();
        assertThat(metrics.getCertificatesByKeyType()).isEmpty();
        assertThat(metrics.getErrorsByCode()).isEmpty();
    }
}
