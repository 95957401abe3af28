package com.wpanther.sshcertauthority.service;

import org.springframework.stereotype.Service;

import com.wpanther.sshcertauthority.exception.ErrorCode;
import com.wpanther.sshcertauthority.model.SshCertificate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Audit trail of signing operations. Entries go to the application log only;
 * issued certificates are not stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SigningLogService {

    private final MetricsService metricsService;

    /**
     * Logs an issued certificate
     */
    public void logSuccessfulSigning(SshCertificate certificate, String caKeyReference) {
        log.info("Issued {} certificate serial={} keyId='{}' principals={} validAfter={} validBefore={} ca={}",
            certificate.getType(),
            Long.toUnsignedString(certificate.getSerial()),
            certificate.getKeyId(),
            certificate.getPrincipals(),
            Long.toUnsignedString(certificate.getValidAfter()),
            Long.toUnsignedString(certificate.getValidBefore()),
            caKeyReference);
        metricsService.recordSigned(certificate.getPublicKey().getKeyType());
    }

    /**
     * Logs a request turned away before signing was attempted
     */
    public void logRejectedRequest(ErrorCode errorCode, String errorMessage) {
        log.warn("Rejected signing request: {} {}", errorCode, errorMessage);
        metricsService.recordRejected(errorCode);
    }

    /**
     * Logs a request that passed validation but could not be signed
     */
    public void logFailedSigning(ErrorCode errorCode, String errorMessage) {
        log.warn("Failed signing request: {} {}", errorCode, errorMessage);
        metricsService.recordFailed(errorCode);
    }
}
