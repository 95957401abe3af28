package com.wpanther.sshcertauthority.service;

import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import com.wpanther.sshcertauthority.dto.CertificateSigningRequest;
import com.wpanther.sshcertauthority.dto.CertificateSigningResponse;
import com.wpanther.sshcertauthority.exception.BackendUnavailableException;
import com.wpanther.sshcertauthority.exception.ErrorCode;
import com.wpanther.sshcertauthority.exception.SigningException;
import com.wpanther.sshcertauthority.model.SshCertificate;
import com.wpanther.sshcertauthority.signer.CloudSigningKey;
import com.wpanther.sshcertauthority.util.SshCertificateCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * Remote signing service. Each request moves through
 * RECEIVED, then VALIDATED or REJECTED, then SIGNED or FAILED, and always ends
 * in a response value; no exception leaves {@link #handleSigningRequest}.
 */
@Service
@Slf4j
public class CertificateSigningService {

    private final CloudSigningKey cloudSigningKey;
    private final CertificateRequestValidationService validationService;
    private final SigningLogService signingLogService;
    private final AsyncTaskExecutor signingExecutor;
    private final Duration signingTimeout;

    public CertificateSigningService(CloudSigningKey cloudSigningKey,
            CertificateRequestValidationService validationService,
            SigningLogService signingLogService,
            @Qualifier("asyncSigningExecutor") AsyncTaskExecutor signingExecutor,
            @Value("${app.ca.signing-timeout:10s}") Duration signingTimeout) {
        this.cloudSigningKey = cloudSigningKey;
        this.validationService = validationService;
        this.signingLogService = signingLogService;
        this.signingExecutor = signingExecutor;
        this.signingTimeout = signingTimeout;
    }

    /**
     * Validates and signs a request using the configured timeout
     */
    public CertificateSigningResponse handleSigningRequest(CertificateSigningRequest request) {
        return handleSigningRequest(request, signingTimeout);
    }

    /**
     * Validates and signs a request
     *
     * @param request The certificate signing request
     * @param timeout Upper bound on the wait for the signing backend
     * @return The signed certificate, or a REJECTED / FAILED response carrying the error
     */
    public CertificateSigningResponse handleSigningRequest(CertificateSigningRequest request, Duration timeout) {
        log.debug("Signing request received");

        ValidatedRequest validated;
        try {
            validated = validationService.validate(request);
            log.debug("Signing request validated: keyId='{}' type={}",
                validated.getParameters().getKeyId(), validated.getParameters().getType());
        } catch (SigningException e) {
            signingLogService.logRejectedRequest(e.getErrorCode(), e.getMessage());
            return CertificateSigningResponse.rejected(e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while validating signing request", e);
            signingLogService.logRejectedRequest(ErrorCode.INTERNAL_ERROR, e.getMessage());
            return CertificateSigningResponse.rejected(ErrorCode.INTERNAL_ERROR,
                "An unexpected error occurred: " + e.getMessage());
        }

        try {
            SshCertificate certificate = signWithTimeout(validated, timeout);
            byte[] encoded = SshCertificateCodec.encode(certificate);
            signingLogService.logSuccessfulSigning(certificate, cloudSigningKey.identity().getKeyReference());
            CertificateSigningResponse response = toResponse(certificate, encoded);
            log.debug("Signing response ready for serial {}", response.getSerial());
            return response;
        } catch (SigningException e) {
            signingLogService.logFailedSigning(e.getErrorCode(), e.getMessage());
            return CertificateSigningResponse.failed(e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while signing certificate", e);
            signingLogService.logFailedSigning(ErrorCode.INTERNAL_ERROR, e.getMessage());
            return CertificateSigningResponse.failed(ErrorCode.INTERNAL_ERROR,
                "An unexpected error occurred: " + e.getMessage());
        }
    }

    private SshCertificate signWithTimeout(ValidatedRequest validated, Duration timeout) {
        Future<SshCertificate> future;
        try {
            future = signingExecutor.submit(
                () -> cloudSigningKey.signCertificate(validated.getSubjectKey(), validated.getParameters()));
        } catch (TaskRejectedException e) {
            throw new BackendUnavailableException("Signing capacity exhausted, try again later", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SigningException(ErrorCode.SIGNING_TIMEOUT,
                "Signing backend did not respond within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SigningException(ErrorCode.INTERNAL_ERROR, "Signing was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SigningException(ErrorCode.INTERNAL_ERROR, "Signing failed: " + cause, cause);
        }
    }

    private CertificateSigningResponse toResponse(SshCertificate certificate, byte[] encoded) {
        String comment = certificate.getKeyId().isEmpty() ? null : certificate.getKeyId();
        return CertificateSigningResponse.builder()
            .status(CertificateSigningResponse.Status.SIGNED)
            .certificate(Base64.getEncoder().encodeToString(encoded))
            .certificateLine(SshCertificateCodec.certificateLine(certificate, comment))
            .certificateKeyType(certificate.getCertificateKeyType())
            .serial(Long.toUnsignedString(certificate.getSerial()))
            .keyId(certificate.getKeyId())
            .principals(certificate.getPrincipals())
            .validAfter(Long.toUnsignedString(certificate.getValidAfter()))
            .validBefore(Long.toUnsignedString(certificate.getValidBefore()))
            .build();
    }
}
