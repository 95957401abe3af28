package com.wpanther.sshcertauthority.exception;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import com.wpanther.sshcertauthority.dto.CertificateSigningResponse;
import com.wpanther.sshcertauthority.service.SigningLogService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.stream.Collectors;

@ControllerAdvice
@RequiredArgsConstructor
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    private final SigningLogService signingLogService;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CertificateSigningResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getAllErrors().stream()
            .map(error -> error instanceof FieldError
                ? ((FieldError) error).getField() + ": " + error.getDefaultMessage()
                : error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return rejected(ErrorCode.VALIDATION_ERROR, "Validation failed: " + message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CertificateSigningResponse> handleUnreadableMessage(HttpMessageNotReadableException ex) {
        return rejected(ErrorCode.VALIDATION_ERROR, "Malformed request body: " + ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CertificateSigningResponse> handleException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(ErrorCode.INTERNAL_ERROR.getHttpStatus())
            .body(CertificateSigningResponse.failed(ErrorCode.INTERNAL_ERROR,
                "An unexpected error occurred: " + ex.getMessage()));
    }

    private ResponseEntity<CertificateSigningResponse> rejected(ErrorCode code, String message) {
        signingLogService.logRejectedRequest(code, message);
        return ResponseEntity.status(code.getHttpStatus())
            .body(CertificateSigningResponse.rejected(code, message));
    }
}
