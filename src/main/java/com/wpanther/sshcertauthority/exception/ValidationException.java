package com.wpanther.sshcertauthority.exception;

/**
 * Raised when certificate request fields violate protocol limits
 */
public class ValidationException extends SigningException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
