package com.wpanther.sshcertauthority.exception;

/**
 * Raised when the cloud signing API cannot be reached or rejects the caller's credentials
 */
public class BackendUnavailableException extends SigningException {

    public BackendUnavailableException(String message) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message, cause);
    }
}
