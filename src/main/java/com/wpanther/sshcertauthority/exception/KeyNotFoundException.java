package com.wpanther.sshcertauthority.exception;

/**
 * Raised when the referenced cloud key does not exist or is disabled
 */
public class KeyNotFoundException extends SigningException {

    public KeyNotFoundException(String message) {
        super(ErrorCode.KEY_NOT_FOUND, message);
    }

    public KeyNotFoundException(String message, Throwable cause) {
        super(ErrorCode.KEY_NOT_FOUND, message, cause);
    }
}
