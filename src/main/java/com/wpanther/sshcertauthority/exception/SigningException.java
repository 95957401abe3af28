package com.wpanther.sshcertauthority.exception;

/**
 * Base class of every failure raised while building or signing a certificate
 */
public class SigningException extends RuntimeException {

    private final ErrorCode errorCode;

    public SigningException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SigningException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
