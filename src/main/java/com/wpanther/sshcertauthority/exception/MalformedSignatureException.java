package com.wpanther.sshcertauthority.exception;

/**
 * Raised when a backend returns a signature that is not a valid ECDSA signature
 */
public class MalformedSignatureException extends SigningException {

    public MalformedSignatureException(String message) {
        super(ErrorCode.MALFORMED_SIGNATURE, message);
    }

    public MalformedSignatureException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_SIGNATURE, message, cause);
    }
}
