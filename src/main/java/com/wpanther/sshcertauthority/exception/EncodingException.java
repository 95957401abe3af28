package com.wpanther.sshcertauthority.exception;

/**
 * Raised when a certificate field is unset or exceeds a protocol limit during encoding
 */
public class EncodingException extends SigningException {

    public EncodingException(String message) {
        super(ErrorCode.ENCODING_ERROR, message);
    }

    public EncodingException(String message, Throwable cause) {
        super(ErrorCode.ENCODING_ERROR, message, cause);
    }
}
