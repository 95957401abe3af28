package com.wpanther.sshcertauthority.exception;

/**
 * Raised when a certificate or public key byte stream cannot be parsed
 */
public class DecodingException extends SigningException {

    public DecodingException(String message) {
        super(ErrorCode.DECODING_ERROR, message);
    }

    public DecodingException(String message, Throwable cause) {
        super(ErrorCode.DECODING_ERROR, message, cause);
    }
}
