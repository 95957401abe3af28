package com.wpanther.sshcertauthority.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes carried in structured signing responses
 */
public enum ErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    ENCODING_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    DECODING_ERROR(HttpStatus.BAD_REQUEST),
    MALFORMED_SIGNATURE(HttpStatus.BAD_GATEWAY),
    BACKEND_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    KEY_NOT_FOUND(HttpStatus.INTERNAL_SERVER_ERROR),
    SIGNING_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
