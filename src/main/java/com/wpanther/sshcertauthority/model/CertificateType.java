package com.wpanther.sshcertauthority.model;

import com.wpanther.sshcertauthority.exception.DecodingException;

/**
 * Certificate type as encoded in the uint32 "type" field of an OpenSSH certificate
 */
public enum CertificateType {

    USER(1),
    HOST(2);

    private final int code;

    CertificateType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static CertificateType fromCode(long code) {
        for (CertificateType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new DecodingException("Unknown certificate type: " + code);
    }
}
