package com.wpanther.sshcertauthority.model;

/**
 * Field limits enforced on certificates before they are encoded
 */
public final class CertificateLimits {

    // SSHKEY_CERT_MAX_PRINCIPALS in OpenSSH
    public static final int MAX_PRINCIPALS = 256;

    public static final int MAX_PRINCIPAL_LENGTH = 255;
    public static final int MAX_KEY_ID_LENGTH = 1024;
    public static final int MAX_OPTION_NAME_LENGTH = 255;
    public static final int MAX_OPTION_VALUE_LENGTH = 4096;

    public static final int NONCE_LENGTH = 32;

    private CertificateLimits() {
    }
}
