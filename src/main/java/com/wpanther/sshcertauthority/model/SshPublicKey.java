package com.wpanther.sshcertauthority.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import lombok.Value;

/**
 * Subject public key of a certificate, kept in SSH wire format
 */
@Value
public class SshPublicKey {

    public static final String SSH_RSA = "ssh-rsa";
    public static final String SSH_DSS = "ssh-dss";
    public static final String SSH_ED25519 = "ssh-ed25519";

    String keyType;

    // string key type followed by the type specific fields
    byte[] blob;

    /**
     * Returns the key fields following the leading key type string. These are the bytes
     * a certificate embeds between its nonce and serial.
     */
    public byte[] publicParts() {
        int offset = 4 + keyType.getBytes(StandardCharsets.UTF_8).length;
        return Arrays.copyOfRange(blob, offset, blob.length);
    }
}
