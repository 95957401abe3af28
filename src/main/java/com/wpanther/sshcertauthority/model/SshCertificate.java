package com.wpanther.sshcertauthority.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Builder;
import lombok.Value;

/**
 * In-memory form of an OpenSSH certificate (PROTOCOL.certkeys).
 * Fields are kept in wire order; options and extensions are sorted by name.
 * Collections and byte arrays are copied on the way in and out.
 */
@Value
public class SshCertificate {

    public static final String CERT_SUFFIX = "-cert-v01@openssh.com";

    public static final long MIN_EPOCH = 0L;
    public static final long INFINITY = 0xffff_ffff_ffff_ffffL;

    byte[] nonce;
    SshPublicKey publicKey;
    long serial;
    CertificateType type;
    String keyId;
    List<String> principals;
    long validAfter;
    long validBefore;
    SortedMap<String, String> criticalOptions;
    SortedMap<String, String> extensions;
    byte[] reserved;

    // CA public key blob
    byte[] signatureKey;

    // SSH signature blob: string signature type, string signature data
    byte[] signature;

    @Builder(toBuilder = true)
    private SshCertificate(byte[] nonce, SshPublicKey publicKey, long serial, CertificateType type, String keyId,
            List<String> principals, Long validAfter, Long validBefore,
            Map<String, String> criticalOptions, Map<String, String> extensions,
            byte[] reserved, byte[] signatureKey, byte[] signature) {
        this.nonce = copy(nonce);
        this.publicKey = publicKey;
        this.serial = serial;
        this.type = type;
        this.keyId = keyId;
        this.principals = principals == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(principals));
        this.validAfter = validAfter == null ? MIN_EPOCH : validAfter;
        this.validBefore = validBefore == null ? INFINITY : validBefore;
        this.criticalOptions = sortedCopy(criticalOptions);
        this.extensions = sortedCopy(extensions);
        this.reserved = reserved == null ? new byte[0] : reserved.clone();
        this.signatureKey = copy(signatureKey);
        this.signature = copy(signature);
    }

    public byte[] getNonce() {
        return copy(nonce);
    }

    public byte[] getReserved() {
        return reserved.clone();
    }

    public byte[] getSignatureKey() {
        return copy(signatureKey);
    }

    public byte[] getSignature() {
        return copy(signature);
    }

    public String getCertificateKeyType() {
        return publicKey.getKeyType() + CERT_SUFFIX;
    }

    /**
     * An empty principal list means the certificate is valid for any principal.
     */
    public boolean isValidForPrincipal(String principal) {
        return principals.isEmpty() || principals.contains(principal);
    }

    public boolean isValidAt(long epochSecond) {
        return Long.compareUnsigned(validAfter, epochSecond) <= 0
            && Long.compareUnsigned(epochSecond, validBefore) < 0;
    }

    public boolean isSigned() {
        return signature != null;
    }

    private static byte[] copy(byte[] bytes) {
        return bytes == null ? null : bytes.clone();
    }

    private static SortedMap<String, String> sortedCopy(Map<String, String> options) {
        return options == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(options));
    }
}
