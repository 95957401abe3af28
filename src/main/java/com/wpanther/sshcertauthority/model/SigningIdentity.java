package com.wpanther.sshcertauthority.model;

import lombok.Value;

/**
 * Identifies a CA key held by a cloud key management service.
 * Created once when a backend is constructed and never modified afterwards.
 */
@Value
public class SigningIdentity {

    EcdsaCurve curve;

    // ecdsa-sha2-* public key blob in SSH wire format
    byte[] publicKeyBlob;

    // provider specific reference (key ARN, key vault key id, crypto key version name)
    String keyReference;

    public String getKeyType() {
        return curve.getKeyType();
    }
}
