package com.wpanther.sshcertauthority.signer;

import com.wpanther.sshcertauthority.model.SigningIdentity;

/**
 * A CA key held by a key management service that can sign a digest but knows nothing
 * about SSH. Implementations must be immutable after construction and safe for
 * concurrent use; provider addressing and credentials stay inside the implementation.
 */
public interface SigningBackend {

    /**
     * @return The CA public key in SSH wire format
     */
    default byte[] publicKeyBlob() {
        return identity().getPublicKeyBlob();
    }

    /**
     * @return The JCA name of the digest the key signs over, fixed by the curve
     */
    default String digestAlgorithm() {
        return identity().getCurve().getDigestAlgorithm();
    }

    /**
     * Signs a precomputed digest
     *
     * @param digest Digest computed with {@link #digestAlgorithm()}
     * @return DER encoded ECDSA signature
     * @throws com.wpanther.sshcertauthority.exception.BackendUnavailableException on transport or authentication failure
     * @throws com.wpanther.sshcertauthority.exception.KeyNotFoundException if the key is missing or disabled
     */
    byte[] sign(byte[] digest);

    SigningIdentity identity();
}
