package com.wpanther.sshcertauthority.signer;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

import com.wpanther.sshcertauthority.exception.EncodingException;
import com.wpanther.sshcertauthority.model.CertificateLimits;
import com.wpanther.sshcertauthority.model.CertificateParameters;
import com.wpanther.sshcertauthority.model.EcdsaCurve;
import com.wpanther.sshcertauthority.model.EcdsaSignature;
import com.wpanther.sshcertauthority.model.SigningIdentity;
import com.wpanther.sshcertauthority.model.SshCertificate;
import com.wpanther.sshcertauthority.model.SshPublicKey;
import com.wpanther.sshcertauthority.util.SignatureCodec;
import com.wpanther.sshcertauthority.util.SshCertificateCodec;
import com.wpanther.sshcertauthority.util.SshKeyUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * SSH CA key whose private half lives in a cloud key management service.
 * Builds certificates, has the backend sign their digest and attaches the SSH signature.
 * Holds no mutable state, so a single instance serves concurrent requests.
 */
@Slf4j
public class CloudSigningKey {

    public static final Duration DEFAULT_VALIDITY = Duration.ofHours(1);

    private final SigningBackend backend;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final Duration defaultValidity;

    public CloudSigningKey(SigningBackend backend, SecureRandom secureRandom) {
        this(backend, secureRandom, Clock.systemUTC(), DEFAULT_VALIDITY);
    }

    public CloudSigningKey(SigningBackend backend, SecureRandom secureRandom, Clock clock, Duration defaultValidity) {
        if (defaultValidity.isNegative() || defaultValidity.isZero()) {
            throw new IllegalArgumentException("Default validity must be positive: " + defaultValidity);
        }
        this.backend = backend;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.defaultValidity = defaultValidity;
    }

    /**
     * Signs a subject public key to produce a certificate.
     * Each call generates a new nonce and makes exactly one call to the backend.
     * An unset serial is drawn at random; an unset validity window starts now and
     * lasts for the default validity.
     *
     * @param subjectKey The key to certify
     * @param parameters Certificate fields
     * @return The signed certificate
     */
    public SshCertificate signCertificate(SshPublicKey subjectKey, CertificateParameters parameters) {
        SigningIdentity identity = backend.identity();

        byte[] nonce = new byte[CertificateLimits.NONCE_LENGTH];
        secureRandom.nextBytes(nonce);

        long serial = parameters.getSerial() != null ? parameters.getSerial() : secureRandom.nextLong();
        long validAfter = parameters.getValidAfter() != null
            ? parameters.getValidAfter()
            : clock.instant().getEpochSecond();
        long validBefore = parameters.getValidBefore() != null
            ? parameters.getValidBefore()
            : validAfter + defaultValidity.getSeconds();

        SshCertificate unsigned = SshCertificate.builder()
            .nonce(nonce)
            .publicKey(subjectKey)
            .serial(serial)
            .type(parameters.getType())
            .keyId(parameters.getKeyId())
            .principals(parameters.getPrincipals())
            .validAfter(validAfter)
            .validBefore(validBefore)
            .criticalOptions(parameters.getCriticalOptions())
            .extensions(parameters.getExtensions())
            .signatureKey(identity.getPublicKeyBlob())
            .build();

        byte[] toBeSigned = SshCertificateCodec.toBeSignedBytes(unsigned);
        byte[] digest = digest(toBeSigned, backend.digestAlgorithm());

        log.debug("Requesting signature from {} for certificate key id '{}'",
            identity.getKeyReference(), parameters.getKeyId());
        byte[] der = backend.sign(digest);

        EcdsaCurve curve = identity.getCurve();
        EcdsaSignature signature = SignatureCodec.derToRaw(der, curve.getComponentWidth());
        byte[] signatureBlob = SignatureCodec.rawToSignatureBlob(curve.getKeyType(), signature.getR(), signature.getS());

        return unsigned.toBuilder()
            .signature(signatureBlob)
            .build();
    }

    public byte[] publicKeyBlob() {
        return backend.publicKeyBlob();
    }

    /**
     * Renders the CA public key for authorized_keys or TrustedUserCAKeys
     *
     * @param comment Optional comment, defaulting to the current date and time
     */
    public String publicKeyString(String comment) {
        return SshKeyUtil.toOpenSshLine(backend.identity().getKeyType(), backend.publicKeyBlob(), comment, clock);
    }

    public SigningIdentity identity() {
        return backend.identity();
    }

    private static byte[] digest(byte[] data, String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new EncodingException("Digest algorithm not available: " + algorithm, e);
        }
    }
}
