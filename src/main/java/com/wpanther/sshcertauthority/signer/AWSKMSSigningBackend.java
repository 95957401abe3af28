package com.wpanther.sshcertauthority.signer;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.X509EncodedKeySpec;

import com.wpanther.sshcertauthority.exception.BackendUnavailableException;
import com.wpanther.sshcertauthority.exception.KeyNotFoundException;
import com.wpanther.sshcertauthority.exception.SigningException;
import com.wpanther.sshcertauthority.model.EcdsaCurve;
import com.wpanther.sshcertauthority.model.SigningIdentity;
import com.wpanther.sshcertauthority.util.SshKeyUtil;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DisabledException;
import software.amazon.awssdk.services.kms.model.GetPublicKeyRequest;
import software.amazon.awssdk.services.kms.model.GetPublicKeyResponse;
import software.amazon.awssdk.services.kms.model.KeySpec;
import software.amazon.awssdk.services.kms.model.KeyUsageType;
import software.amazon.awssdk.services.kms.model.KmsInvalidStateException;
import software.amazon.awssdk.services.kms.model.MessageType;
import software.amazon.awssdk.services.kms.model.NotFoundException;
import software.amazon.awssdk.services.kms.model.SignRequest;
import software.amazon.awssdk.services.kms.model.SignResponse;
import software.amazon.awssdk.services.kms.model.SigningAlgorithmSpec;

/**
 * CA key held in AWS KMS, addressed by key id, alias or ARN
 */
@Slf4j
public class AWSKMSSigningBackend implements SigningBackend {

    private final KmsClient kmsClient;
    private final String keyId;
    private final SigningIdentity identity;
    private final SigningAlgorithmSpec signingAlgorithm;

    /**
     * Loads the public key of the KMS key and checks that it is an EC signing key
     *
     * @param kmsClient Client configured for the key's region and credentials
     * @param keyId The KMS key ID or ARN
     */
    public AWSKMSSigningBackend(KmsClient kmsClient, String keyId) {
        this.kmsClient = kmsClient;
        this.keyId = keyId;

        GetPublicKeyResponse response = fetchPublicKey();
        if (response.keyUsage() != KeyUsageType.SIGN_VERIFY) {
            throw new KeyNotFoundException("AWS KMS key " + keyId + " is not a signing key");
        }

        EcdsaCurve curve = curveOf(response.keySpec());
        ECPublicKey publicKey = decodePublicKey(response.publicKey().asByteArray());
        if (SshKeyUtil.curveOf(publicKey) != curve) {
            throw new KeyNotFoundException("AWS KMS public key does not match key spec " + response.keySpec());
        }

        String keyReference = response.keyId() != null ? response.keyId() : keyId;
        this.identity = new SigningIdentity(curve, SshKeyUtil.encodePublicKey(publicKey), keyReference);
        this.signingAlgorithm = determineSigningAlgorithm(curve);

        log.info("Loaded AWS KMS signing key {} ({})", keyReference, curve.getKeyType());
    }

    private GetPublicKeyResponse fetchPublicKey() {
        try {
            return kmsClient.getPublicKey(GetPublicKeyRequest.builder()
                .keyId(keyId)
                .build());
        } catch (SdkException e) {
            throw translate(e, "Failed to get public key from AWS KMS");
        }
    }

    @Override
    public byte[] sign(byte[] digest) {
        try {
            SignRequest signRequest = SignRequest.builder()
                .keyId(keyId)
                .message(SdkBytes.fromByteArray(digest))
                .messageType(MessageType.DIGEST)
                .signingAlgorithm(signingAlgorithm)
                .build();

            SignResponse signResponse = kmsClient.sign(signRequest);
            return signResponse.signature().asByteArray();
        } catch (SdkException e) {
            throw translate(e, "Failed to sign with AWS KMS");
        }
    }

    @Override
    public SigningIdentity identity() {
        return identity;
    }

    private SigningException translate(SdkException e, String message) {
        if (e instanceof NotFoundException
                || e instanceof DisabledException
                || e instanceof KmsInvalidStateException) {
            log.error("{}: key {} is missing or disabled", message, keyId);
            return new KeyNotFoundException(message + ": " + e.getMessage(), e);
        }
        log.error("{} for key {}", message, keyId, e);
        return new BackendUnavailableException(message + ": " + e.getMessage(), e);
    }

    private static EcdsaCurve curveOf(KeySpec keySpec) {
        if (keySpec == null) {
            throw new KeyNotFoundException("AWS KMS key has no key spec");
        }
        switch (keySpec) {
            case ECC_NIST_P256:
                return EcdsaCurve.NISTP256;
            case ECC_NIST_P384:
                return EcdsaCurve.NISTP384;
            case ECC_NIST_P521:
                return EcdsaCurve.NISTP521;
            default:
                throw new KeyNotFoundException("Unsupported AWS KMS key spec: " + keySpec);
        }
    }

    private static SigningAlgorithmSpec determineSigningAlgorithm(EcdsaCurve curve) {
        switch (curve) {
            case NISTP256:
                return SigningAlgorithmSpec.ECDSA_SHA_256;
            case NISTP384:
                return SigningAlgorithmSpec.ECDSA_SHA_384;
            case NISTP521:
                return SigningAlgorithmSpec.ECDSA_SHA_512;
            default:
                throw new KeyNotFoundException("Unsupported curve: " + curve);
        }
    }

    private static ECPublicKey decodePublicKey(byte[] subjectPublicKeyInfo) {
        try {
            PublicKey publicKey = KeyFactory.getInstance("EC")
                .generatePublic(new X509EncodedKeySpec(subjectPublicKeyInfo));
            return (ECPublicKey) publicKey;
        } catch (GeneralSecurityException | ClassCastException e) {
            throw new KeyNotFoundException("AWS KMS returned an unusable EC public key: " + e.getMessage(), e);
        }
    }
}
