package com.wpanther.sshcertauthority.signer;

import java.io.IOException;
import java.io.StringReader;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.ECPublicKey;
import java.security.spec.X509EncodedKeySpec;

import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.openssl.PEMParser;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.FailedPreconditionException;
import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.kms.v1.AsymmetricSignRequest;
import com.google.cloud.kms.v1.AsymmetricSignResponse;
import com.google.cloud.kms.v1.CryptoKeyVersion.CryptoKeyVersionAlgorithm;
import com.google.cloud.kms.v1.Digest;
import com.google.cloud.kms.v1.KeyManagementServiceClient;
import com.google.cloud.kms.v1.PublicKey;
import com.google.protobuf.ByteString;
import com.wpanther.sshcertauthority.exception.BackendUnavailableException;
import com.wpanther.sshcertauthority.exception.KeyNotFoundException;
import com.wpanther.sshcertauthority.exception.SigningException;
import com.wpanther.sshcertauthority.model.EcdsaCurve;
import com.wpanther.sshcertauthority.model.SigningIdentity;
import com.wpanther.sshcertauthority.util.SshKeyUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * CA key held in Google Cloud KMS, addressed by its fully qualified crypto key version name
 * ({@code projects/../locations/../keyRings/../cryptoKeys/../cryptoKeyVersions/..}).
 */
@Slf4j
public class GCPKMSSigningBackend implements SigningBackend {

    private final KeyManagementServiceClient kmsClient;
    private final String keyVersionName;
    private final SigningIdentity identity;

    public GCPKMSSigningBackend(KeyManagementServiceClient kmsClient, String keyVersionName) {
        this.kmsClient = kmsClient;
        this.keyVersionName = keyVersionName;

        PublicKey publicKey;
        try {
            publicKey = kmsClient.getPublicKey(keyVersionName);
        } catch (ApiException e) {
            throw translate(e, "Failed to get public key from Google Cloud KMS");
        }

        EcdsaCurve curve = curveOf(publicKey.getAlgorithm());
        ECPublicKey ecPublicKey = parsePem(publicKey.getPem());
        if (SshKeyUtil.curveOf(ecPublicKey) != curve) {
            throw new KeyNotFoundException("Google Cloud KMS public key does not match " + publicKey.getAlgorithm());
        }

        String keyReference = publicKey.getName().isEmpty() ? keyVersionName : publicKey.getName();
        this.identity = new SigningIdentity(curve, SshKeyUtil.encodePublicKey(ecPublicKey), keyReference);

        log.info("Loaded Google Cloud KMS signing key {} ({})", keyReference, curve.getKeyType());
    }

    @Override
    public byte[] sign(byte[] digest) {
        AsymmetricSignRequest request = AsymmetricSignRequest.newBuilder()
            .setName(keyVersionName)
            .setDigest(toDigest(digest))
            .build();
        try {
            AsymmetricSignResponse response = kmsClient.asymmetricSign(request);
            return response.getSignature().toByteArray();
        } catch (ApiException e) {
            throw translate(e, "Failed to sign with Google Cloud KMS");
        }
    }

    @Override
    public SigningIdentity identity() {
        return identity;
    }

    private Digest toDigest(byte[] digest) {
        ByteString value = ByteString.copyFrom(digest);
        switch (identity.getCurve()) {
            case NISTP256:
                return Digest.newBuilder().setSha256(value).build();
            case NISTP384:
                return Digest.newBuilder().setSha384(value).build();
            default:
                return Digest.newBuilder().setSha512(value).build();
        }
    }

    private SigningException translate(ApiException e, String message) {
        // a disabled or destroyed key version fails its precondition
        if (e instanceof NotFoundException || e instanceof FailedPreconditionException) {
            log.error("{}: key version {} is missing or disabled", message, keyVersionName);
            return new KeyNotFoundException(message + ": " + e.getMessage(), e);
        }
        log.error("{} for key version {}", message, keyVersionName, e);
        return new BackendUnavailableException(message + ": " + e.getMessage(), e);
    }

    private static EcdsaCurve curveOf(CryptoKeyVersionAlgorithm algorithm) {
        switch (algorithm) {
            case EC_SIGN_P256_SHA256:
                return EcdsaCurve.NISTP256;
            case EC_SIGN_P384_SHA384:
                return EcdsaCurve.NISTP384;
            default:
                throw new KeyNotFoundException("Unsupported signing algorithm: " + algorithm);
        }
    }

    private static ECPublicKey parsePem(String pem) {
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object parsed = parser.readObject();
            if (!(parsed instanceof SubjectPublicKeyInfo)) {
                throw new KeyNotFoundException("Google Cloud KMS returned no public key");
            }
            byte[] encoded = ((SubjectPublicKeyInfo) parsed).getEncoded();
            java.security.PublicKey publicKey = KeyFactory.getInstance("EC")
                .generatePublic(new X509EncodedKeySpec(encoded));
            if (!(publicKey instanceof ECPublicKey)) {
                throw new KeyNotFoundException("Google Cloud KMS key is not an EC key");
            }
            return (ECPublicKey) publicKey;
        } catch (IOException | GeneralSecurityException e) {
            throw new KeyNotFoundException("Failed to parse Google Cloud KMS public key: " + e.getMessage(), e);
        }
    }
}
