package com.wpanther.sshcertauthority.signer;

import java.security.KeyPair;
import java.security.interfaces.ECPublicKey;
import java.util.Locale;

import com.azure.core.exception.HttpResponseException;
import com.azure.core.exception.ResourceNotFoundException;
import com.azure.security.keyvault.keys.KeyClient;
import com.azure.security.keyvault.keys.cryptography.CryptographyClient;
import com.azure.security.keyvault.keys.cryptography.models.SignResult;
import com.azure.security.keyvault.keys.cryptography.models.SignatureAlgorithm;
import com.azure.security.keyvault.keys.models.JsonWebKey;
import com.azure.security.keyvault.keys.models.KeyCurveName;
import com.azure.security.keyvault.keys.models.KeyVaultKey;
import com.wpanther.sshcertauthority.exception.BackendUnavailableException;
import com.wpanther.sshcertauthority.exception.KeyNotFoundException;
import com.wpanther.sshcertauthority.exception.SigningException;
import com.wpanther.sshcertauthority.model.EcdsaCurve;
import com.wpanther.sshcertauthority.model.EcdsaSignature;
import com.wpanther.sshcertauthority.model.SigningIdentity;
import com.wpanther.sshcertauthority.util.SignatureCodec;
import com.wpanther.sshcertauthority.util.SshKeyUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * CA key held in Azure Key Vault. Key Vault returns ES256/ES384/ES512 signatures as
 * fixed width r || s, which are re-encoded as DER here.
 */
@Slf4j
public class AzureKeyVaultSigningBackend implements SigningBackend {

    private static final int HTTP_NOT_FOUND = 404;

    private final CryptographyClient cryptographyClient;
    private final SigningIdentity identity;
    private final SignatureAlgorithm signatureAlgorithm;

    /**
     * @param key The Key Vault key, as returned by {@link #fetchKey(KeyClient, String)}
     * @param cryptographyClient Client bound to the key's identifier
     */
    public AzureKeyVaultSigningBackend(KeyVaultKey key, CryptographyClient cryptographyClient) {
        this.cryptographyClient = cryptographyClient;

        Boolean enabled = key.getProperties() == null ? null : key.getProperties().isEnabled();
        if (Boolean.FALSE.equals(enabled)) {
            throw new KeyNotFoundException("Azure Key Vault key " + key.getId() + " is disabled");
        }

        JsonWebKey jsonWebKey = key.getKey();
        if (jsonWebKey == null) {
            throw new KeyNotFoundException("Azure Key Vault key " + key.getId() + " has no key material");
        }
        EcdsaCurve curve = curveOf(jsonWebKey.getCurveName());

        ECPublicKey publicKey;
        try {
            KeyPair keyPair = jsonWebKey.toEc();
            publicKey = (ECPublicKey) keyPair.getPublic();
        } catch (RuntimeException e) {
            throw new KeyNotFoundException("Azure Key Vault key " + key.getId()
                + " is not a usable EC key: " + e.getMessage(), e);
        }

        this.identity = new SigningIdentity(curve, SshKeyUtil.encodePublicKey(publicKey), key.getId());
        this.signatureAlgorithm = signatureAlgorithmOf(curve);

        log.info("Loaded Azure Key Vault signing key {} ({})", key.getId(), curve.getKeyType());
    }

    /**
     * Retrieves the latest version of a key from the vault
     */
    public static KeyVaultKey fetchKey(KeyClient keyClient, String keyName) {
        try {
            return keyClient.getKey(keyName);
        } catch (RuntimeException e) {
            throw translate(e, "Failed to get key " + keyName + " from Azure Key Vault");
        }
    }

    @Override
    public byte[] sign(byte[] digest) {
        SignResult result;
        try {
            result = cryptographyClient.sign(signatureAlgorithm, digest);
        } catch (RuntimeException e) {
            throw translate(e, "Failed to sign with Azure Key Vault key " + identity.getKeyReference());
        }
        EcdsaSignature signature = SignatureCodec.concatenatedToRaw(
            result.getSignature(), identity.getCurve().getComponentWidth());
        return SignatureCodec.rawToDer(signature.getR(), signature.getS());
    }

    @Override
    public SigningIdentity identity() {
        return identity;
    }

    private static SigningException translate(RuntimeException e, String message) {
        if (e instanceof ResourceNotFoundException) {
            log.error("{}: key not found", message);
            return new KeyNotFoundException(message + ": " + e.getMessage(), e);
        }
        if (e instanceof HttpResponseException) {
            HttpResponseException httpError = (HttpResponseException) e;
            boolean notFound = httpError.getResponse() != null
                && httpError.getResponse().getStatusCode() == HTTP_NOT_FOUND;
            boolean disabled = e.getMessage() != null && e.getMessage().toLowerCase(Locale.ROOT).contains("disabled");
            if (notFound || disabled) {
                log.error("{}: key missing or disabled", message);
                return new KeyNotFoundException(message + ": " + e.getMessage(), e);
            }
        }
        log.error(message, e);
        return new BackendUnavailableException(message + ": " + e.getMessage(), e);
    }

    private static EcdsaCurve curveOf(KeyCurveName curveName) {
        if (KeyCurveName.P_256.equals(curveName)) {
            return EcdsaCurve.NISTP256;
        } else if (KeyCurveName.P_384.equals(curveName)) {
            return EcdsaCurve.NISTP384;
        } else if (KeyCurveName.P_521.equals(curveName)) {
            return EcdsaCurve.NISTP521;
        }
        throw new KeyNotFoundException("Unsupported Azure Key Vault curve: " + curveName);
    }

    private static SignatureAlgorithm signatureAlgorithmOf(EcdsaCurve curve) {
        switch (curve) {
            case NISTP256:
                return SignatureAlgorithm.ES256;
            case NISTP384:
                return SignatureAlgorithm.ES384;
            default:
                return SignatureAlgorithm.ES512;
        }
    }
}
