package com.wpanther.sshcertauthority.signer;

import com.wpanther.sshcertauthority.TestUtils;
import com.wpanther.sshcertauthority.exception.BackendUnavailableException;
import com.wpanther.sshcertauthority.exception.KeyNotFoundException;
import com.wpanther.sshcertauthority.model.EcdsaCurve;
import com.wpanther.sshcertauthority.util.SshKeyUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DisabledException;
import software.amazon.awssdk.services.kms.model.GetPublicKeyRequest;
import software.amazon.awssdk.services.kms.model.GetPublicKeyResponse;
import software.amazon.awssdk.services.kms.model.KeySpec;
import software.amazon.awssdk.services.kms.model.KeyUsageType;
import software.amazon.awssdk.services.kms.model.KmsInternalException;
import software.amazon.awssdk.services.kms.model.MessageType;
import software.amazon.awssdk.services.kms.model.NotFoundException;
import software.amazon.awssdk.services.kms.model.SignRequest;
import software.amazon.awssdk.services.kms.model.SignResponse;
import software.amazon.awssdk.services.kms.model.SigningAlgorithmSpec;

import java.security.KeyPair;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AWSKMSSigningBackend
 */
@ExtendWith(MockitoExtension.class)
class AWSKMSSigningBackendTest {

    private static final String KEY_ID = "alias/ssh-ca";
    private static final String KEY_ARN = "arn:aws:kms:us-east-1:111122223333:key/1234abcd-12ab-34cd-56ef-1234567890ab";

    @Mock
    private KmsClient kmsClient;

    private KeyPair keyPair;

    @BeforeEach
    void setUp() {
        keyPair = TestUtils.generateEcKeyPair(EcdsaCurve.NISTP256);
    }

    private GetPublicKeyResponse.Builder publicKeyResponse() {
        return GetPublicKeyResponse.builder()
                .keyId(KEY_ARN)
                .keyUsage(KeyUsageType.SIGN_VERIFY)
                .keySpec(KeySpec.ECC_NIST_P256)
                .publicKey(SdkBytes.fromByteArray(keyPair.getPublic().getEncoded()));
    }

    @Test
    void testLoadsIdentityFromPublicKey() {
        // Arrange
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class))).thenReturn(publicKeyResponse().build());

        // Act
        AWSKMSSigningBackend backend = new AWSKMSSigningBackend(kmsClient, KEY_ID);

        // Assert
        assertThat(backend.identity().getCurve()).isEqualTo(EcdsaCurve.NISTP256);
        assertThat(backend.identity().getKeyReference()).isEqualTo(KEY_ARN);
        assertThat(backend.publicKeyBlob()).isEqualTo(SshKeyUtil.encodePublicKey(keyPair.getPublic()));
        assertThat(backend.digestAlgorithm()).isEqualTo("SHA-256");
    }

    @Test
    void testSignSendsDigest() {
        // Arrange
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class))).thenReturn(publicKeyResponse().build());
        byte[] der = {0x30, 0x06, 0x02, 0x01, 0x01, 0x02, 0x01, 0x02};
        when(kmsClient.sign(any(SignRequest.class)))
                .thenReturn(SignResponse.builder().signature(SdkBytes.fromByteArray(der)).build());
        AWSKMSSigningBackend backend = new AWSKMSSigningBackend(kmsClient, KEY_ID);
        byte[] digest = new byte[32];

        // Act
        byte[] signature = backend.sign(digest);

        // Assert
        assertThat(signature).isEqualTo(der);
        ArgumentCaptor<SignRequest> captor = ArgumentCaptor.forClass(SignRequest.class);
        verify(kmsClient).sign(captor.capture());
        assertThat(captor.getValue().keyId()).isEqualTo(KEY_ID);
        assertThat(captor.getValue().messageType()).isEqualTo(MessageType.DIGEST);
        assertThat(captor.getValue().signingAlgorithm()).isEqualTo(SigningAlgorithmSpec.ECDSA_SHA_256);
        assertThat(captor.getValue().message().asByteArray()).isEqualTo(digest);
    }

    @Test
    void testUsesSha384ForP384Keys() {
        KeyPair p384 = TestUtils.generateEcKeyPair(EcdsaCurve.NISTP384);
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class))).thenReturn(publicKeyResponse()
                .keySpec(KeySpec.ECC_NIST_P384)
                .publicKey(SdkBytes.fromByteArray(p384.getPublic().getEncoded()))
                .build());

        AWSKMSSigningBackend backend = new AWSKMSSigningBackend(kmsClient, KEY_ID);

        assertThat(backend.identity().getCurve()).isEqualTo(EcdsaCurve.NISTP384);
        assertThat(backend.digestAlgorithm()).isEqualTo("SHA-384");
    }

    @Test
    void testRejectsNonSigningKey() {
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class)))
                .thenReturn(publicKeyResponse().keyUsage(KeyUsageType.ENCRYPT_DECRYPT).build());

        assertThatThrownBy(() -> new AWSKMSSigningBackend(kmsClient, KEY_ID))
                .isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void testRejectsUnsupportedKeySpec() {
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class)))
                .thenReturn(publicKeyResponse().keySpec(KeySpec.RSA_2048).build());

        assertThatThrownBy(() -> new AWSKMSSigningBackend(kmsClient, KEY_ID))
                .isInstanceOf(KeyNotFoundException.class)
                .hasMessageContaining("RSA_2048");
    }

    @Test
    void testRejectsKeySpecThatDoesNotMatchPublicKey() {
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class)))
                .thenReturn(publicKeyResponse().keySpec(KeySpec.ECC_NIST_P384).build());

        assertThatThrownBy(() -> new AWSKMSSigningBackend(kmsClient, KEY_ID))
                .isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void testMissingKeyIsReportedAsKeyNotFound() {
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class)))
                .thenThrow(NotFoundException.builder().message("Alias not found").build());

        assertThatThrownBy(() -> new AWSKMSSigningBackend(kmsClient, KEY_ID))
                .isInstanceOf(KeyNotFoundException.class)
                .hasMessageContaining("Alias not found");
    }

    @Test
    void testDisabledKeyIsReportedAsKeyNotFound() {
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class))).thenReturn(publicKeyResponse().build());
        when(kmsClient.sign(any(SignRequest.class)))
                .thenThrow(DisabledException.builder().message("Key is disabled").build());
        AWSKMSSigningBackend backend = new AWSKMSSigningBackend(kmsClient, KEY_ID);

        assertThatThrownBy(() -> backend.sign(new byte[32]))
                .isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void testServiceFailureIsReportedAsBackendUnavailable() {
        when(kmsClient.getPublicKey(any(GetPublicKeyRequest.class))).thenReturn(publicKeyResponse().build());
        when(kmsClient.sign(any(SignRequest.class)))
                .thenThrow(KmsInternalException.builder().message("Internal error").build())
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));
        AWSKMSSigningBackend backend = new AWSKMSSigningBackend(kmsClient, KEY_ID);

        assertThatThrownBy(() -> backend.sign(new byte[32]))
                .isInstanceOf(BackendUnavailableException.class);
        assertThatThrownBy(() -> backend.sign(new byte[32]))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("Unable to execute HTTP request");
    }
}
