package com.wpanther.sshcertauthority.signer;

import com.google.api.gax.grpc.GrpcStatusCode;
import com.google.api.gax.rpc.FailedPreconditionException;
import com.google.api.gax.rpc.NotFoundException;
import com.google.api.gax.rpc.UnavailableException;
import com.google.cloud.kms.v1.AsymmetricSignRequest;
import com.google.cloud.kms.v1.AsymmetricSignResponse;
import com.google.cloud.kms.v1.CryptoKeyVersion.CryptoKeyVersionAlgorithm;
import com.google.cloud.kms.v1.KeyManagementServiceClient;
import com.google.cloud.kms.v1.PublicKey;
import com.google.protobuf.ByteString;
import com.wpanther.sshcertauthority.TestUtils;
import com.wpanther.sshcertauthority.exception.BackendUnavailableException;
import com.wpanther.sshcertauthority.exception.KeyNotFoundException;
import com.wpanther.sshcertauthority.model.EcdsaCurve;
import com.wpanther.sshcertauthority.util.SshKeyUtil;
import io.grpc.Status;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GCPKMSSigningBackend
 */
@ExtendWith(MockitoExtension.class)
class GCPKMSSigningBackendTest {

    private static final String KEY_VERSION =
            "projects/ssh/locations/global/keyRings/ca/cryptoKeys/user-ca/cryptoKeyVersions/1";

    @Mock
    private KeyManagementServiceClient kmsClient;

    private static String pem(KeyPair keyPair) {
        String body = new String(Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encode(keyPair.getPublic().getEncoded()), StandardCharsets.US_ASCII);
        return "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n";
    }

    private static PublicKey publicKey(KeyPair keyPair, CryptoKeyVersionAlgorithm algorithm) {
        return PublicKey.newBuilder()
                .setName(KEY_VERSION)
                .setAlgorithm(algorithm)
                .setPem(pem(keyPair))
                .build();
    }

    @Test
    void testLoadsIdentityFromPem() {
        // Arrange
        KeyPair keyPair = TestUtils.generateEcKeyPair(EcdsaCurve.NISTP384);
        when(kmsClient.getPublicKey(KEY_VERSION))
                .thenReturn(publicKey(keyPair, CryptoKeyVersionAlgorithm.EC_SIGN_P384_SHA384));

        // Act
        GCPKMSSigningBackend backend = new GCPKMSSigningBackend(kmsClient, KEY_VERSION);

        // Assert
        assertThat(backend.identity().getCurve()).isEqualTo(EcdsaCurve.NISTP384);
        assertThat(backend.identity().getKeyReference()).isEqualTo(KEY_VERSION);
        assertThat(backend.publicKeyBlob()).isEqualTo(SshKeyUtil.encodePublicKey(keyPair.getPublic()));
    }

    @Test
    void testSignSendsSha256Digest() {
        // Arrange
        KeyPair keyPair = TestUtils.generateEcKeyPair(EcdsaCurve.NISTP256);
        when(kmsClient.getPublicKey(KEY_VERSION))
                .thenReturn(publicKey(keyPair, CryptoKeyVersionAlgorithm.EC_SIGN_P256_SHA256));
        byte[] der = {0x30, 0x06, 0x02, 0x01, 0x01, 0x02, 0x01, 0x02};
        when(kmsClient.asymmetricSign(any(AsymmetricSignRequest.class)))
                .thenReturn(AsymmetricSignResponse.newBuilder().setSignature(ByteString.copyFrom(der)).build());
        GCPKMSSigningBackend backend = new GCPKMSSigningBackend(kmsClient, KEY_VERSION);
        byte[] digest = new byte[32];
        digest[0] = 0x42;

        // Act
        byte[] signature = backend.sign(digest);

        // Assert
        assertThat(signature).isEqualTo(der);
        ArgumentCaptor<AsymmetricSignRequest> captor = ArgumentCaptor.forClass(AsymmetricSignRequest.class);
        verify(kmsClient).asymmetricSign(captor.capture());
        assertThat(captor.getValue().getName()).isEqualTo(KEY_VERSION);
        assertThat(captor.getValue().getDigest().getSha256().toByteArray()).isEqualTo(digest);
    }

    @Test
    void testRejectsNonEcAlgorithm() {
        KeyPair keyPair = TestUtils.generateEcKeyPair(EcdsaCurve.NISTP256);
        when(kmsClient.getPublicKey(KEY_VERSION))
                .thenReturn(publicKey(keyPair, CryptoKeyVersionAlgorithm.RSA_SIGN_PSS_2048_SHA256));

        assertThatThrownBy(() -> new GCPKMSSigningBackend(kmsClient, KEY_VERSION))
                .isInstanceOf(KeyNotFoundException.class)
                .hasMessageContaining("RSA_SIGN_PSS_2048_SHA256");
    }

    @Test
    void testRejectsAlgorithmThatDoesNotMatchKey() {
        KeyPair keyPair = TestUtils.generateEcKeyPair(EcdsaCurve.NISTP256);
        when(kmsClient.getPublicKey(KEY_VERSION))
                .thenReturn(publicKey(keyPair, CryptoKeyVersionAlgorithm.EC_SIGN_P384_SHA384));

        assertThatThrownBy(() -> new GCPKMSSigningBackend(kmsClient, KEY_VERSION))
                .isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void testMissingKeyVersionIsReportedAsKeyNotFound() {
        when(kmsClient.getPublicKey(KEY_VERSION)).thenThrow(new NotFoundException(
                new RuntimeException("CryptoKeyVersion not found"), GrpcStatusCode.of(Status.Code.NOT_FOUND), false));

        assertThatThrownBy(() -> new GCPKMSSigningBackend(kmsClient, KEY_VERSION))
                .isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void testSignErrorsAreTranslated() {
        KeyPair keyPair = TestUtils.generateEcKeyPair(EcdsaCurve.NISTP256);
        when(kmsClient.getPublicKey(KEY_VERSION))
                .thenReturn(publicKey(keyPair, CryptoKeyVersionAlgorithm.EC_SIGN_P256_SHA256));
        when(kmsClient.asymmetricSign(any(AsymmetricSignRequest.class)))
                .thenThrow(new FailedPreconditionException(new RuntimeException("key version is DISABLED"),
                        GrpcStatusCode.of(Status.Code.FAILED_PRECONDITION), false))
                .thenThrow(new UnavailableException(new RuntimeException("connection refused"),
                        GrpcStatusCode.of(Status.Code.UNAVAILABLE), true));
        GCPKMSSigningBackend backend = new GCPKMSSigningBackend(kmsClient, KEY_VERSION);

        assertThatThrownBy(() -> backend.sign(new byte[32])).isInstanceOf(KeyNotFoundException.class);
        assertThatThrownBy(() -> backend.sign(new byte[32])).isInstanceOf(BackendUnavailableException.class);
    }
}
