package com.wpanther.sshcertauthority.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.sshcertauthority.TestUtils;
import com.wpanther.sshcertauthority.dto.CertificateSigningRequest;
import com.wpanther.sshcertauthority.model.CertificateType;
import com.wpanther.sshcertauthority.model.EcdsaCurve;
import com.wpanther.sshcertauthority.model.SshCertificate;
import com.wpanther.sshcertauthority.signer.LocalSigningBackend;
import com.wpanther.sshcertauthority.signer.SigningBackend;
import com.wpanther.sshcertauthority.util.SignatureCodec;
import com.wpanther.sshcertauthority.util.SshCertificateCodec;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.security.Signature;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End to end tests of the signing API over an in-process CA key
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CertificateSigningControllerTest {

    @TestConfiguration
    static class LocalBackendConfig {

        @Bean
        SigningBackend signingBackend() {
            return new LocalSigningBackend(EcdsaCurve.NISTP256);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SigningBackend signingBackend;

    @Test
    void testSignCertificate() throws Exception {
        // Arrange
        CertificateSigningRequest request = CertificateSigningRequest.builder()
                .publicKey(TestUtils.openSshLine(TestUtils.ecdsaSubjectKeyBlob(), "test.user@laptop"))
                .principals(List.of("test.user"))
                .keyId("test.user")
                .serial("42")
                .validForSeconds(600L)
                .criticalOptions(Map.of("force-command", "/usr/bin/true"))
                .build();

        // Act
        MvcResult result = mockMvc.perform(post("/api/v1/certificates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SIGNED"))
                .andExpect(jsonPath("$.serial").value("42"))
                .andExpect(jsonPath("$.certificateKeyType").value("ecdsa-sha2-nistp256-cert-v01@openssh.com"))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andReturn();

        // Assert
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        SshCertificate certificate = SshCertificateCodec.parse(
                Base64.getDecoder().decode(body.get("certificate").asText()));
        assertThat(certificate.getType()).isEqualTo(CertificateType.USER);
        assertThat(certificate.getPrincipals()).containsExactly("test.user");
        assertThat(certificate.getCriticalOptions()).containsEntry("force-command", "/usr/bin/true");
        assertThat(certificate.getValidBefore() - certificate.getValidAfter()).isEqualTo(600L);

        SignatureCodec.ParsedSignature signature = SignatureCodec.parseSignatureBlob(certificate.getSignature());
        Signature verifier = Signature.getInstance("SHA256withECDSA");
        verifier.initVerify(((LocalSigningBackend) signingBackend).getPublicKey());
        verifier.update(SshCertificateCodec.toBeSignedBytes(certificate));
        assertThat(verifier.verify(SignatureCodec.rawToDer(
                signature.getSignature().getR(), signature.getSignature().getS()))).isTrue();
    }

    @Test
    void testInvalidPublicKeyIsRejected() throws Exception {
        CertificateSigningRequest request = CertificateSigningRequest.builder()
                .publicKey("ssh-ed25519 AAAA broken")
                .principals(List.of("test.user"))
                .build();

        mockMvc.perform(post("/api/v1/certificates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.certificate").doesNotExist());
    }

    @Test
    void testMissingPublicKeyIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/certificates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .content("{\"principals\":[\"test.user\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void testMalformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/certificates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .content("{\"publicKey\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void testGetCAPublicKey() throws Exception {
        String expectedBlob = Base64.getEncoder().encodeToString(signingBackend.publicKeyBlob());

        mockMvc.perform(get("/api/v1/certificates/ca-public-key")
                        .param("comment", "ssh-ca")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.keyType").value("ecdsa-sha2-nistp256"))
                .andExpect(jsonPath("$.publicKey").value(expectedBlob))
                .andExpect(jsonPath("$.publicKeyLine").value("ecdsa-sha2-nistp256 " + expectedBlob + " ssh-ca"))
                .andExpect(jsonPath("$.keyReference").value("local/nistp256"));
    }

    @Test
    void testGetMetrics() throws Exception {
        mockMvc.perform(get("/api/v1/metrics").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.signedCertificates").isNumber())
                .andExpect(jsonPath("$.rejectedRequests").isNumber())
                .andExpect(jsonPath("$.startedAt").exists());
    }
}
