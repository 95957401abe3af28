package com.wpanther.sshcertauthority.controller;

import java.util.Base64;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.sshcertauthority.dto.CAPublicKeyResponse;
import com.wpanther.sshcertauthority.dto.CertificateSigningRequest;
import com.wpanther.sshcertauthority.dto.CertificateSigningResponse;
import com.wpanther.sshcertauthority.model.SigningIdentity;
import com.wpanther.sshcertauthority.service.CertificateSigningService;
import com.wpanther.sshcertauthority.signer.CloudSigningKey;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Remote signing API: issues SSH certificates and publishes the CA public key
 */
@RestController
@RequestMapping(value = "/api/v1/certificates", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
public class CertificateSigningController {

    private final CertificateSigningService certificateSigningService;
    private final CloudSigningKey cloudSigningKey;

    /**
     * Signs a subject public key
     */
    @PostMapping
    public ResponseEntity<CertificateSigningResponse> signCertificate(
            @Valid @RequestBody CertificateSigningRequest request) {
        log.debug("Received certificate signing request for key id '{}'", request.getKeyId());

        CertificateSigningResponse response = certificateSigningService.handleSigningRequest(request);
        HttpStatus status = response.isSigned() ? HttpStatus.OK : response.getError().getCode().getHttpStatus();
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Returns the CA public key for TrustedUserCAKeys or @cert-authority entries
     */
    @GetMapping("/ca-public-key")
    public ResponseEntity<CAPublicKeyResponse> getCAPublicKey(
            @RequestParam(value = "comment", required = false) String comment) {
        SigningIdentity identity = cloudSigningKey.identity();
        CAPublicKeyResponse response = CAPublicKeyResponse.builder()
            .keyType(identity.getKeyType())
            .publicKey(Base64.getEncoder().encodeToString(cloudSigningKey.publicKeyBlob()))
            .publicKeyLine(cloudSigningKey.publicKeyString(comment))
            .keyReference(identity.getKeyReference())
            .build();
        return ResponseEntity.ok(response);
    }
}
