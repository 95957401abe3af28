package com.wpanther.sshcertauthority.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to certify a subject public key
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CertificateSigningRequest {

    /**
     * Base64 SSH public key blob, or an OpenSSH public key line ("type base64 comment")
     */
    @NotBlank(message = "Public key is required")
    private String publicKey;

    private List<String> principals;

    // USER or HOST, defaults to USER
    private String certificateType;

    private String keyId;

    // unsigned 64-bit serial as a decimal string, random when absent
    private String serial;

    // epoch seconds; defaults to now
    private Long validAfter;

    // epoch seconds; defaults to validAfter + validForSeconds
    private Long validBefore;

    private Long validForSeconds;

    private Map<String, String> criticalOptions;

    // null means all standard extensions, an empty map means none
    private Map<String, String> extensions;
}
