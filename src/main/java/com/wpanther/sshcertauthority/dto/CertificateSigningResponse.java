package com.wpanther.sshcertauthority.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.wpanther.sshcertauthority.exception.ErrorCode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a signing request: either the signed certificate or an error, never both
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CertificateSigningResponse {

    private Status status;

    // base64 encoded certificate blob
    private String certificate;

    // "<type>-cert-v01@openssh.com <base64> <comment>" as written to *-cert.pub files
    private String certificateLine;

    private String certificateKeyType;
    private String serial;
    private String keyId;
    private List<String> principals;
    private String validAfter;
    private String validBefore;

    private SigningError error;

    public enum Status {
        SIGNED,
        REJECTED,
        FAILED
    }

    @JsonIgnore
    public boolean isSigned() {
        return status == Status.SIGNED;
    }

    public static CertificateSigningResponse rejected(ErrorCode code, String message) {
        return CertificateSigningResponse.builder()
            .status(Status.REJECTED)
            .error(new SigningError(code, message))
            .build();
    }

    public static CertificateSigningResponse failed(ErrorCode code, String message) {
        return CertificateSigningResponse.builder()
            .status(Status.FAILED)
            .error(new SigningError(code, message))
            .build();
    }
}
