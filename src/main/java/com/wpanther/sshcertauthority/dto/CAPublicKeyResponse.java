package com.wpanther.sshcertauthority.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CAPublicKeyResponse {

    private String keyType;
    private String publicKey;

    // line for authorized_keys (cert-authority) or TrustedUserCAKeys
    private String publicKeyLine;

    private String keyReference;
}
