package com.wpanther.sshcertauthority.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.wpanther.sshcertauthority.signer.CloudSigningKey;
import com.wpanther.sshcertauthority.signer.SigningBackend;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires the CA signing key over whichever backend app.ca.backend selected
 */
@Configuration
@Slf4j
public class CertificateAuthorityConfig {

    @Bean
    public CloudSigningKey cloudSigningKey(SigningBackend signingBackend, SecureRandom secureRandom, Clock clock,
            @Value("${app.ca.default-validity:1h}") Duration defaultValidity) {
        CloudSigningKey key = new CloudSigningKey(signingBackend, secureRandom, clock, defaultValidity);
        log.info("SSH CA key {} ready: {}", key.identity().getKeyReference(), key.publicKeyString("ca"));
        return key;
    }
}
