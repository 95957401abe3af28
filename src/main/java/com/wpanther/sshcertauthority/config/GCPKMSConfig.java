package com.wpanther.sshcertauthority.config;

import java.io.IOException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.google.cloud.kms.v1.KeyManagementServiceClient;
import com.wpanther.sshcertauthority.exception.BackendUnavailableException;
import com.wpanther.sshcertauthority.signer.GCPKMSSigningBackend;
import com.wpanther.sshcertauthority.signer.SigningBackend;

import lombok.extern.slf4j.Slf4j;

/**
 * Configuration for a CA key held in Google Cloud KMS. Credentials come from
 * Application Default Credentials.
 */
@Configuration
@ConditionalOnProperty(name = "app.ca.backend", havingValue = "gcp")
@Slf4j
public class GCPKMSConfig {

    @Value("${app.gcp.kms.key-version-name}")
    private String keyVersionName;

    @Bean(destroyMethod = "close")
    public KeyManagementServiceClient keyManagementServiceClient() {
        log.info("Initializing Google Cloud KMS client");
        try {
            return KeyManagementServiceClient.create();
        } catch (IOException e) {
            throw new BackendUnavailableException("Could not initialize Google Cloud KMS client: " + e.getMessage(), e);
        }
    }

    @Bean
    public SigningBackend signingBackend(KeyManagementServiceClient keyManagementServiceClient) {
        return new GCPKMSSigningBackend(keyManagementServiceClient, keyVersionName);
    }
}
