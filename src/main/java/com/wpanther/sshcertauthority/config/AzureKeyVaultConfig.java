package com.wpanther.sshcertauthority.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.security.keyvault.keys.KeyClient;
import com.azure.security.keyvault.keys.KeyClientBuilder;
import com.azure.security.keyvault.keys.cryptography.CryptographyClient;
import com.azure.security.keyvault.keys.cryptography.CryptographyClientBuilder;
import com.azure.security.keyvault.keys.models.KeyVaultKey;
import com.wpanther.sshcertauthority.signer.AzureKeyVaultSigningBackend;
import com.wpanther.sshcertauthority.signer.SigningBackend;

import lombok.extern.slf4j.Slf4j;

/**
 * Configuration for a CA key held in Azure Key Vault
 */
@Configuration
@ConditionalOnProperty(name = "app.ca.backend", havingValue = "azure")
@Slf4j
public class AzureKeyVaultConfig {

    @Value("${app.azure.keyvault.vault-url}")
    private String vaultUrl;

    @Value("${app.azure.keyvault.key-name}")
    private String keyName;

    @Value("${app.azure.keyvault.tenant-id:}")
    private String tenantId;

    @Value("${app.azure.keyvault.client-id:}")
    private String clientId;

    @Value("${app.azure.keyvault.client-secret:}")
    private String clientSecret;

    @Bean
    public TokenCredential azureCredential() {
        if (!clientSecret.isEmpty()) {
            if (tenantId.isEmpty() || clientId.isEmpty()) {
                throw new IllegalStateException(
                    "Azure client secret set without app.azure.keyvault.tenant-id and app.azure.keyvault.client-id");
            }
            log.info("Using Azure client secret credential for client {}", clientId);
            return new ClientSecretCredentialBuilder()
                .tenantId(tenantId)
                .clientId(clientId)
                .clientSecret(clientSecret)
                .build();
        }
        // managed identity, environment, Azure CLI
        log.info("Using Azure default credential chain");
        return new DefaultAzureCredentialBuilder().build();
    }

    @Bean
    public KeyClient keyClient(TokenCredential azureCredential) {
        log.info("Initializing Azure Key Vault client for {}", vaultUrl);
        return new KeyClientBuilder()
            .vaultUrl(vaultUrl)
            .credential(azureCredential)
            .buildClient();
    }

    @Bean
    public SigningBackend signingBackend(KeyClient keyClient, TokenCredential azureCredential) {
        KeyVaultKey key = AzureKeyVaultSigningBackend.fetchKey(keyClient, keyName);
        CryptographyClient cryptographyClient = new CryptographyClientBuilder()
            .keyIdentifier(key.getId())
            .credential(azureCredential)
            .buildClient();
        return new AzureKeyVaultSigningBackend(key, cryptographyClient);
    }
}
