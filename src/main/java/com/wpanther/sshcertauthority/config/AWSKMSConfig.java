package com.wpanther.sshcertauthority.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.wpanther.sshcertauthority.signer.AWSKMSSigningBackend;
import com.wpanther.sshcertauthority.signer.SigningBackend;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsClient;

/**
 * Configuration for a CA key held in AWS KMS
 */
@Configuration
@ConditionalOnProperty(name = "app.ca.backend", havingValue = "aws")
@Slf4j
public class AWSKMSConfig {

    @Value("${app.aws.kms.region:us-east-1}")
    private String awsRegion;

    @Value("${app.aws.kms.key-id}")
    private String keyId;

    @Value("${app.aws.kms.access-key-id:}")
    private String accessKeyId;

    @Value("${app.aws.kms.secret-access-key:}")
    private String secretAccessKey;

    @Value("${app.aws.kms.use-default-credentials:true}")
    private boolean useDefaultCredentials;

    /**
     * Creates AWS KMS client bean
     *
     * @return KmsClient instance configured with credentials and region
     */
    @Bean(destroyMethod = "close")
    public KmsClient kmsClient() {
        log.info("Initializing AWS KMS client for region: {}", awsRegion);

        AwsCredentialsProvider credentialsProvider;
        if (useDefaultCredentials) {
            // IAM role, environment variables, profile files
            log.info("Using AWS default credentials provider chain");
            credentialsProvider = DefaultCredentialsProvider.create();
        } else {
            if (accessKeyId == null || accessKeyId.isEmpty()
                    || secretAccessKey == null || secretAccessKey.isEmpty()) {
                throw new IllegalStateException(
                    "AWS credentials not configured. Set app.aws.kms.access-key-id and "
                    + "app.aws.kms.secret-access-key or enable use-default-credentials.");
            }
            log.info("Using static AWS credentials");
            credentialsProvider = StaticCredentialsProvider.create(
                AwsBasicCredentials.create(accessKeyId, secretAccessKey)
            );
        }

        return KmsClient.builder()
            .region(Region.of(awsRegion))
            .credentialsProvider(credentialsProvider)
            .build();
    }

    @Bean
    public SigningBackend signingBackend(KmsClient kmsClient) {
        return new AWSKMSSigningBackend(kmsClient, keyId);
    }
}
