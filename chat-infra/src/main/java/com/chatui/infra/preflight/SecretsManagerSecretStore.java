package com.chatui.infra.preflight;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

// Checks existence only, the secret value is never fetched
public class SecretsManagerSecretStore implements SecretStore {
    private static final Logger LOG = LogManager.getLogger(SecretsManagerSecretStore.class);

    private final SecretsManagerClient secretsManagerClient;

    public SecretsManagerSecretStore(String region) {
        this(SecretsManagerClient.builder()
            .credentialsProvider(DefaultCredentialsProvider.create())
            .region(Region.of(region))
            .build());
    }

    public SecretsManagerSecretStore(SecretsManagerClient secretsManagerClient) {
        this.secretsManagerClient = secretsManagerClient;
    }

    @Override
    public Optional<String> lookupSecret(String secretPath) {
        try {
            var response = secretsManagerClient.describeSecret(DescribeSecretRequest.builder()
                .secretId(secretPath)
                .build());
            if (response.deletedDate() != null) {
                LOG.warn("secrets - {} - scheduled for deletion", secretPath);
                return Optional.empty();
            }
            return Optional.of(response.arn());
        } catch (ResourceNotFoundException e) {
            LOG.debug("secrets - {} - not found", secretPath);
            return Optional.empty();
        }
    }
}
