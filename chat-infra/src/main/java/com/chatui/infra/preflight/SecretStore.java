package com.chatui.infra.preflight;

import java.util.Optional;

// Read-only view of the secrets a deployment references
public interface SecretStore {

    /**
     * @return the secret's ARN, empty when no secret has that name
     */
    Optional<String> lookupSecret(String secretPath);
}
