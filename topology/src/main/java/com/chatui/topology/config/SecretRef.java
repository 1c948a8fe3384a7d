package com.chatui.topology.config;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Reference to one field of a secret that lives in Secrets Manager.
 * Only the reference ever crosses into a declaration, never the value.
 *
 * @param logicalName environment variable the container sees, e.g. {@code OPENAI_API_KEY}
 * @param secretPath  secret name, e.g. {@code multimodalai/openai-api-key}
 * @param field       JSON field selected from the secret
 */
public record SecretRef(String logicalName, String secretPath, String field) {

    @JsonIgnore
    public boolean isComplete() {
        return !isBlank(logicalName) && !isBlank(secretPath) && !isBlank(field);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
