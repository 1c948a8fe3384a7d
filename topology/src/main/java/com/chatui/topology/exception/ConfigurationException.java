package com.chatui.topology.exception;

/**
 * Raised while assembling a topology, before any resource is declared.
 * {@link #getField()} names the configuration option at fault.
 */
public class ConfigurationException extends Exception {
    private final ConfigurationError error;
    private final String field;

    public ConfigurationException(ConfigurationError error, String field) {
        this(error, field, null);
    }

    public ConfigurationException(ConfigurationError error, String field, String detail) {
        super(field + ": " + error.getMessage() + (detail == null ? "" : " (" + detail + ")"));
        this.error = error;
        this.field = field;
    }

    public ConfigurationError getError() {
        return error;
    }

    public String getField() {
        return field;
    }
}
