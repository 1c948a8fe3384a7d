package com.chatui.topology.exception;

public enum DependencyError {
    SECRET_NOT_FOUND("Secret does not exist"),
    HOSTED_ZONE_NOT_FOUND("Hosted zone does not exist or is not delegated"),
    LOOKUP_FAILED("Lookup failed");

    private final String message;

    DependencyError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
