package com.chatui.topology.exception;

import java.util.List;

/**
 * A declaration references something that does not exist outside the stack.
 * Only detectable at apply time.
 */
public class DependencyException extends Exception {
    private final DependencyError error;
    private final String logicalId;
    private final String reference;
    private final List<String> resourcePath;

    public DependencyException(DependencyError error, String logicalId, String reference) {
        this(error, logicalId, reference, List.of(logicalId), null);
    }

    public DependencyException(DependencyError error, String logicalId, String reference, Throwable cause) {
        this(error, logicalId, reference, List.of(logicalId), cause);
    }

    private DependencyException(
            DependencyError error,
            String logicalId,
            String reference,
            List<String> resourcePath,
            Throwable cause) {
        super(String.join(" > ", resourcePath) + ": " + error.getMessage() + " (" + reference + ")", cause);
        this.error = error;
        this.logicalId = logicalId;
        this.reference = reference;
        this.resourcePath = List.copyOf(resourcePath);
    }

    // Same failure, located in the dependency graph
    public DependencyException withPath(List<String> path) {
        return new DependencyException(this.error, this.logicalId, this.reference, path, getCause());
    }

    public DependencyError getError() {
        return error;
    }

    public String getLogicalId() {
        return logicalId;
    }

    public String getReference() {
        return reference;
    }

    public List<String> getResourcePath() {
        return resourcePath;
    }
}
