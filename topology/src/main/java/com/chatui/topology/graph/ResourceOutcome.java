package com.chatui.topology.graph;

public record ResourceOutcome(String logicalId, Status status, String message) {

    public enum Status {
        APPLIED,
        FAILED,
        SKIPPED
    }
}
