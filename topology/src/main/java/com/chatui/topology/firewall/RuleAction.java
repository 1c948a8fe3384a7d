package com.chatui.topology.firewall;

public enum RuleAction {
    ALLOW,
    BLOCK,
    COUNT; // Records the match and keeps evaluating

    public boolean isTerminating() {
        return this != COUNT;
    }
}
