package com.chatui.topology.firewall;

// Applied on top of a managed rule group's own verdicts
public enum OverrideAction {
    NONE,
    COUNT
}
