package com.chatui.topology.firewall;

/**
 * A vendor maintained rule group, e.g. {@code AWS/AWSManagedRulesCommonRuleSet}.
 * Its rules are opaque here.
 */
public record ManagedRuleGroupStatement(String vendorName, String name) {
}
