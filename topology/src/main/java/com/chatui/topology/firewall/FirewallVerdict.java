package com.chatui.topology.firewall;

import java.util.List;

/**
 * @param ruleName      terminating rule, or null when the default action applied
 * @param countedRules  rules that matched with a non-terminating action
 */
public record FirewallVerdict(RuleAction action, String ruleName, List<String> countedRules) {

    public boolean isBlocked() {
        return action == RuleAction.BLOCK;
    }
}
