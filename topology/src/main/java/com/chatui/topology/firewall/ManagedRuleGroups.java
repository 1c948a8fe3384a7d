package com.chatui.topology.firewall;

import java.util.Optional;

/**
 * Verdict of a managed rule group's internal rules for a request, or empty
 * when none of them matched.
 */
@FunctionalInterface
public interface ManagedRuleGroups {

    ManagedRuleGroups NONE = (group, request) -> Optional.empty();

    Optional<RuleAction> evaluate(ManagedRuleGroupStatement group, InboundRequest request);
}
