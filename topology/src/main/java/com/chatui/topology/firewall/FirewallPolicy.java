package com.chatui.topology.firewall;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;

/**
 * Web ACL bound to the load balancer.
 * <p>
 * Rules are kept in ascending priority, which is also the evaluation order.
 * The first terminating match decides; when nothing matches the default
 * action applies.
 */
public record FirewallPolicy(String name, String scope, RuleAction defaultAction, List<FirewallRule> rules) {

    // of() reports the same clash as a ConfigurationException before getting here
    public FirewallPolicy {
        var priorities = new HashSet<Integer>();
        for (var rule : rules) {
            if (!priorities.add(rule.priority())) {
                throw new IllegalArgumentException(
                    ConfigurationError.DUPLICATE_FIREWALL_PRIORITY.getMessage() + ": " + rule.name() + "@" + rule.priority());
            }
        }
        var sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(FirewallRule::priority));
        rules = List.copyOf(sorted);
    }

    public static FirewallPolicy of(
        String name,
        String scope,
        RuleAction defaultAction,
        List<FirewallRule> rules) throws ConfigurationException {
            if (defaultAction == null || defaultAction == RuleAction.COUNT) {
                throw new ConfigurationException(ConfigurationError.INVALID_FIREWALL_RULE, "firewall.defaultAction");
            }
            var priorities = new HashSet<Integer>();
            for (var rule : rules) {
                rule.validate();
                if (!priorities.add(rule.priority())) {
                    throw new ConfigurationException(
                        ConfigurationError.DUPLICATE_FIREWALL_PRIORITY, "firewall.rules", rule.name() + "@" + rule.priority());
                }
            }
            return new FirewallPolicy(name, scope, defaultAction, rules);
    }

    public FirewallVerdict evaluate(InboundRequest request, ManagedRuleGroups managedRuleGroups) {
        var counted = new ArrayList<String>();
        for (var rule : rules) {
            RuleAction outcome;
            if (rule.isManaged()) {
                outcome = managedRuleGroups.evaluate(rule.managedRuleGroup(), request)
                    .map(verdict -> rule.overrideAction() == OverrideAction.COUNT ? RuleAction.COUNT : verdict)
                    .orElse(null);
            } else {
                outcome = rule.statement().matches(request) ? rule.action() : null;
            }
            if (outcome == null) {
                continue;
            }
            if (outcome.isTerminating()) {
                return new FirewallVerdict(outcome, rule.name(), List.copyOf(counted));
            }
            counted.add(rule.name());
        }
        return new FirewallVerdict(defaultAction, null, List.copyOf(counted));
    }
}
