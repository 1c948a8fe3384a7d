package com.chatui.topology.firewall;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A web ACL rule. Custom rules carry an {@code action} and a
 * {@code statement}; managed rules carry an {@code overrideAction} and a
 * {@code managedRuleGroup}. Never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FirewallRule(
    String name,
    int priority,
    RuleAction action,
    MatchStatement statement,
    OverrideAction overrideAction,
    ManagedRuleGroupStatement managedRuleGroup,
    String metricName
) {

    public static FirewallRule custom(String name, int priority, RuleAction action, MatchStatement statement) {
        return new FirewallRule(name, priority, action, statement, null, null, name);
    }

    public static FirewallRule managed(String name, int priority, String vendorName, String groupName, String metricName) {
        return new FirewallRule(
            name,
            priority,
            null,
            null,
            OverrideAction.NONE,
            new ManagedRuleGroupStatement(vendorName, groupName),
            metricName);
    }

    @JsonIgnore
    public boolean isManaged() {
        return managedRuleGroup != null;
    }

    public void validate() throws ConfigurationException {
        var custom = action != null && statement != null && overrideAction == null && managedRuleGroup == null;
        var managed = action == null && statement == null && overrideAction != null && managedRuleGroup != null;
        if (name == null || name.isBlank() || priority < 0 || !(custom || managed)) {
            throw new ConfigurationException(ConfigurationError.INVALID_FIREWALL_RULE, "firewall.rules", name);
        }
    }
}
