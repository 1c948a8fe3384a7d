package com.chatui.topology.assembly;

import java.util.List;
import java.util.Optional;

import com.chatui.topology.alarm.AlarmRule;
import com.chatui.topology.config.TopologyConfig;
import com.chatui.topology.firewall.FirewallPolicy;
import com.chatui.topology.graph.ResourceGraph;
import com.chatui.topology.health.HealthCheckPolicy;
import com.chatui.topology.scaling.AutoscalingPolicy;

/**
 * Result of assembly: the declaration graph plus the typed policies its
 * nodes were derived from.
 */
public record DeploymentTopology(
    TopologyConfig config,
    HealthCheckPolicy healthCheck,
    AutoscalingPolicy autoscaling,
    FirewallPolicy firewall,
    List<AlarmRule> alarms,
    List<SecurityRule> securityRules,
    List<DashboardWidget> dashboardWidgets,
    ResourceGraph graph
) {

    public DeploymentTopology {
        alarms = List.copyOf(alarms);
        securityRules = List.copyOf(securityRules);
        dashboardWidgets = List.copyOf(dashboardWidgets);
    }

    public Optional<FirewallPolicy> firewallPolicy() {
        return Optional.ofNullable(firewall);
    }
}
