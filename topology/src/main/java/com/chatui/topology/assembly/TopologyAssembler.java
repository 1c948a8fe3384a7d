package com.chatui.topology.assembly;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.chatui.topology.alarm.AlarmRule;
import com.chatui.topology.config.TopologyConfig;
import com.chatui.topology.exception.ConfigurationException;
import com.chatui.topology.firewall.FirewallPolicy;
import com.chatui.topology.firewall.FirewallRule;
import com.chatui.topology.firewall.GeoMatchStatement;
import com.chatui.topology.firewall.NotStatement;
import com.chatui.topology.firewall.RuleAction;
import com.chatui.topology.graph.GraphCodec;
import com.chatui.topology.graph.ResourceGraphBuilder;
import com.chatui.topology.graph.ResourceKind;
import com.chatui.topology.health.HealthCheckPolicy;
import com.chatui.topology.scaling.AutoscalingPolicy;
import com.chatui.topology.scaling.StepScalingPolicy;
import com.chatui.topology.scaling.TargetTrackingPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a {@link TopologyConfig} into the chat UI deployment graph:
 * network, EC2 capacity, service behind an ALB, security rules, scaling,
 * WAF, observability, DNS and outputs.
 * <p>
 * Assembly is a pure function of the configuration. It validates first, so an
 * invalid configuration never yields a partial graph.
 */
public class TopologyAssembler {
    private static final Logger LOG = LogManager.getLogger(TopologyAssembler.class);

    // Host ports ECS hands out to bridge-mode containers
    static final int EPHEMERAL_PORT_FROM = 32768;
    static final int EPHEMERAL_PORT_TO = 65535;
    public static final String ACCESS_LOG_PREFIX = "alb-logs";
    public static final String KNOWLEDGE_BUCKET_ENV = "KNOWLEDGE_BUCKET";

    private final ObjectMapper mapper;

    public TopologyAssembler() {
        this(GraphCodec.defaultMapper());
    }

    public TopologyAssembler(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public DeploymentTopology assemble(TopologyConfig config) throws ConfigurationException {
        config.validate();

        var healthCheck = HealthCheckPolicy.defaults();
        var autoscaling = autoscalingPolicy(config);
        var firewall = config.enableWaf() ? firewallPolicy(config) : null;
        var alarms = config.observability() ? AlarmRule.defaults() : List.<AlarmRule>of();
        for (var alarm : alarms) {
            alarm.validate();
        }
        var ingress = new SecurityRule(
            SecurityRule.Direction.INGRESS,
            LogicalIds.AUTO_SCALING_GROUP,
            LogicalIds.LOAD_BALANCER,
            "tcp",
            EPHEMERAL_PORT_FROM,
            EPHEMERAL_PORT_TO,
            "Allow ALB to reach ECS tasks on dynamic host ports (bridge mode)");
        var securityRules = List.of(
            ingress,
            ingress.mirror("Allow ALB egress to ECS instances on dynamic host ports"));
        var widgets = dashboardWidgets(config);

        var graph = new ResourceGraphBuilder(mapper);
        declareNetwork(graph);
        declareCompute(config, graph);
        declareStorage(config, graph);
        declareSecrets(config, graph);
        declareImage(config, graph);
        declareDomain(config, graph);
        declareService(config, healthCheck, graph);
        securityRules.forEach(rule -> graph.add(
            rule.direction() == SecurityRule.Direction.INGRESS ? LogicalIds.INGRESS_RULE : LogicalIds.EGRESS_RULE,
            ResourceKind.SECURITY_RULE,
            rule,
            rule.securityGroupOf(),
            rule.peer()));
        declareScaling(autoscaling, graph);
        if (firewall != null) {
            declareFirewall(firewall, graph);
        }
        declareObservability(config, alarms, widgets, graph);
        declareDnsRecord(config, graph);
        declareOutputs(config, graph);

        var built = graph.build();
        LOG.info("topology - {} - {} declarations, outputs {}",
            config.stackName(), built.size(), built.getOutputs().keySet());
        return new DeploymentTopology(
            config, healthCheck, autoscaling, firewall, alarms, securityRules, widgets, built);
    }

    AutoscalingPolicy autoscalingPolicy(TopologyConfig config) throws ConfigurationException {
        var cpu = new TargetTrackingPolicy(
            LogicalIds.CPU_SCALING,
            "CPUUtilization",
            config.cpuTargetPercent(),
            config.scalingCooldownSeconds(),
            config.scalingCooldownSeconds());
        var requestRate = config.requestScalingSteps().isEmpty()
            ? null
            : StepScalingPolicy.of(
                LogicalIds.REQUEST_SCALING,
                "RequestCountPerTarget",
                config.requestScalingSteps(),
                config.scalingCooldownSeconds());
        return new AutoscalingPolicy(config.minReplicas(), config.maxReplicas(), cpu, requestRate);
    }

    FirewallPolicy firewallPolicy(TopologyConfig config) throws ConfigurationException {
        var rules = new ArrayList<FirewallRule>();
        if (!config.allowedCountries().isEmpty()) {
            var name = config.allowedCountries().size() == 1
                ? "BlockNon" + config.allowedCountries().get(0)
                : "BlockOutsideAllowedCountries";
            rules.add(FirewallRule.custom(
                name,
                rules.size(),
                RuleAction.BLOCK,
                new NotStatement(new GeoMatchStatement(config.allowedCountries()))));
            LOG.warn("waf - requests from outside {} are blocked, monitoring clients included",
                config.allowedCountries());
        }
        rules.add(FirewallRule.managed("CommonRuleSet", rules.size(), "AWS", "AWSManagedRulesCommonRuleSet", "CommonRules"));
        rules.add(FirewallRule.managed("SQLiRuleSet", rules.size(), "AWS", "AWSManagedRulesSQLiRuleSet", "SQLiRules"));
        rules.add(FirewallRule.managed(
            "BadInputsRuleSet", rules.size(), "AWS", "AWSManagedRulesKnownBadInputsRuleSet", "BadInputs"));
        return FirewallPolicy.of(LogicalIds.WEB_ACL, "REGIONAL", RuleAction.ALLOW, rules);
    }

    private List<DashboardWidget> dashboardWidgets(TopologyConfig config) {
        var widgets = new ArrayList<DashboardWidget>();
        widgets.add(DashboardWidget.of("ECS CPU Utilization (%)", DashboardMetric.SERVICE_CPU));
        widgets.add(DashboardWidget.of("ALB Request Count (Sum/min)", DashboardMetric.REQUEST_COUNT));
        widgets.add(new DashboardWidget(
            "ALB Healthy (L) vs Unhealthy (R)",
            List.of(DashboardMetric.HEALTHY_HOSTS),
            List.of(DashboardMetric.UNHEALTHY_HOSTS)));
        widgets.add(DashboardWidget.of(
            "Target Response Time (p50 & p95)", DashboardMetric.RESPONSE_TIME_P50, DashboardMetric.RESPONSE_TIME_P95));
        widgets.add(new DashboardWidget(
            "HTTP 5xx (Target vs ELB)",
            List.of(DashboardMetric.TARGET_5XX),
            List.of(DashboardMetric.ELB_5XX)));
        if (config.enableWaf()) {
            widgets.add(DashboardWidget.of("WAF Blocked Requests", DashboardMetric.WAF_BLOCKED));
        }
        return widgets;
    }

    private void declareNetwork(ResourceGraphBuilder graph) {
        graph.add(LogicalIds.VPC, ResourceKind.NETWORK, props(
            "maxAzs", 2,
            "natGateways", 1,
            "subnets", List.of("PUBLIC", "PRIVATE_WITH_EGRESS"),
            "restrictDefaultSecurityGroup", false));
    }

    private void declareCompute(TopologyConfig config, ResourceGraphBuilder graph) {
        graph.add(LogicalIds.CLUSTER, ResourceKind.CLUSTER, props(), LogicalIds.VPC);
        graph.add(LogicalIds.AUTO_SCALING_GROUP, ResourceKind.COMPUTE_POOL, props(
            "instanceType", config.instanceType(),
            "machineImage", "ECS_OPTIMIZED_AMAZON_LINUX_2",
            "minCapacity", config.capacityMin(),
            "maxCapacity", config.capacityMax(),
            "desiredCapacity", config.capacityDesired()), LogicalIds.VPC);
        graph.add(LogicalIds.CAPACITY_PROVIDER, ResourceKind.CAPACITY_BINDING, props(
            "enableManagedScaling", true,
            "targetCapacityPercent", config.targetCapacityPercent(),
            "enableManagedTerminationProtection", false,
            "defaultStrategyWeight", 1), LogicalIds.CLUSTER, LogicalIds.AUTO_SCALING_GROUP);
    }

    private void declareStorage(TopologyConfig config, ResourceGraphBuilder graph) {
        if (config.knowledgeBucket()) {
            graph.add(LogicalIds.KNOWLEDGE_BUCKET, ResourceKind.STORAGE_BUCKET, props(
                "removalPolicy", "DESTROY",
                "autoDeleteObjects", true));
        }
    }

    private void declareSecrets(TopologyConfig config, ResourceGraphBuilder graph) {
        for (var secret : config.secretRefs()) {
            graph.add(LogicalIds.secret(secret.logicalName()), ResourceKind.SECRET_REF, props(
                "logicalName", secret.logicalName(),
                "secretName", secret.secretPath(),
                "field", secret.field()));
        }
    }

    private void declareImage(TopologyConfig config, ResourceGraphBuilder graph) {
        var pinned = config.containerImage().contains("@sha256:");
        if (!pinned) {
            LOG.warn("image - {} is referenced by a mutable tag", config.containerImage());
        }
        graph.add(LogicalIds.CONTAINER_IMAGE, ResourceKind.CONTAINER_IMAGE, props(
            "image", config.containerImage(),
            "digestPinned", pinned));
    }

    private void declareDomain(TopologyConfig config, ResourceGraphBuilder graph) {
        if (config.domainName() == null || !(config.enableHttps() || config.hasDnsRecord())) {
            return;
        }
        graph.add(LogicalIds.HOSTED_ZONE, ResourceKind.DNS_ZONE, props("domainName", config.domainName()));
        if (config.enableHttps()) {
            graph.add(LogicalIds.CERTIFICATE, ResourceKind.CERTIFICATE, props(
                "domainName", config.fqdn().orElseThrow(),
                "validation", "DNS"), LogicalIds.HOSTED_ZONE);
        }
    }

    private void declareService(TopologyConfig config, HealthCheckPolicy healthCheck, ResourceGraphBuilder graph) {
        var loadBalancerDeps = new ArrayList<String>(List.of(LogicalIds.VPC));
        if (config.enableHttps()) {
            loadBalancerDeps.add(LogicalIds.CERTIFICATE);
        }
        if (config.observability()) {
            // Access logging is switched on only once the bucket policy admits the ELB account
            loadBalancerDeps.add(LogicalIds.ACCESS_LOGS_BUCKET);
        }
        graph.add(LogicalIds.LOAD_BALANCER, ResourceKind.LOAD_BALANCER, props(
            "internetFacing", true,
            "protocol", config.enableHttps() ? "HTTPS" : "HTTP",
            "listenerPort", config.enableHttps() ? 443 : 80,
            "redirectHttp", config.enableHttps(),
            "certificate", config.enableHttps() ? LogicalIds.CERTIFICATE : null,
            "idleTimeoutSeconds", healthCheck.idleTimeoutSeconds(),
            "accessLogs", config.observability()
                ? props("bucket", LogicalIds.ACCESS_LOGS_BUCKET, "prefix", ACCESS_LOG_PREFIX)
                : null), loadBalancerDeps);

        graph.add(LogicalIds.TARGET_GROUP, ResourceKind.TARGET_GROUP, props(
            "protocol", "HTTP",
            "healthCheck", healthCheck,
            "deregistrationDelaySeconds", healthCheck.deregistrationDelaySeconds()), LogicalIds.VPC);

        var serviceDeps = new ArrayList<String>(List.of(
            LogicalIds.CLUSTER,
            LogicalIds.CAPACITY_PROVIDER,
            LogicalIds.CONTAINER_IMAGE,
            LogicalIds.LOAD_BALANCER,
            LogicalIds.TARGET_GROUP));
        var secrets = new ArrayList<Map<String, Object>>();
        for (var secret : config.secretRefs()) {
            var id = LogicalIds.secret(secret.logicalName());
            serviceDeps.add(id);
            secrets.add(props("name", secret.logicalName(), "secret", id, "field", secret.field()));
        }
        var environment = new LinkedHashMap<String, Object>(config.envVars());
        List<String> readGrants = List.of();
        if (config.knowledgeBucket()) {
            serviceDeps.add(LogicalIds.KNOWLEDGE_BUCKET);
            readGrants = List.of(LogicalIds.KNOWLEDGE_BUCKET);
            environment.putIfAbsent(KNOWLEDGE_BUCKET_ENV, "${" + LogicalIds.KNOWLEDGE_BUCKET + ".BucketName}");
        }
        graph.add(LogicalIds.SERVICE, ResourceKind.SERVICE_DEPLOYMENT, props(
            "networkMode", "BRIDGE",
            "desiredCount", config.desiredReplicas(),
            "memoryLimitMiB", config.memoryLimitMiB(),
            "containerPort", config.containerPort(),
            "image", LogicalIds.CONTAINER_IMAGE,
            "environment", environment,
            "secrets", secrets,
            "readGrants", readGrants,
            "enableExecuteCommand", true,
            "healthCheckGracePeriodSeconds", healthCheck.gracePeriodSeconds()), serviceDeps);
    }

    private void declareScaling(AutoscalingPolicy autoscaling, ResourceGraphBuilder graph) {
        graph.add(LogicalIds.TASK_SCALING, ResourceKind.AUTOSCALING_TARGET, props(
            "minCapacity", autoscaling.minReplicas(),
            "maxCapacity", autoscaling.maxReplicas()), LogicalIds.SERVICE);
        graph.add(LogicalIds.CPU_SCALING, ResourceKind.AUTOSCALING_POLICY, props(
            "type", "TARGET_TRACKING",
            "policy", autoscaling.cpu()), LogicalIds.TASK_SCALING);
        if (autoscaling.requestRate() != null) {
            graph.add(LogicalIds.REQUEST_SCALING, ResourceKind.AUTOSCALING_POLICY, props(
                "type", "STEP",
                "adjustmentType", "CHANGE_IN_CAPACITY",
                "policy", autoscaling.requestRate()), LogicalIds.TASK_SCALING, LogicalIds.TARGET_GROUP);
        }
    }

    private void declareFirewall(FirewallPolicy firewall, ResourceGraphBuilder graph) {
        graph.add(LogicalIds.WEB_ACL, ResourceKind.FIREWALL_POLICY, firewall);
        graph.add(LogicalIds.WEB_ACL_ASSOCIATION, ResourceKind.FIREWALL_ASSOCIATION, props(
            "webAcl", LogicalIds.WEB_ACL,
            "resource", LogicalIds.LOAD_BALANCER), LogicalIds.WEB_ACL, LogicalIds.LOAD_BALANCER);
    }

    private void declareObservability(
        TopologyConfig config,
        List<AlarmRule> alarms,
        List<DashboardWidget> widgets,
        ResourceGraphBuilder graph) {
            if (config.observability()) {
                graph.add(LogicalIds.ACCESS_LOGS_BUCKET, ResourceKind.LOG_BUCKET, props(
                    "objectOwnership", "OBJECT_WRITER",
                    "blockPublicAccess", true,
                    "enforceSsl", true,
                    "expirationDays", config.accessLogRetentionDays(),
                    "prefix", ACCESS_LOG_PREFIX,
                    "logDeliveryAccount", config.logDeliveryAccount().orElseThrow()));

                graph.add(LogicalIds.ALERTS_TOPIC, ResourceKind.NOTIFICATION_CHANNEL, props());
                if (config.notifyEmail() != null) {
                    graph.add(LogicalIds.ALERTS_SUBSCRIPTION, ResourceKind.NOTIFICATION_SUBSCRIPTION, props(
                        "protocol", "email",
                        "endpoint", config.notifyEmail()), LogicalIds.ALERTS_TOPIC);
                }
                for (var alarm : alarms) {
                    graph.add(alarm.name(), ResourceKind.ALARM, props(
                        "rule", alarm,
                        "actions", List.of(LogicalIds.ALERTS_TOPIC)),
                        LogicalIds.ALERTS_TOPIC, LogicalIds.LOAD_BALANCER, LogicalIds.TARGET_GROUP);
                }
            }

            var dashboardDeps = new ArrayList<String>(List.of(
                LogicalIds.SERVICE, LogicalIds.LOAD_BALANCER, LogicalIds.TARGET_GROUP));
            if (config.enableWaf()) {
                dashboardDeps.add(LogicalIds.WEB_ACL);
            }
            graph.add(LogicalIds.DASHBOARD, ResourceKind.DASHBOARD, props(
                "dashboardName", config.dashboardName(),
                "widgets", widgets), dashboardDeps);
    }

    private void declareDnsRecord(TopologyConfig config, ResourceGraphBuilder graph) {
        if (!config.hasDnsRecord()) {
            return;
        }
        // The alias resolves the load balancer's address, so it always waits for it
        graph.add(LogicalIds.ALIAS_RECORD, ResourceKind.DNS_RECORD, props(
            "recordName", config.subdomain(),
            "recordType", "A",
            "zone", LogicalIds.HOSTED_ZONE,
            "aliasTarget", LogicalIds.LOAD_BALANCER), LogicalIds.HOSTED_ZONE, LogicalIds.LOAD_BALANCER);
    }

    private void declareOutputs(TopologyConfig config, ResourceGraphBuilder graph) {
        graph.output(LogicalIds.OUTPUT_LOAD_BALANCER_DNS, LogicalIds.LOAD_BALANCER, "DnsName", "ALB DNS");
        graph.output(LogicalIds.OUTPUT_CLUSTER_NAME, LogicalIds.CLUSTER, "ClusterName", "ECS Cluster Name");
        if (config.knowledgeBucket()) {
            graph.output(LogicalIds.OUTPUT_BUCKET_NAME, LogicalIds.KNOWLEDGE_BUCKET, "BucketName",
                "S3 bucket name for knowledge base files");
        }
        if (config.observability()) {
            graph.output(LogicalIds.OUTPUT_ALERTS_TOPIC, LogicalIds.ALERTS_TOPIC, "TopicArn", "Alerts SNS Topic");
        }
        if (config.hasDnsRecord()) {
            graph.output(LogicalIds.OUTPUT_SERVICE_URL, LogicalIds.ALIAS_RECORD, "Url", "Public URL for the chat UI");
        }
    }

    // Ordered key/value pairs; null values are left out
    private static Map<String, Object> props(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }
}
