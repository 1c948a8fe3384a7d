package com.chatui.infra;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.chatui.topology.alarm.AlarmRule;
import com.chatui.topology.alarm.LoadBalancerMetric;
import com.chatui.topology.assembly.DashboardMetric;
import com.chatui.topology.assembly.DeploymentTopology;
import com.chatui.topology.assembly.LogicalIds;
import com.chatui.topology.assembly.TopologyAssembler;
import com.chatui.topology.config.TopologyConfig;
import com.chatui.topology.firewall.FirewallPolicy;
import com.chatui.topology.firewall.FirewallRule;
import com.chatui.topology.firewall.GeoMatchStatement;
import com.chatui.topology.firewall.MatchStatement;
import com.chatui.topology.firewall.NotStatement;
import com.chatui.topology.firewall.OverrideAction;
import com.chatui.topology.firewall.RuleAction;
import com.chatui.topology.graph.ResourceKind;
import com.chatui.topology.health.HealthCheckPolicy;
import com.chatui.topology.scaling.AutoscalingPolicy;
import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.CfnOutputProps;
import software.amazon.awscdk.Duration;
import software.amazon.awscdk.RemovalPolicy;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.services.applicationautoscaling.AdjustmentType;
import software.amazon.awscdk.services.applicationautoscaling.BasicStepScalingPolicyProps;
import software.amazon.awscdk.services.applicationautoscaling.EnableScalingProps;
import software.amazon.awscdk.services.applicationautoscaling.ScalingInterval;
import software.amazon.awscdk.services.autoscaling.AutoScalingGroup;
import software.amazon.awscdk.services.autoscaling.AutoScalingGroupProps;
import software.amazon.awscdk.services.certificatemanager.Certificate;
import software.amazon.awscdk.services.certificatemanager.CertificateProps;
import software.amazon.awscdk.services.certificatemanager.CertificateValidation;
import software.amazon.awscdk.services.cloudwatch.Alarm;
import software.amazon.awscdk.services.cloudwatch.AlarmProps;
import software.amazon.awscdk.services.cloudwatch.ComparisonOperator;
import software.amazon.awscdk.services.cloudwatch.Dashboard;
import software.amazon.awscdk.services.cloudwatch.DashboardProps;
import software.amazon.awscdk.services.cloudwatch.GraphWidget;
import software.amazon.awscdk.services.cloudwatch.GraphWidgetProps;
import software.amazon.awscdk.services.cloudwatch.IMetric;
import software.amazon.awscdk.services.cloudwatch.IWidget;
import software.amazon.awscdk.services.cloudwatch.Metric;
import software.amazon.awscdk.services.cloudwatch.MetricOptions;
import software.amazon.awscdk.services.cloudwatch.MetricProps;
import software.amazon.awscdk.services.cloudwatch.actions.SnsAction;
import software.amazon.awscdk.services.ec2.InstanceType;
import software.amazon.awscdk.services.ec2.Port;
import software.amazon.awscdk.services.ec2.Vpc;
import software.amazon.awscdk.services.ec2.VpcProps;
import software.amazon.awscdk.services.ecs.AsgCapacityProvider;
import software.amazon.awscdk.services.ecs.AsgCapacityProviderProps;
import software.amazon.awscdk.services.ecs.AwsLogDriverProps;
import software.amazon.awscdk.services.ecs.CapacityProviderStrategy;
import software.amazon.awscdk.services.ecs.Cluster;
import software.amazon.awscdk.services.ecs.ClusterProps;
import software.amazon.awscdk.services.ecs.ContainerImage;
import software.amazon.awscdk.services.ecs.CpuUtilizationScalingProps;
import software.amazon.awscdk.services.ecs.EcsOptimizedImage;
import software.amazon.awscdk.services.ecs.LogDrivers;
import software.amazon.awscdk.services.ecs.Secret;
import software.amazon.awscdk.services.ecs.patterns.ApplicationLoadBalancedEc2Service;
import software.amazon.awscdk.services.ecs.patterns.ApplicationLoadBalancedEc2ServiceProps;
import software.amazon.awscdk.services.ecs.patterns.ApplicationLoadBalancedTaskImageOptions;
import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationProtocol;
import software.amazon.awscdk.services.elasticloadbalancingv2.HealthCheck;
import software.amazon.awscdk.services.iam.ArnPrincipal;
import software.amazon.awscdk.services.iam.Effect;
import software.amazon.awscdk.services.iam.PolicyStatement;
import software.amazon.awscdk.services.iam.PolicyStatementProps;
import software.amazon.awscdk.services.route53.ARecord;
import software.amazon.awscdk.services.route53.ARecordProps;
import software.amazon.awscdk.services.route53.HostedZone;
import software.amazon.awscdk.services.route53.HostedZoneProviderProps;
import software.amazon.awscdk.services.route53.IHostedZone;
import software.amazon.awscdk.services.route53.RecordTarget;
import software.amazon.awscdk.services.route53.targets.LoadBalancerTarget;
import software.amazon.awscdk.services.s3.BlockPublicAccess;
import software.amazon.awscdk.services.s3.Bucket;
import software.amazon.awscdk.services.s3.BucketProps;
import software.amazon.awscdk.services.s3.LifecycleRule;
import software.amazon.awscdk.services.s3.ObjectOwnership;
import software.amazon.awscdk.services.sns.Topic;
import software.amazon.awscdk.services.sns.TopicProps;
import software.amazon.awscdk.services.sns.subscriptions.EmailSubscription;
import software.amazon.awscdk.services.wafv2.CfnWebACL;
import software.amazon.awscdk.services.wafv2.CfnWebACLAssociation;
import software.amazon.awscdk.services.wafv2.CfnWebACLAssociationProps;
import software.amazon.awscdk.services.wafv2.CfnWebACLProps;
import software.constructs.Construct;

record ChatUiStackProps(DeploymentTopology topology) {}

/**
 * Chat UI on ECS/EC2 behind an HTTPS load balancer, built from an assembled
 * {@link DeploymentTopology}. Which optional parts exist is decided by the
 * topology's graph; this class only maps declarations onto CDK constructs.
 */
public class ChatUiStack extends Stack {
    private final Map<String, String> attributes = new HashMap<>();

    public ChatUiStack(
        final Construct scope,
        final String id,
        final StackProps props,
        final ChatUiStackProps chatUiStackProps) {
            super(scope, id, props);
            var topology = chatUiStackProps.topology();
            var config = topology.config();
            var graph = topology.graph();

            var vpc = this.createVpc();
            var cluster = this.createCluster(vpc);
            var asg = this.createCapacity(config, vpc, cluster);

            Bucket bucket = null;
            if (graph.contains(LogicalIds.KNOWLEDGE_BUCKET)) {
                bucket = this.createKnowledgeBucket();
            }
            var secrets = this.lookupSecrets(topology);
            var zone = graph.contains(LogicalIds.HOSTED_ZONE) ? this.lookupHostedZone(config) : null;
            var certificate = graph.contains(LogicalIds.CERTIFICATE) ? this.createCertificate(config, zone) : null;

            var service = this.createService(config, topology.healthCheck(), cluster, bucket, secrets, certificate);
            this.openDynamicPorts(service, asg);
            this.configureHealthCheck(service, topology.healthCheck());
            if (bucket != null) {
                bucket.grantRead(service.getTaskDefinition().getTaskRole());
            }

            this.autoScale(service, topology.autoscaling());

            CfnWebACL webAcl = null;
            if (topology.firewallPolicy().isPresent()) {
                webAcl = this.createWebAcl(topology.firewall());
                new CfnWebACLAssociation(this, LogicalIds.WEB_ACL_ASSOCIATION, CfnWebACLAssociationProps.builder()
                    .resourceArn(service.getLoadBalancer().getLoadBalancerArn())
                    .webAclArn(webAcl.getAttrArn())
                    .build());
            }

            if (graph.contains(LogicalIds.ACCESS_LOGS_BUCKET)) {
                this.enableAccessLogs(config, service);
            }
            if (graph.contains(LogicalIds.ALERTS_TOPIC)) {
                this.createAlarms(config, topology.alarms(), service);
            }
            this.createDashboard(topology, service);

            if (graph.contains(LogicalIds.ALIAS_RECORD)) {
                this.createAliasRecord(config, zone, service);
            }

            attributes.put(LogicalIds.LOAD_BALANCER + ".DnsName", service.getLoadBalancer().getLoadBalancerDnsName());
            attributes.put(LogicalIds.CLUSTER + ".ClusterName", cluster.getClusterName());
            if (bucket != null) {
                attributes.put(LogicalIds.KNOWLEDGE_BUCKET + ".BucketName", bucket.getBucketName());
            }
            this.createOutputs(topology);
    }

    private Vpc createVpc() {
        // Public subnets for the ALB, private ones with a single NAT for the instances
        return new Vpc(this, LogicalIds.VPC, VpcProps.builder()
            .maxAzs(2)
            .natGateways(1)
            .restrictDefaultSecurityGroup(false)
            .build());
    }

    private Cluster createCluster(Vpc vpc) {
        return new Cluster(this, LogicalIds.CLUSTER, ClusterProps.builder()
            .vpc(vpc)
            .build());
    }

    private AutoScalingGroup createCapacity(TopologyConfig config, Vpc vpc, Cluster cluster) {
        var asg = new AutoScalingGroup(this, LogicalIds.AUTO_SCALING_GROUP, AutoScalingGroupProps.builder()
            .vpc(vpc)
            .instanceType(new InstanceType(config.instanceType()))
            .machineImage(EcsOptimizedImage.amazonLinux2())
            .minCapacity(config.capacityMin())
            .maxCapacity(config.capacityMax())
            .desiredCapacity(config.capacityDesired())
            .build());

        var capacityProvider = new AsgCapacityProvider(this, LogicalIds.CAPACITY_PROVIDER, AsgCapacityProviderProps.builder()
            .autoScalingGroup(asg)
            .enableManagedScaling(true)
            .targetCapacityPercent(config.targetCapacityPercent())
            .enableManagedTerminationProtection(false)
            .build());
        cluster.addAsgCapacityProvider(capacityProvider);
        cluster.addDefaultCapacityProviderStrategy(List.of(CapacityProviderStrategy.builder()
            .capacityProvider(capacityProvider.getCapacityProviderName())
            .weight(1)
            .build()));
        return asg;
    }

    private Bucket createKnowledgeBucket() {
        return new Bucket(this, LogicalIds.KNOWLEDGE_BUCKET, BucketProps.builder()
            .removalPolicy(RemovalPolicy.DESTROY)
            .autoDeleteObjects(true)
            .build());
    }

    // Imported by name, the stack never owns them
    private Map<String, Secret> lookupSecrets(DeploymentTopology topology) {
        var secrets = new LinkedHashMap<String, Secret>();
        for (var node : topology.graph().nodesOfKind(ResourceKind.SECRET_REF)) {
            var imported = software.amazon.awscdk.services.secretsmanager.Secret.fromSecretNameV2(
                this, node.logicalId(), node.stringProperty("secretName"));
            secrets.put(node.stringProperty("logicalName"), Secret.fromSecretsManager(imported, node.stringProperty("field")));
        }
        return secrets;
    }

    private IHostedZone lookupHostedZone(TopologyConfig config) {
        return HostedZone.fromLookup(this, LogicalIds.HOSTED_ZONE, HostedZoneProviderProps.builder()
            .domainName(config.domainName())
            .build());
    }

    private Certificate createCertificate(TopologyConfig config, IHostedZone zone) {
        return new Certificate(this, LogicalIds.CERTIFICATE, CertificateProps.builder()
            .domainName(config.fqdn().orElseThrow())
            .validation(CertificateValidation.fromDns(zone))
            .build());
    }

    private ApplicationLoadBalancedEc2Service createService(
        TopologyConfig config,
        HealthCheckPolicy healthCheck,
        Cluster cluster,
        Bucket bucket,
        Map<String, Secret> secrets,
        Certificate certificate) {
            var environment = new LinkedHashMap<>(config.envVars());
            if (bucket != null) {
                environment.putIfAbsent(TopologyAssembler.KNOWLEDGE_BUCKET_ENV, bucket.getBucketName());
            }

            var taskImage = ApplicationLoadBalancedTaskImageOptions.builder()
                .image(ContainerImage.fromRegistry(config.containerImage()))
                .containerPort(config.containerPort())
                .environment(environment)
                .secrets(secrets)
                .logDriver(LogDrivers.awsLogs(AwsLogDriverProps.builder()
                    .streamPrefix("lobe-chat")
                    .build()))
                .build();

            var props = ApplicationLoadBalancedEc2ServiceProps.builder()
                .cluster(cluster)
                .desiredCount(config.desiredReplicas())
                .memoryLimitMiB(config.memoryLimitMiB())
                .publicLoadBalancer(true)
                .enableExecuteCommand(true)
                .taskImageOptions(taskImage)
                .healthCheckGracePeriod(Duration.seconds(healthCheck.gracePeriodSeconds()));
            if (certificate != null) {
                props.protocol(ApplicationProtocol.HTTPS)
                    .certificate(certificate)
                    .redirectHttp(true);
            } else {
                props.listenerPort(80);
            }
            return new ApplicationLoadBalancedEc2Service(this, LogicalIds.SERVICE, props.build());
    }

    // Bridge mode maps container ports onto ephemeral host ports
    private void openDynamicPorts(ApplicationLoadBalancedEc2Service service, AutoScalingGroup asg) {
        var albSecurityGroup = service.getLoadBalancer().getConnections().getSecurityGroups().get(0);
        var asgSecurityGroup = asg.getConnections().getSecurityGroups().get(0);
        var ports = Port.tcpRange(32768, 65535);
        asgSecurityGroup.addIngressRule(albSecurityGroup, ports,
            "Allow ALB to reach ECS tasks on dynamic host ports (bridge mode)");
        albSecurityGroup.addEgressRule(asgSecurityGroup, ports,
            "Allow ALB egress to ECS instances on dynamic host ports");
    }

    private void configureHealthCheck(ApplicationLoadBalancedEc2Service service, HealthCheckPolicy policy) {
        service.getTargetGroup().configureHealthCheck(HealthCheck.builder()
            .path(policy.path())
            .port(policy.port())
            .healthyHttpCodes(policy.healthyHttpCodes().expression())
            .interval(Duration.seconds(policy.intervalSeconds()))
            .timeout(Duration.seconds(policy.timeoutSeconds())) // Must stay below the interval
            .healthyThresholdCount(policy.healthyThresholdCount())
            .unhealthyThresholdCount(policy.unhealthyThresholdCount())
            .build());
        service.getTargetGroup().setAttribute(
            "deregistration_delay.timeout_seconds", String.valueOf(policy.deregistrationDelaySeconds()));
        service.getLoadBalancer().setAttribute("idle_timeout.timeout_seconds", String.valueOf(policy.idleTimeoutSeconds()));
    }

    private void autoScale(ApplicationLoadBalancedEc2Service service, AutoscalingPolicy policy) {
        var count = service.getService().autoScaleTaskCount(EnableScalingProps.builder()
            .minCapacity(policy.minReplicas())
            .maxCapacity(policy.maxReplicas())
            .build());

        var cpu = policy.cpu();
        count.scaleOnCpuUtilization(cpu.name(), CpuUtilizationScalingProps.builder()
            .targetUtilizationPercent(cpu.targetValue())
            .scaleInCooldown(Duration.seconds(cpu.scaleInCooldownSeconds()))
            .scaleOutCooldown(Duration.seconds(cpu.scaleOutCooldownSeconds()))
            .build());

        var requestRate = policy.requestRate();
        if (requestRate == null) {
            return;
        }
        var steps = new ArrayList<ScalingInterval>();
        for (var step : requestRate.getSteps()) {
            steps.add(ScalingInterval.builder()
                .lower(step.lower())
                .upper(step.upper())
                .change(step.change())
                .build());
        }
        var requests = service.getTargetGroup().metricRequestCountPerTarget(MetricOptions.builder()
            .period(Duration.minutes(1))
            .build());
        count.scaleOnMetric(requestRate.getName(), BasicStepScalingPolicyProps.builder()
            .metric(requests)
            .scalingSteps(steps)
            .adjustmentType(AdjustmentType.CHANGE_IN_CAPACITY)
            .cooldown(Duration.seconds(requestRate.getCooldownSeconds()))
            .build());
    }

    private CfnWebACL createWebAcl(FirewallPolicy policy) {
        var rules = new ArrayList<CfnWebACL.RuleProperty>();
        for (var rule : policy.rules()) {
            rules.add(this.toRuleProperty(rule));
        }
        return new CfnWebACL(this, LogicalIds.WEB_ACL, CfnWebACLProps.builder()
            .scope(policy.scope())
            .defaultAction(policy.defaultAction() == RuleAction.BLOCK
                ? CfnWebACL.DefaultActionProperty.builder().block(CfnWebACL.BlockActionProperty.builder().build()).build()
                : CfnWebACL.DefaultActionProperty.builder().allow(CfnWebACL.AllowActionProperty.builder().build()).build())
            .visibilityConfig(visibility(policy.name()))
            .rules(rules)
            .build());
    }

    private CfnWebACL.RuleProperty toRuleProperty(FirewallRule rule) {
        var builder = CfnWebACL.RuleProperty.builder()
            .name(rule.name())
            .priority(rule.priority())
            .visibilityConfig(visibility(rule.metricName()));
        if (rule.isManaged()) {
            return builder
                .overrideAction(rule.overrideAction() == OverrideAction.COUNT
                    ? CfnWebACL.OverrideActionProperty.builder().count(Map.of()).build()
                    : CfnWebACL.OverrideActionProperty.builder().none(Map.of()).build())
                .statement(CfnWebACL.StatementProperty.builder()
                    .managedRuleGroupStatement(CfnWebACL.ManagedRuleGroupStatementProperty.builder()
                        .vendorName(rule.managedRuleGroup().vendorName())
                        .name(rule.managedRuleGroup().name())
                        .build())
                    .build())
                .build();
        }
        var action = CfnWebACL.RuleActionProperty.builder();
        switch (rule.action()) {
            case BLOCK:
                action.block(CfnWebACL.BlockActionProperty.builder().build());
                break;
            case ALLOW:
                action.allow(CfnWebACL.AllowActionProperty.builder().build());
                break;
            default:
                action.count(CfnWebACL.CountActionProperty.builder().build());
        }
        return builder
            .action(action.build())
            .statement(toStatement(rule.statement()))
            .build();
    }

    private static CfnWebACL.StatementProperty toStatement(MatchStatement statement) {
        if (statement instanceof NotStatement) {
            return CfnWebACL.StatementProperty.builder()
                .notStatement(CfnWebACL.NotStatementProperty.builder()
                    .statement(toStatement(((NotStatement) statement).statement()))
                    .build())
                .build();
        }
        if (statement instanceof GeoMatchStatement) {
            return CfnWebACL.StatementProperty.builder()
                .geoMatchStatement(CfnWebACL.GeoMatchStatementProperty.builder()
                    .countryCodes(((GeoMatchStatement) statement).countryCodes())
                    .build())
                .build();
        }
        throw new IllegalArgumentException("Unsupported statement " + statement.getClass().getSimpleName());
    }

    private static CfnWebACL.VisibilityConfigProperty visibility(String metricName) {
        return CfnWebACL.VisibilityConfigProperty.builder()
            .cloudWatchMetricsEnabled(true)
            .sampledRequestsEnabled(true)
            .metricName(metricName)
            .build();
    }

    private void enableAccessLogs(TopologyConfig config, ApplicationLoadBalancedEc2Service service) {
        var logs = new Bucket(this, LogicalIds.ACCESS_LOGS_BUCKET, BucketProps.builder()
            .objectOwnership(ObjectOwnership.OBJECT_WRITER) // ALB log delivery writes with an ACL
            .lifecycleRules(List.of(LifecycleRule.builder()
                .enabled(true)
                .expiration(Duration.days(config.accessLogRetentionDays()))
                .build()))
            .blockPublicAccess(BlockPublicAccess.BLOCK_ALL)
            .enforceSsl(true)
            .build());

        var deliveryPrincipal = new ArnPrincipal("arn:aws:iam::" + config.logDeliveryAccount().orElseThrow() + ":root");
        logs.addToResourcePolicy(new PolicyStatement(PolicyStatementProps.builder()
            .sid("AWSLogDeliveryWrite")
            .effect(Effect.ALLOW)
            .principals(List.of(deliveryPrincipal))
            .actions(List.of("s3:PutObject"))
            .resources(List.of(
                logs.getBucketArn() + "/" + TopologyAssembler.ACCESS_LOG_PREFIX + "/AWSLogs/" + getAccount() + "/*"))
            .conditions(Map.of("StringEquals", Map.of("s3:x-amz-acl", "bucket-owner-full-control")))
            .build()));
        logs.addToResourcePolicy(new PolicyStatement(PolicyStatementProps.builder()
            .sid("AWSLogDeliveryCheck")
            .effect(Effect.ALLOW)
            .principals(List.of(deliveryPrincipal))
            .actions(List.of("s3:GetBucketAcl"))
            .resources(List.of(logs.getBucketArn()))
            .build()));

        var loadBalancer = service.getLoadBalancer();
        loadBalancer.setAttribute("access_logs.s3.enabled", "true");
        loadBalancer.setAttribute("access_logs.s3.bucket", logs.getBucketName());
        loadBalancer.setAttribute("access_logs.s3.prefix", TopologyAssembler.ACCESS_LOG_PREFIX);
        // ELB checks bucket permissions when the attribute is set
        if (logs.getPolicy() != null) {
            loadBalancer.getNode().addDependency(logs.getPolicy());
        }
    }

    private void createAlarms(TopologyConfig config, List<AlarmRule> rules, ApplicationLoadBalancedEc2Service service) {
        var topic = new Topic(this, LogicalIds.ALERTS_TOPIC, TopicProps.builder().build());
        if (config.notifyEmail() != null) {
            topic.addSubscription(new EmailSubscription(config.notifyEmail()));
        }
        attributes.put(LogicalIds.ALERTS_TOPIC + ".TopicArn", topic.getTopicArn());

        for (var rule : rules) {
            new Alarm(this, rule.name(), AlarmProps.builder()
                .metric(this.alarmMetric(rule, service))
                .threshold(rule.threshold())
                .evaluationPeriods(rule.evaluationPeriods())
                .datapointsToAlarm(rule.datapointsToAlarm())
                .comparisonOperator(ComparisonOperator.valueOf(rule.comparisonOperator().name()))
                .alarmDescription(rule.description())
                .build())
                .addAlarmAction(new SnsAction(topic));
        }
    }

    private IMetric alarmMetric(AlarmRule rule, ApplicationLoadBalancedEc2Service service) {
        var dimensions = new HashMap<String, String>();
        dimensions.put("LoadBalancer", service.getLoadBalancer().getLoadBalancerFullName());
        if (rule.metric().isTargetGroupScoped()) {
            dimensions.put("TargetGroup", service.getTargetGroup().getTargetGroupFullName());
        }
        return new Metric(MetricProps.builder()
            .namespace(LoadBalancerMetric.NAMESPACE)
            .metricName(rule.metric().getMetricName())
            .dimensionsMap(dimensions)
            .statistic(rule.statistic())
            .period(Duration.seconds(rule.periodSeconds()))
            .build());
    }

    private void createDashboard(DeploymentTopology topology, ApplicationLoadBalancedEc2Service service) {
        var dashboard = new Dashboard(this, LogicalIds.DASHBOARD, DashboardProps.builder()
            .dashboardName(topology.config().dashboardName())
            .build());
        var widgets = new ArrayList<IWidget>();
        for (var widget : topology.dashboardWidgets()) {
            var left = new ArrayList<IMetric>();
            widget.left().forEach(metric -> left.add(this.dashboardMetric(metric, service)));
            var right = new ArrayList<IMetric>();
            widget.right().forEach(metric -> right.add(this.dashboardMetric(metric, service)));
            widgets.add(new GraphWidget(GraphWidgetProps.builder()
                .title(widget.title())
                .left(left)
                .right(right)
                .build()));
        }
        dashboard.addWidgets(widgets.toArray(new IWidget[0]));
    }

    private IMetric dashboardMetric(DashboardMetric metric, ApplicationLoadBalancedEc2Service service) {
        var perMinute = Duration.minutes(1);
        var targetGroup = service.getTargetGroup();
        var loadBalancer = service.getLoadBalancer();
        switch (metric) {
            case SERVICE_CPU:
                return service.getService().metricCpuUtilization(options("Average", perMinute));
            case REQUEST_COUNT:
                return loadBalancer.metricRequestCount(options("Sum", perMinute));
            case HEALTHY_HOSTS:
                return targetGroup.metricHealthyHostCount(options("Average", perMinute));
            case UNHEALTHY_HOSTS:
                return targetGroup.metricUnhealthyHostCount(options("Average", perMinute));
            case RESPONSE_TIME_P50:
                return targetGroup.metricTargetResponseTime(options("p50", perMinute));
            case RESPONSE_TIME_P95:
                return targetGroup.metricTargetResponseTime(options("p95", perMinute));
            case TARGET_5XX:
                return loadBalancerMetric("HTTPCode_Target_5XX_Count", Map.of(
                    "TargetGroup", targetGroup.getTargetGroupFullName(),
                    "LoadBalancer", loadBalancer.getLoadBalancerFullName()));
            case ELB_5XX:
                return loadBalancerMetric("HTTPCode_ELB_5XX_Count", Map.of(
                    "LoadBalancer", loadBalancer.getLoadBalancerFullName()));
            case WAF_BLOCKED:
                return new Metric(MetricProps.builder()
                    .namespace("AWS/WAFV2")
                    .metricName("BlockedRequests")
                    .dimensionsMap(Map.of("ResourceArn", loadBalancer.getLoadBalancerArn()))
                    .statistic("Sum")
                    .period(Duration.minutes(5))
                    .build());
            default:
                throw new IllegalArgumentException("Unknown dashboard metric " + metric);
        }
    }

    private static MetricOptions options(String statistic, Duration period) {
        return MetricOptions.builder()
            .statistic(statistic)
            .period(period)
            .build();
    }

    private static Metric loadBalancerMetric(String metricName, Map<String, String> dimensions) {
        return new Metric(MetricProps.builder()
            .namespace(LoadBalancerMetric.NAMESPACE)
            .metricName(metricName)
            .dimensionsMap(dimensions)
            .statistic("Sum")
            .period(Duration.minutes(1))
            .build());
    }

    private void createAliasRecord(TopologyConfig config, IHostedZone zone, ApplicationLoadBalancedEc2Service service) {
        var record = new ARecord(this, LogicalIds.ALIAS_RECORD, ARecordProps.builder()
            .zone(zone)
            .recordName(config.subdomain())
            .target(RecordTarget.fromAlias(new LoadBalancerTarget(service.getLoadBalancer())))
            .build());
        // Explicit even though the alias target already implies it
        record.getNode().addDependency(service.getLoadBalancer());
        var scheme = config.enableHttps() ? "https://" : "http://";
        attributes.put(LogicalIds.ALIAS_RECORD + ".Url", scheme + config.fqdn().orElseThrow());
    }

    private void createOutputs(DeploymentTopology topology) {
        topology.graph().getOutputs().forEach((name, ref) -> {
            var value = attributes.get(ref.key());
            if (value == null) {
                throw new IllegalStateException("No construct provides " + ref.key() + " for output " + name);
            }
            new CfnOutput(this, name, CfnOutputProps.builder()
                .value(value)
                .description(ref.description())
                .build());
        });
    }
}
