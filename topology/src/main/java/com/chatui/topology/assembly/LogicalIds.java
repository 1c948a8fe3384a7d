package com.chatui.topology.assembly;

// Construct ids shared by the graph and the CDK stack
public final class LogicalIds {
    public static final String VPC = "Vpc";
    public static final String CLUSTER = "EcsCluster";
    public static final String AUTO_SCALING_GROUP = "Ec2Asg";
    public static final String CAPACITY_PROVIDER = "AsgCapacityProvider";
    public static final String KNOWLEDGE_BUCKET = "KnowledgeBucket";
    public static final String CONTAINER_IMAGE = "ContainerImage";
    public static final String HOSTED_ZONE = "HostedZone";
    public static final String CERTIFICATE = "AlbCert";
    public static final String SERVICE = "ChatUiService";
    public static final String LOAD_BALANCER = "LoadBalancer";
    public static final String TARGET_GROUP = "TargetGroup";
    public static final String INGRESS_RULE = "AlbToTasksIngress";
    public static final String EGRESS_RULE = "AlbToTasksEgress";
    public static final String TASK_SCALING = "TaskScaling";
    public static final String CPU_SCALING = "CpuScaling";
    public static final String REQUEST_SCALING = "RequestScaling";
    public static final String WEB_ACL = "WebAcl";
    public static final String WEB_ACL_ASSOCIATION = "WebAclAssoc";
    public static final String ACCESS_LOGS_BUCKET = "AlbAccessLogs";
    public static final String ALERTS_TOPIC = "AlertsTopic";
    public static final String ALERTS_SUBSCRIPTION = "AlertsEmailSubscription";
    public static final String DASHBOARD = "Dashboard";
    public static final String ALIAS_RECORD = "AliasRecord";

    public static final String OUTPUT_LOAD_BALANCER_DNS = "LoadBalancerDNS";
    public static final String OUTPUT_CLUSTER_NAME = "ClusterName";
    public static final String OUTPUT_BUCKET_NAME = "KnowledgeBucketName";
    public static final String OUTPUT_ALERTS_TOPIC = "AlertsSnsTopicArn";
    public static final String OUTPUT_SERVICE_URL = "ServiceUrl";

    private LogicalIds() {
    }

    public static String secret(String logicalName) {
        return "Secret-" + logicalName;
    }
}
