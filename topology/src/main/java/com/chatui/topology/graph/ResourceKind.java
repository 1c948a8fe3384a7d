package com.chatui.topology.graph;

public enum ResourceKind {
    NETWORK,
    CLUSTER,
    COMPUTE_POOL,
    CAPACITY_BINDING,
    STORAGE_BUCKET,
    SECRET_REF(true),
    CONTAINER_IMAGE(true),
    DNS_ZONE(true),
    CERTIFICATE,
    LOAD_BALANCER,
    TARGET_GROUP,
    SERVICE_DEPLOYMENT,
    SECURITY_RULE,
    AUTOSCALING_TARGET,
    AUTOSCALING_POLICY,
    FIREWALL_POLICY,
    FIREWALL_ASSOCIATION,
    LOG_BUCKET,
    NOTIFICATION_CHANNEL,
    NOTIFICATION_SUBSCRIPTION,
    ALARM,
    DASHBOARD,
    DNS_RECORD;

    private final boolean lookupOnly;

    ResourceKind() {
        this(false);
    }

    ResourceKind(boolean lookupOnly) {
        this.lookupOnly = lookupOnly;
    }

    // Referenced by the stack, never created or destroyed by it
    public boolean isLookupOnly() {
        return lookupOnly;
    }
}
