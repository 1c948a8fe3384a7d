package com.chatui.topology.assembly;

public enum DashboardMetric {
    SERVICE_CPU,
    REQUEST_COUNT,
    HEALTHY_HOSTS,
    UNHEALTHY_HOSTS,
    RESPONSE_TIME_P50,
    RESPONSE_TIME_P95,
    TARGET_5XX,
    ELB_5XX,
    WAF_BLOCKED
}
