package com.chatui.topology.alarm;

// ALB metrics the alarms watch
public enum LoadBalancerMetric {
    TARGET_RESPONSE_TIME("TargetResponseTime", true),
    UNHEALTHY_HOST_COUNT("UnHealthyHostCount", true),
    TARGET_5XX_COUNT("HTTPCode_Target_5XX_Count", true),
    ELB_5XX_COUNT("HTTPCode_ELB_5XX_Count", false);

    public static final String NAMESPACE = "AWS/ApplicationELB";

    private final String metricName;
    private final boolean targetGroupScoped;

    LoadBalancerMetric(String metricName, boolean targetGroupScoped) {
        this.metricName = metricName;
        this.targetGroupScoped = targetGroupScoped;
    }

    public String getMetricName() {
        return metricName;
    }

    // Needs the TargetGroup dimension in addition to LoadBalancer
    public boolean isTargetGroupScoped() {
        return targetGroupScoped;
    }
}
