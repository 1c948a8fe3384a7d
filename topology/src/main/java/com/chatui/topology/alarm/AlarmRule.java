package com.chatui.topology.alarm;

import java.util.List;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;

/**
 * Threshold alarm over a load balancer metric, published to the alerts topic.
 * Fires when {@code datapointsToAlarm} of the last {@code evaluationPeriods}
 * samples breach.
 */
public record AlarmRule(
    String name,
    LoadBalancerMetric metric,
    String statistic,
    int periodSeconds,
    double threshold,
    int evaluationPeriods,
    int datapointsToAlarm,
    ComparisonOperator comparisonOperator,
    String description
) {

    public static List<AlarmRule> defaults() {
        return List.of(
            new AlarmRule("HighP95Latency", LoadBalancerMetric.TARGET_RESPONSE_TIME, "p95", 60, 1.0, 3, 2,
                ComparisonOperator.GREATER_THAN_THRESHOLD, "p95 target response time > 1s"),
            new AlarmRule("UnhealthyHostsAlarm", LoadBalancerMetric.UNHEALTHY_HOST_COUNT, "Average", 60, 0.5, 2, 1,
                ComparisonOperator.GREATER_THAN_THRESHOLD, "Any target becomes unhealthy"),
            new AlarmRule("Target5XXAlarm", LoadBalancerMetric.TARGET_5XX_COUNT, "Sum", 60, 5, 3, 2,
                ComparisonOperator.GREATER_THAN_THRESHOLD, "Target group returning 5xx errors"),
            new AlarmRule("Elb5XXAlarm", LoadBalancerMetric.ELB_5XX_COUNT, "Sum", 60, 5, 3, 2,
                ComparisonOperator.GREATER_THAN_THRESHOLD, "ALB (frontend) returning 5xx errors"));
    }

    public void validate() throws ConfigurationException {
        if (evaluationPeriods < 1 || datapointsToAlarm < 1 || datapointsToAlarm > evaluationPeriods) {
            throw new ConfigurationException(
                ConfigurationError.INVALID_ALARM, "alarms." + name, datapointsToAlarm + "/" + evaluationPeriods);
        }
        if (periodSeconds < 10) {
            throw new ConfigurationException(ConfigurationError.OUT_OF_RANGE, "alarms." + name + ".periodSeconds");
        }
    }
}
