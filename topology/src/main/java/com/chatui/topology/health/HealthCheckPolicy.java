package com.chatui.topology.health;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;

/**
 * How the load balancer decides a task is fit for traffic, and the timing
 * attributes that go with it.
 *
 * @param port                       {@code traffic-port} or a fixed port
 * @param deregistrationDelaySeconds time a draining target keeps in-flight requests
 * @param idleTimeoutSeconds         load balancer connection idle timeout
 * @param gracePeriodSeconds         time after task start when failed checks are ignored
 */
public record HealthCheckPolicy(
    String path,
    String port,
    HealthyHttpCodes healthyHttpCodes,
    int intervalSeconds,
    int timeoutSeconds,
    int healthyThresholdCount,
    int unhealthyThresholdCount,
    int deregistrationDelaySeconds,
    int idleTimeoutSeconds,
    int gracePeriodSeconds
) {
    public static final String TRAFFIC_PORT = "traffic-port";

    public static HealthCheckPolicy defaults() throws ConfigurationException {
        var policy = new HealthCheckPolicy(
            "/",
            TRAFFIC_PORT,
            HealthyHttpCodes.parse("200-399"),
            30,
            20, // Chat UIs render server side, keep well under the interval
            2,
            5,
            30,
            120,
            120);
        policy.validate();
        return policy;
    }

    public void validate() throws ConfigurationException {
        if (path == null || !path.startsWith("/")) {
            throw new ConfigurationException(ConfigurationError.INVALID_HEALTH_CHECK, "healthCheck.path", path);
        }
        if (timeoutSeconds < 2 || timeoutSeconds >= intervalSeconds) {
            throw new ConfigurationException(
                ConfigurationError.INVALID_HEALTH_CHECK,
                "healthCheck.timeoutSeconds",
                timeoutSeconds + "s >= " + intervalSeconds + "s");
        }
        if (healthyThresholdCount < 2 || unhealthyThresholdCount < 2) {
            throw new ConfigurationException(ConfigurationError.OUT_OF_RANGE, "healthCheck.thresholdCount");
        }
    }
}
