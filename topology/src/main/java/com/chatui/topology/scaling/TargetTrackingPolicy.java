package com.chatui.topology.scaling;

import java.time.Instant;
import java.util.Optional;

/**
 * Keeps a metric near {@code targetValue} by sizing capacity proportionally.
 */
public record TargetTrackingPolicy(
    String name,
    String metric,
    double targetValue,
    int scaleInCooldownSeconds,
    int scaleOutCooldownSeconds
) {

    public Optional<ScalingAction> evaluate(double metricValue, int currentCapacity, Instant at) {
        var desired = (int) Math.ceil(currentCapacity * metricValue / targetValue);
        if (desired == currentCapacity) {
            return Optional.empty();
        }
        var cooldown = desired < currentCapacity ? scaleInCooldownSeconds : scaleOutCooldownSeconds;
        return Optional.of(new ScalingAction(name, desired, at, cooldown));
    }
}
