package com.chatui.topology.scaling;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Replica bounds of the service plus the policies that move it inside them.
 * {@code requestRate} is null when request-rate scaling is off.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AutoscalingPolicy(
    int minReplicas,
    int maxReplicas,
    TargetTrackingPolicy cpu,
    StepScalingPolicy requestRate
) {

    public int clamp(int capacity) {
        return Math.max(minReplicas, Math.min(maxReplicas, capacity));
    }
}
