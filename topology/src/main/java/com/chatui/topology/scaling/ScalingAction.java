package com.chatui.topology.scaling;

import java.time.Instant;

/**
 * A capacity a policy asked for. {@code desiredCapacity} is computed from the
 * capacity the policy observed, not from other policies' requests.
 */
public record ScalingAction(String policyName, int desiredCapacity, Instant firedAt, int cooldownSeconds) {

    public Instant cooldownEnd() {
        return firedAt.plusSeconds(cooldownSeconds);
    }
}
