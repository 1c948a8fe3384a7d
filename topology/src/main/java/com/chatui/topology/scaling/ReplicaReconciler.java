package com.chatui.topology.scaling;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Replica count as the ECS scheduler settles it when several policies fire.
 * <p>
 * The most recently fired action governs: its desired capacity replaces the
 * current one (clamped to the policy bounds). Deltas from different policies
 * are never added together. An action is dropped when it is older than the
 * governing one, or when its own policy is still cooling down.
 */
public class ReplicaReconciler {
    private static final Logger LOG = LogManager.getLogger(ReplicaReconciler.class);

    private final AutoscalingPolicy policy;
    private final Map<String, ScalingAction> lastByPolicy = new HashMap<>();
    private ScalingAction governing;
    private int capacity;

    public ReplicaReconciler(AutoscalingPolicy policy, int initialCapacity) {
        this.policy = policy;
        this.capacity = policy.clamp(initialCapacity);
    }

    public boolean apply(ScalingAction action) {
        if (governing != null && action.firedAt().isBefore(governing.firedAt())) {
            LOG.debug("scaling - {} - stale action ignored", action.policyName());
            return false;
        }
        var previous = lastByPolicy.get(action.policyName());
        if (previous != null && action.firedAt().isBefore(previous.cooldownEnd())) {
            LOG.debug("scaling - {} - cooling down until {}", action.policyName(), previous.cooldownEnd());
            return false;
        }
        var next = policy.clamp(action.desiredCapacity());
        LOG.info("scaling - {} - {} -> {} replicas", action.policyName(), capacity, next);
        this.capacity = next;
        this.governing = action;
        this.lastByPolicy.put(action.policyName(), action);
        return true;
    }

    public int applyAll(Collection<ScalingAction> actions) {
        var ordered = new ArrayList<>(actions);
        ordered.sort(Comparator.comparing(ScalingAction::firedAt));
        ordered.forEach(this::apply);
        return capacity;
    }

    public int capacity() {
        return capacity;
    }

    public Optional<ScalingAction> governing() {
        return Optional.ofNullable(governing);
    }
}
