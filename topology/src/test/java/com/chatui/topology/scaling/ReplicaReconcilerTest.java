package com.chatui.topology.scaling;

import java.time.Instant;
import java.util.List;

import com.chatui.topology.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReplicaReconcilerTest {
    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private AutoscalingPolicy policy;

    @BeforeEach
    void setUp() throws ConfigurationException {
        var cpu = new TargetTrackingPolicy("CpuScaling", "CPUUtilization", 30, 60, 60);
        var requestRate = StepScalingPolicy.of("RequestScaling", "RequestCountPerTarget", List.of(
            ScalingInterval.below(50, -1),
            ScalingInterval.atOrAbove(100, 1),
            ScalingInterval.atOrAbove(200, 2)), 60);
        policy = new AutoscalingPolicy(1, 6, cpu, requestRate);
    }

    @Test
    void targetTrackingSizesProportionally() {
        var action = policy.cpu().evaluate(10, 2, T0).orElseThrow();
        assertEquals(1, action.desiredCapacity());
        assertEquals(4, policy.cpu().evaluate(60, 2, T0).orElseThrow().desiredCapacity());
        assertTrue(policy.cpu().evaluate(30, 2, T0).isEmpty());
    }

    @Test
    void latestActionWinsOverAnEarlierOne() {
        // Both policies observed two replicas
        var cpuAction = policy.cpu().evaluate(10, 2, T0).orElseThrow();
        var requestAction = policy.requestRate().evaluate(150, 2, T0.plusSeconds(5)).orElseThrow();
        assertEquals(1, cpuAction.desiredCapacity());
        assertEquals(3, requestAction.desiredCapacity());

        var reconciler = new ReplicaReconciler(policy, 2);
        var capacity = reconciler.applyAll(List.of(requestAction, cpuAction));

        assertEquals(3, capacity);
        assertNotEquals(2, capacity);
        assertEquals("RequestScaling", reconciler.governing().orElseThrow().policyName());
    }

    @Test
    void orderOfFiringDecides() {
        var requestAction = policy.requestRate().evaluate(150, 2, T0).orElseThrow();
        var cpuAction = policy.cpu().evaluate(10, 2, T0.plusSeconds(5)).orElseThrow();

        var reconciler = new ReplicaReconciler(policy, 2);
        assertEquals(1, reconciler.applyAll(List.of(cpuAction, requestAction)));
        assertEquals("CpuScaling", reconciler.governing().orElseThrow().policyName());
    }

    @Test
    void capacityStaysWithinBounds() {
        var reconciler = new ReplicaReconciler(policy, 2);
        reconciler.apply(new ScalingAction("CpuScaling", 12, T0, 60));
        assertEquals(6, reconciler.capacity());
        reconciler.apply(new ScalingAction("RequestScaling", 0, T0.plusSeconds(1), 60));
        assertEquals(1, reconciler.capacity());
        assertEquals(6, new ReplicaReconciler(policy, 40).capacity());
    }

    @Test
    void policyIsQuietDuringItsCooldown() {
        var reconciler = new ReplicaReconciler(policy, 2);
        assertTrue(reconciler.apply(new ScalingAction("RequestScaling", 3, T0, 60)));
        assertFalse(reconciler.apply(new ScalingAction("RequestScaling", 4, T0.plusSeconds(30), 60)));
        assertEquals(3, reconciler.capacity());
        assertTrue(reconciler.apply(new ScalingAction("RequestScaling", 4, T0.plusSeconds(60), 60)));
        assertEquals(4, reconciler.capacity());
    }

    @Test
    void otherPoliciesAreNotBlockedByACooldown() {
        var reconciler = new ReplicaReconciler(policy, 2);
        reconciler.apply(new ScalingAction("RequestScaling", 4, T0, 60));
        assertTrue(reconciler.apply(new ScalingAction("CpuScaling", 2, T0.plusSeconds(10), 60)));
        assertEquals(2, reconciler.capacity());
    }

    @Test
    void staleActionsAreDropped() {
        var reconciler = new ReplicaReconciler(policy, 2);
        reconciler.apply(new ScalingAction("CpuScaling", 5, T0.plusSeconds(10), 60));
        assertFalse(reconciler.apply(new ScalingAction("RequestScaling", 3, T0, 60)));
        assertEquals(5, reconciler.capacity());
    }
}
