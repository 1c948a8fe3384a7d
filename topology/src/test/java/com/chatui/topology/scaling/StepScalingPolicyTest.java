package com.chatui.topology.scaling;

import java.time.Instant;
import java.util.List;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StepScalingPolicyTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static StepScalingPolicy requestRate() throws ConfigurationException {
        return StepScalingPolicy.of("RequestScaling", "RequestCountPerTarget", List.of(
            ScalingInterval.below(50, -1),
            ScalingInterval.atOrAbove(100, 1),
            ScalingInterval.atOrAbove(200, 2)), 60);
    }

    @Test
    void everyMetricValueFallsInExactlyOneInterval() throws ConfigurationException {
        var policy = requestRate();
        assertEquals(4, policy.getIntervals().size());
        for (var metric : new double[] { -5, 0, 49.9, 50, 99, 100, 199.9, 200, 1e9 }) {
            var matching = policy.getIntervals().stream().filter(interval -> interval.contains(metric)).count();
            assertEquals(1, matching, "metric " + metric);
        }
    }

    @Test
    void changeByInterval() throws ConfigurationException {
        var policy = requestRate();
        assertEquals(-1, policy.intervalFor(10).change());
        assertEquals(0, policy.intervalFor(50).change());
        assertEquals(0, policy.intervalFor(75).change());
        assertEquals(1, policy.intervalFor(100).change());
        assertEquals(1, policy.intervalFor(150).change());
        assertEquals(2, policy.intervalFor(200).change());
        assertEquals(2, policy.intervalFor(5000).change());
    }

    @Test
    void noActionInsideTheGap() throws ConfigurationException {
        assertTrue(requestRate().evaluate(75, 3, NOW).isEmpty());
    }

    @Test
    void actionCarriesTheCooldown() throws ConfigurationException {
        var action = requestRate().evaluate(250, 3, NOW).orElseThrow();
        assertEquals("RequestScaling", action.policyName());
        assertEquals(5, action.desiredCapacity());
        assertEquals(NOW.plusSeconds(60), action.cooldownEnd());
    }

    @Test
    void rejectsASingleStep() {
        var e = assertThrows(ConfigurationException.class, () -> StepScalingPolicy.of(
            "RequestScaling", "RequestCountPerTarget", List.of(ScalingInterval.atOrAbove(100, 1)), 60));
        assertEquals(ConfigurationError.INVALID_SCALING_STEPS, e.getError());
        assertEquals("requestScalingSteps", e.getField());
    }

    @Test
    void rejectsOverlappingSteps() {
        assertThrows(ConfigurationException.class, () -> StepScalingPolicy.of("p", "m", List.of(
            ScalingInterval.between(0, 100, 1),
            ScalingInterval.between(50, 150, 2)), 60));
    }

    @Test
    void rejectsTwoStepsOpenBelow() {
        assertThrows(ConfigurationException.class, () -> StepScalingPolicy.of("p", "m", List.of(
            ScalingInterval.below(10, -1),
            ScalingInterval.below(20, -2)), 60));
    }

    @Test
    void rejectsEmptySteps() {
        assertThrows(ConfigurationException.class, () -> StepScalingPolicy.of("p", "m", List.of(
            ScalingInterval.below(10, -1),
            ScalingInterval.between(30, 30, 1)), 60));
    }

    @Test
    void keepsTheConfiguredSteps() throws ConfigurationException {
        var policy = requestRate();
        assertEquals(ScalingInterval.below(50, -1), policy.getSteps().get(0));
        assertEquals(60, policy.getCooldownSeconds());
    }
}
