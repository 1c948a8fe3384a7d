package com.chatui.topology.scaling;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Changes capacity by the delta of the interval that contains the metric.
 * <p>
 * Configured steps are turned into a partition of the real line: the open
 * ends and any gap between steps change nothing, overlapping steps are
 * rejected. Bounds are absolute metric values, as CDK's {@code ScalingInterval}.
 */
public final class StepScalingPolicy {
    private final String name;
    private final String metric;
    private final List<ScalingInterval> steps;
    private final int cooldownSeconds;
    private final List<ScalingInterval> intervals;

    private StepScalingPolicy(
        String name,
        String metric,
        List<ScalingInterval> steps,
        int cooldownSeconds,
        List<ScalingInterval> intervals) {
            this.name = name;
            this.metric = metric;
            this.steps = List.copyOf(steps);
            this.cooldownSeconds = cooldownSeconds;
            this.intervals = List.copyOf(intervals);
    }

    public static StepScalingPolicy of(
        String name,
        String metric,
        List<ScalingInterval> steps,
        int cooldownSeconds) throws ConfigurationException {
            return new StepScalingPolicy(name, metric, steps, cooldownSeconds, partition(steps));
    }

    public String getName() {
        return name;
    }

    public String getMetric() {
        return metric;
    }

    public List<ScalingInterval> getSteps() {
        return steps;
    }

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    @JsonIgnore
    public List<ScalingInterval> getIntervals() {
        return intervals;
    }

    public ScalingInterval intervalFor(double metricValue) {
        return intervals.stream()
            .filter(interval -> interval.contains(metricValue))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No interval contains " + metricValue));
    }

    public Optional<ScalingAction> evaluate(double metricValue, int currentCapacity, Instant at) {
        var change = intervalFor(metricValue).change();
        if (change == 0) {
            return Optional.empty();
        }
        return Optional.of(new ScalingAction(name, currentCapacity + change, at, cooldownSeconds));
    }

    static List<ScalingInterval> partition(List<ScalingInterval> steps) throws ConfigurationException {
        // Application Auto Scaling wants a scale-in and a scale-out side
        if (steps.size() < 2) {
            throw invalid("fewer than two steps");
        }
        var sorted = new ArrayList<>(steps);
        sorted.sort(Comparator.comparingDouble(ScalingInterval::lowerOrMin));

        // A step with only a lower bound ends where the next one starts
        var bounded = new ArrayList<ScalingInterval>();
        for (int i = 0; i < sorted.size(); i++) {
            var step = sorted.get(i);
            if (step.lower() == null && i > 0) {
                throw invalid("more than one step without a lower bound");
            }
            var upper = step.upper() != null
                ? step.upperOrMax()
                : i + 1 < sorted.size() ? sorted.get(i + 1).lowerOrMin() : Double.POSITIVE_INFINITY;
            if (step.lowerOrMin() >= upper) {
                throw invalid("empty step at " + step.lowerOrMin());
            }
            bounded.add(new ScalingInterval(step.lowerOrMin(), upper, step.change()));
        }

        var result = new ArrayList<ScalingInterval>();
        var cursor = Double.NEGATIVE_INFINITY;
        for (var step : bounded) {
            if (step.lower() < cursor) {
                throw invalid("steps overlap at " + step.lower());
            }
            if (step.lower() > cursor) {
                result.add(new ScalingInterval(cursor, step.lower(), 0));
            }
            result.add(step);
            cursor = step.upper();
        }
        if (cursor < Double.POSITIVE_INFINITY) {
            result.add(new ScalingInterval(cursor, Double.POSITIVE_INFINITY, 0));
        }
        return result;
    }

    private static ConfigurationException invalid(String detail) {
        return new ConfigurationException(ConfigurationError.INVALID_SCALING_STEPS, "requestScalingSteps", detail);
    }
}
