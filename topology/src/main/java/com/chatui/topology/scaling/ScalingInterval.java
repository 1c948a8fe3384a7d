package com.chatui.topology.scaling;

/**
 * One step of a step-scaling policy: when the metric falls in
 * {@code [lower, upper)} the capacity changes by {@code change}.
 * A missing bound is open.
 */
public record ScalingInterval(Double lower, Double upper, int change) {

    public static ScalingInterval below(double upper, int change) {
        return new ScalingInterval(null, upper, change);
    }

    public static ScalingInterval atOrAbove(double lower, int change) {
        return new ScalingInterval(lower, null, change);
    }

    public static ScalingInterval between(double lower, double upper, int change) {
        return new ScalingInterval(lower, upper, change);
    }

    public boolean contains(double metric) {
        var aboveLower = lower == null || metric >= lower;
        var belowUpper = upper == null || metric < upper;
        return aboveLower && belowUpper;
    }

    double lowerOrMin() {
        return lower == null ? Double.NEGATIVE_INFINITY : lower;
    }

    double upperOrMax() {
        return upper == null ? Double.POSITIVE_INFINITY : upper;
    }
}
