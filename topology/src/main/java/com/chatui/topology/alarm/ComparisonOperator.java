package com.chatui.topology.alarm;

public enum ComparisonOperator {
    GREATER_THAN_THRESHOLD,
    GREATER_THAN_OR_EQUAL_TO_THRESHOLD,
    LESS_THAN_THRESHOLD,
    LESS_THAN_OR_EQUAL_TO_THRESHOLD;

    public boolean breaches(double value, double threshold) {
        switch (this) {
            case GREATER_THAN_THRESHOLD:
                return value > threshold;
            case GREATER_THAN_OR_EQUAL_TO_THRESHOLD:
                return value >= threshold;
            case LESS_THAN_THRESHOLD:
                return value < threshold;
            default:
                return value <= threshold;
        }
    }
}
