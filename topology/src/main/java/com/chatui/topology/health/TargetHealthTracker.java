package com.chatui.topology.health;

/**
 * Health of one registered target, driven by consecutive probe outcomes.
 */
public class TargetHealthTracker {

    public enum State {
        INITIAL,
        HEALTHY,
        UNHEALTHY
    }

    /**
     * @param statusCode    HTTP status, ignored when {@code timedOut}
     * @param latencyMillis time to the response
     */
    public record Probe(int statusCode, long latencyMillis, boolean timedOut) {

        public static Probe response(int statusCode, long latencyMillis) {
            return new Probe(statusCode, latencyMillis, false);
        }

        public static Probe timeout() {
            return new Probe(0, 0, true);
        }
    }

    private final HealthCheckPolicy policy;
    private State state = State.INITIAL;
    private int successes;
    private int failures;

    public TargetHealthTracker(HealthCheckPolicy policy) {
        this.policy = policy;
    }

    public State record(Probe probe) {
        if (isSuccess(probe)) {
            successes++;
            failures = 0;
            if (state != State.HEALTHY && successes >= policy.healthyThresholdCount()) {
                state = State.HEALTHY;
            }
        } else {
            failures++;
            successes = 0;
            if (state != State.UNHEALTHY && failures >= policy.unhealthyThresholdCount()) {
                state = State.UNHEALTHY;
            }
        }
        return state;
    }

    public State state() {
        return state;
    }

    public boolean isSuccess(Probe probe) {
        return !probe.timedOut()
            && probe.latencyMillis() < policy.timeoutSeconds() * 1000L
            && policy.healthyHttpCodes().matches(probe.statusCode());
    }
}
