package com.chatui.topology.alarm;

import java.util.ArrayDeque;
import java.util.Deque;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * State of one {@link AlarmRule} as samples arrive.
 * <p>
 * The channel hears about transitions into ALARM only; staying in ALARM
 * while more breaching samples arrive does not notify again.
 */
public class AlarmEvaluator {
    private static final Logger LOG = LogManager.getLogger(AlarmEvaluator.class);

    private final AlarmRule rule;
    private final NotificationChannel channel;
    private final Deque<Boolean> window = new ArrayDeque<>();
    private AlarmState state = AlarmState.INSUFFICIENT_DATA;

    public AlarmEvaluator(AlarmRule rule, NotificationChannel channel) {
        this.rule = rule;
        this.channel = channel;
    }

    public AlarmState record(double value) {
        window.addLast(rule.comparisonOperator().breaches(value, rule.threshold()));
        if (window.size() > rule.evaluationPeriods()) {
            window.removeFirst();
        }

        var breaching = window.stream().filter(Boolean::booleanValue).count();
        AlarmState next;
        if (breaching >= rule.datapointsToAlarm()) {
            next = AlarmState.ALARM;
        } else if (window.size() == rule.evaluationPeriods()) {
            next = AlarmState.OK;
        } else {
            next = AlarmState.INSUFFICIENT_DATA;
        }

        var previous = state;
        state = next;
        if (previous != AlarmState.ALARM && next == AlarmState.ALARM) {
            LOG.warn("alarm - {} - {} -> ALARM at {}", rule.name(), previous, value);
            channel.deliver(new AlarmNotification(rule.name(), rule.description(), previous, next, value));
        }
        return state;
    }

    public AlarmState state() {
        return state;
    }
}
